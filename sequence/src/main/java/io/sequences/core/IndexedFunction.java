package io.sequences.core;

/**
 * Maps an element, given its position, to a new value.
 */
@FunctionalInterface
public interface IndexedFunction<T, U> {
    U apply(T value, int index);
}
