package io.sequences.core;

/**
 * Folds one element into an accumulator.
 */
@FunctionalInterface
public interface IndexedReducer<A, T> {
    A apply(A accumulator, T value, int index);
}
