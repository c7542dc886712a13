package io.sequences.core;

@FunctionalInterface
public interface IndexedPredicate<T> {
    boolean test(T value, int index);

    default IndexedPredicate<T> negate() {
        return (value, index) -> !test(value, index);
    }
}
