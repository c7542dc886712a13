package io.sequences.core;

@FunctionalInterface
public interface IndexedConsumer<T> {
    void accept(T value, int index);
}
