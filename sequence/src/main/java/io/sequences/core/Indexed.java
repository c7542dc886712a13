package io.sequences.core;

import java.util.Objects;

/**
 * An element paired with the position at which a stage observed it.
 */
public final class Indexed<T> {
    private final T value;
    private final int index; // 0-based, per stage

    public Indexed(T value, int index) {
        this.value = value;
        this.index = index;
    }

    public T value() { return value; }
    public int index() { return index; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Indexed<?> that)) return false;
        return index == that.index && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, index);
    }

    @Override
    public String toString() {
        return "Indexed{" +
                "value=" + value +
                ", index=" + index +
                '}';
    }
}
