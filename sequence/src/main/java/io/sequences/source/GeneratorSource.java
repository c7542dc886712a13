package io.sequences.source;

import io.sequences.core.PullSequence;

import java.util.Iterator;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Infinite source that asks its supplier for one value per pull. Never exhausts; only
 * short-circuiting stages (take, slice, find, some, every, includes) terminate over it.
 * Any state held by the supplier is shared by every traversal.
 */
public class GeneratorSource<T> implements PullSequence<T> {
    private final Supplier<? extends T> supplier;

    public GeneratorSource(Supplier<? extends T> supplier) {
        this.supplier = Objects.requireNonNull(supplier, "supplier");
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            @Override
            public boolean hasNext() { return true; }

            @Override
            public T next() { return supplier.get(); }
        };
    }
}
