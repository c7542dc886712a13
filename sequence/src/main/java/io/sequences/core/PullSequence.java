package io.sequences.core;

import io.sequences.source.GeneratorSource;
import io.sequences.source.IteratorSource;

import java.util.Iterator;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Produces elements on demand, in order, until exhausted.
 * <p>
 * Each call to {@link #iterator()} starts a traversal. Re-drivable sources (collections, ranges,
 * combinator stages over re-drivable sources) hand out a fresh iterator per traversal; single-use
 * sources hand out the same iterator every time, so two traversals share one cursor.
 * Implementations must not touch their upstream before {@link #iterator()} is called.
 */
@FunctionalInterface
public interface PullSequence<T> extends Iterable<T> {

    static <T> PullSequence<T> of(Iterable<T> iterable) {
        Objects.requireNonNull(iterable, "iterable");
        if (iterable instanceof PullSequence<T> p) return p;
        return iterable::iterator;
    }

    static <T> PullSequence<T> once(Iterator<T> iterator) {
        return new IteratorSource<>(iterator);
    }

    static <T> PullSequence<T> generate(Supplier<? extends T> supplier) {
        return new GeneratorSource<>(supplier);
    }
}
