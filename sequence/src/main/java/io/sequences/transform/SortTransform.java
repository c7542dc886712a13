package io.sequences.transform;

import io.sequences.core.PullSequence;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Eager: buffers the whole upstream on the first pull, sorts it (stable) and yields it in order.
 * Without a comparator elements are compared by natural ordering, nulls last.
 */
public class SortTransform<T> implements PullSequence<T> {
    private final PullSequence<T> upstream;
    private final Comparator<? super T> comparator;

    public SortTransform(PullSequence<T> upstream) {
        this(upstream, naturalOrder());
    }

    public SortTransform(PullSequence<T> upstream, Comparator<? super T> comparator) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.comparator = Objects.requireNonNull(comparator, "comparator");
    }

    @SuppressWarnings("unchecked")
    private static <T> Comparator<T> naturalOrder() {
        Comparator<Comparable<Object>> natural = Comparator.naturalOrder();
        return (Comparator<T>) (Comparator<?>) Comparator.nullsLast(natural);
    }

    @Override
    public Iterator<T> iterator() {
        return new StageIterator<>() {
            private Iterator<T> sorted;

            @Override
            protected boolean advance() {
                if (sorted == null) {
                    List<T> buffer = Buffers.drain(upstream);
                    buffer.sort(comparator);
                    sorted = buffer.iterator();
                }
                if (!sorted.hasNext()) return false;
                emit(sorted.next());
                return true;
            }
        };
    }
}
