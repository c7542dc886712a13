package io.sequences.transform;

import io.sequences.core.IndexedPredicate;
import io.sequences.core.PullSequence;

import java.util.Iterator;
import java.util.Objects;

/**
 * Yields the upstream elements for which the predicate holds. The index passed to the predicate
 * counts every upstream element, rejected ones included.
 */
public class FilterTransform<T> implements PullSequence<T> {
    private final PullSequence<T> upstream;
    private final IndexedPredicate<? super T> predicate;

    public FilterTransform(PullSequence<T> upstream, IndexedPredicate<? super T> predicate) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.predicate = Objects.requireNonNull(predicate, "predicate");
    }

    @Override
    public Iterator<T> iterator() {
        Iterator<T> it = upstream.iterator();
        return new StageIterator<>() {
            private int index = 0;

            @Override
            protected boolean advance() {
                while (it.hasNext()) {
                    T x = it.next();
                    if (predicate.test(x, index++)) {
                        emit(x);
                        return true;
                    }
                }
                return false;
            }
        };
    }
}
