package io.sequences.transform;

import io.sequences.core.IndexedFunction;
import io.sequences.core.PullSequence;

import java.util.Iterator;
import java.util.Objects;

/**
 * Yields f(x, i) for every upstream element x at position i.
 */
public class MapTransform<T, U> implements PullSequence<U> {
    private final PullSequence<T> upstream;
    private final IndexedFunction<? super T, ? extends U> function;

    public MapTransform(PullSequence<T> upstream, IndexedFunction<? super T, ? extends U> function) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.function = Objects.requireNonNull(function, "function");
    }

    @Override
    public Iterator<U> iterator() {
        Iterator<T> it = upstream.iterator();
        return new StageIterator<>() {
            private int index = 0;

            @Override
            protected boolean advance() {
                if (!it.hasNext()) return false;
                emit(function.apply(it.next(), index++));
                return true;
            }
        };
    }
}
