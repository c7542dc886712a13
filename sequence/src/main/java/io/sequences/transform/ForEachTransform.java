package io.sequences.transform;

import io.sequences.core.IndexedConsumer;
import io.sequences.core.PullSequence;

import java.util.Iterator;
import java.util.Objects;

/**
 * Passes elements through unchanged, invoking the action on each one as it is pulled.
 * The action runs once per element actually requested downstream and never ahead of demand.
 */
public class ForEachTransform<T> implements PullSequence<T> {
    private final PullSequence<T> upstream;
    private final IndexedConsumer<? super T> action;

    public ForEachTransform(PullSequence<T> upstream, IndexedConsumer<? super T> action) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.action = Objects.requireNonNull(action, "action");
    }

    @Override
    public Iterator<T> iterator() {
        Iterator<T> it = upstream.iterator();
        return new StageIterator<>() {
            private int index = 0;

            @Override
            protected boolean advance() {
                if (!it.hasNext()) return false;
                T x = it.next();
                action.accept(x, index++);
                emit(x);
                return true;
            }
        };
    }
}
