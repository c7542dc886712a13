package io.sequences.transform;

import io.sequences.core.PullSequence;

import java.util.Iterator;
import java.util.Objects;

/**
 * Yields the first {@code amount} elements and stops pulling right after the last of them.
 */
public class TakeTransform<T> implements PullSequence<T> {
    private final PullSequence<T> upstream;
    private final int amount;

    public TakeTransform(PullSequence<T> upstream, int amount) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.amount = amount;
    }

    @Override
    public Iterator<T> iterator() {
        return new StageIterator<>() {
            private Iterator<T> it;
            private int taken = 0;

            @Override
            protected boolean advance() {
                if (taken >= amount) return false;
                if (it == null) it = upstream.iterator();
                if (!it.hasNext()) return false;
                taken++;
                emit(it.next());
                return true;
            }
        };
    }
}
