package io.sequences.transform;

import io.sequences.core.PullSequence;

import java.util.Iterator;
import java.util.Objects;

/**
 * Discards exactly the first {@code amount} elements and yields the rest.
 */
public class SkipTransform<T> implements PullSequence<T> {
    private final PullSequence<T> upstream;
    private final int amount;

    public SkipTransform(PullSequence<T> upstream, int amount) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.amount = amount;
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
                    if (index++ >= amount) {
                        emit(x);
                        return true;
                    }
                }
                return false;
            }
        };
    }
}
