package io.sequences.transform;

import io.sequences.core.PullSequence;

import java.util.Iterator;
import java.util.Objects;

/**
 * Yields every element except the last. Holds exactly one element back and releases it only
 * once a successor has been pulled.
 */
public class PopTransform<T> implements PullSequence<T> {
    private final PullSequence<T> upstream;

    public PopTransform(PullSequence<T> upstream) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
    }

    @Override
    public Iterator<T> iterator() {
        Iterator<T> it = upstream.iterator();
        return new StageIterator<>() {
            private boolean holding = false;
            private T held;

            @Override
            protected boolean advance() {
                if (!holding) {
                    if (!it.hasNext()) return false;
                    held = it.next();
                    holding = true;
                }
                if (!it.hasNext()) {
                    held = null;
                    holding = false;
                    return false;
                }
                emit(held);
                held = it.next();
                return true;
            }
        };
    }
}
