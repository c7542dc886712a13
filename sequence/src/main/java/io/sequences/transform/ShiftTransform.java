package io.sequences.transform;

import io.sequences.core.PullSequence;

import java.util.Iterator;
import java.util.Objects;

/**
 * Yields every element except the first.
 */
public class ShiftTransform<T> implements PullSequence<T> {
    private final PullSequence<T> upstream;

    public ShiftTransform(PullSequence<T> upstream) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
    }

    @Override
    public Iterator<T> iterator() {
        Iterator<T> it = upstream.iterator();
        return new StageIterator<>() {
            private boolean first = true;

            @Override
            protected boolean advance() {
                if (first) {
                    first = false;
                    if (!it.hasNext()) return false;
                    it.next();
                }
                if (!it.hasNext()) return false;
                emit(it.next());
                return true;
            }
        };
    }
}
