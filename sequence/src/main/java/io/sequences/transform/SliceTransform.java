package io.sequences.transform;

import io.sequences.core.PullSequence;

import java.util.Collections;
import java.util.Iterator;
import java.util.Objects;

/**
 * Yields the elements at positions start..end, both bounds inclusive. Nothing past position end is
 * ever pulled, so a slice over an infinite upstream terminates. A negative start behaves as 0; an
 * end before start yields nothing.
 */
public class SliceTransform<T> implements PullSequence<T> {
    private final Iterable<T> upstream;
    private final int start;
    private final int end;

    public SliceTransform(Iterable<T> upstream, int start, int end) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.start = start;
        this.end = end;
    }

    @Override
    public Iterator<T> iterator() {
        if (end < 0 || end < start) return Collections.emptyIterator();
        Iterator<T> it = upstream.iterator();
        return new StageIterator<>() {
            private int index = 0;

            @Override
            protected boolean advance() {
                while (index <= end && it.hasNext()) {
                    T x = it.next();
                    if (index++ >= start) {
                        emit(x);
                        return true;
                    }
                }
                return false;
            }
        };
    }
}
