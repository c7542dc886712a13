package io.sequences.transform;

import io.sequences.core.PullSequence;

import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;

/**
 * Eager: drains the whole upstream into a buffer on the first pull, then yields it back to front.
 * Never terminates on an infinite upstream.
 */
public class ReverseTransform<T> implements PullSequence<T> {
    private final PullSequence<T> upstream;

    public ReverseTransform(PullSequence<T> upstream) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
    }

    @Override
    public Iterator<T> iterator() {
        return new StageIterator<>() {
            private ListIterator<T> buffer;

            @Override
            protected boolean advance() {
                if (buffer == null) {
                    List<T> all = Buffers.drain(upstream);
                    buffer = all.listIterator(all.size());
                }
                if (!buffer.hasPrevious()) return false;
                emit(buffer.previous());
                return true;
            }
        };
    }
}
