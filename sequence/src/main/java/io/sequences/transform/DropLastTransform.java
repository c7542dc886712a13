package io.sequences.transform;

import io.sequences.core.PullSequence;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Eager: buffers the whole upstream (length L) on the first pull and yields the inclusive slice
 * [0, L - amount - 1].
 */
public class DropLastTransform<T> implements PullSequence<T> {
    private final PullSequence<T> upstream;
    private final int amount;

    public DropLastTransform(PullSequence<T> upstream, int amount) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.amount = amount;
    }

    @Override
    public Iterator<T> iterator() {
        return new StageIterator<>() {
            private Iterator<T> sliced;

            @Override
            protected boolean advance() {
                if (sliced == null) {
                    List<T> buffer = Buffers.drain(upstream);
                    long end = (long) buffer.size() - amount - 1;
                    sliced = new SliceTransform<>(buffer, 0, (int) Math.min(end, buffer.size() - 1)).iterator();
                }
                if (!sliced.hasNext()) return false;
                emit(sliced.next());
                return true;
            }
        };
    }
}
