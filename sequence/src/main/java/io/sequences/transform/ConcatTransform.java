package io.sequences.transform;

import io.sequences.core.PullSequence;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Drains each part in argument order. A part's iterator is only requested once every part
 * before it is exhausted.
 */
public class ConcatTransform<T> implements PullSequence<T> {
    private final List<Iterable<? extends T>> parts;

    public ConcatTransform(List<? extends Iterable<? extends T>> parts) {
        for (Iterable<? extends T> part : parts) Objects.requireNonNull(part, "part");
        this.parts = List.copyOf(parts);
    }

    @Override
    public Iterator<T> iterator() {
        return new StageIterator<>() {
            private int part = 0;
            private Iterator<? extends T> current;

            @Override
            protected boolean advance() {
                while (true) {
                    if (current == null) {
                        if (part >= parts.size()) return false;
                        current = parts.get(part++).iterator();
                    }
                    if (current.hasNext()) {
                        emit(current.next());
                        return true;
                    }
                    current = null;
                }
            }
        };
    }
}
