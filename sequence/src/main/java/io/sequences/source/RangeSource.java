package io.sequences.source;

import io.sequences.core.PullSequence;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Emits start, start + 1, ... up to but excluding endExclusive. Re-drivable.
 */
public class RangeSource implements PullSequence<Integer> {
    private final int start;
    private final int endExclusive;

    public RangeSource(int start, int endExclusive) {
        this.start = start;
        this.endExclusive = endExclusive;
    }

    public int size() { return Math.max(0, endExclusive - start); }

    @Override
    public Iterator<Integer> iterator() {
        return new Iterator<>() {
            private int next = start;

            @Override
            public boolean hasNext() { return next < endExclusive; }

            @Override
            public Integer next() {
                if (next >= endExclusive) throw new NoSuchElementException();
                return next++;
            }
        };
    }
}
