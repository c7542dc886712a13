package io.sequences.source;

import io.sequences.core.PullSequence;

import java.util.Iterator;
import java.util.Objects;

/**
 * Single-use source: every traversal gets the same iterator, so a cursor advanced by one chain is
 * advanced for all of them. Driving it from two chains interleaves their pulls.
 */
public class IteratorSource<T> implements PullSequence<T> {
    private final Iterator<T> iterator;

    public IteratorSource(Iterator<T> iterator) {
        this.iterator = Objects.requireNonNull(iterator, "iterator");
    }

    @Override
    public Iterator<T> iterator() {
        return iterator;
    }
}
