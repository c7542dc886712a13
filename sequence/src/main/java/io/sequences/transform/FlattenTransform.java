package io.sequences.transform;

import io.sequences.core.PullSequence;
import io.sequences.core.Sequence;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;

/**
 * Recursively splices nested sequences into the output, depth first. An element is nested when it
 * is an {@link Iterable}, any {@link PullSequence} included; character sequences and
 * {@link Sequence} wrappers are always leaves. A bounded depth stops descending after that many
 * levels, 0 being the identity.
 */
public class FlattenTransform<U> implements PullSequence<U> {
    public static final int UNBOUNDED = -1;

    private final PullSequence<?> upstream;
    private final int depth;

    public FlattenTransform(PullSequence<?> upstream) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.depth = UNBOUNDED;
    }

    public FlattenTransform(PullSequence<?> upstream, int depth) {
        if (depth < 0) throw new IllegalArgumentException("Negative depth: " + depth);
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.depth = depth;
    }

    static Iterable<?> nested(Object x) {
        if (x instanceof CharSequence) return null;
        if (x instanceof Iterable<?> it) return it;
        return null;
    }

    @SuppressWarnings("unchecked")
    @Override
    public Iterator<U> iterator() {
        Deque<Iterator<?>> stack = new ArrayDeque<>();
        stack.push(upstream.iterator());
        return new StageIterator<>() {
            @Override
            protected boolean advance() {
                while (!stack.isEmpty()) {
                    Iterator<?> top = stack.peek();
                    if (!top.hasNext()) {
                        stack.pop();
                        continue;
                    }
                    Object x = top.next();
                    // stack.size() - 1 levels have been descended to reach x
                    Iterable<?> inner = (depth == UNBOUNDED || stack.size() <= depth) ? nested(x) : null;
                    if (inner == null) {
                        emit((U) x);
                        return true;
                    }
                    stack.push(inner.iterator());
                }
                return false;
            }
        };
    }
}
