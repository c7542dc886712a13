package io.sequences.transform;

import io.sequences.core.PullSequence;

import java.util.Iterator;
import java.util.Objects;

/**
 * Withholds leading elements while their position i satisfies {@code i < amount - 1}.
 * <p>
 * This removes {@code amount - 1} elements, not {@code amount}: {@code drop(1)} removes nothing and
 * {@code drop(3)} removes the first two. Existing callers depend on it; use
 * {@link SkipTransform} to remove exactly {@code amount} elements.
 */
public class DropTransform<T> implements PullSequence<T> {
    private final PullSequence<T> upstream;
    private final int amount;

    public DropTransform(PullSequence<T> upstream, int amount) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.amount = amount;
    }

    @Override
    public Iterator<T> iterator() {
        return new SkipTransform<>(upstream, amount <= 0 ? 0 : amount - 1).iterator();
    }
}
