package io.sequences.core;

import io.sequences.metrics.MeteredTransform;
import io.sequences.metrics.Metrics;
import io.sequences.source.RangeSource;
import io.sequences.transform.ConcatTransform;
import io.sequences.transform.DropLastTransform;
import io.sequences.transform.DropTransform;
import io.sequences.transform.FilterTransform;
import io.sequences.transform.FlattenTransform;
import io.sequences.transform.ForEachTransform;
import io.sequences.transform.MapTransform;
import io.sequences.transform.PopTransform;
import io.sequences.transform.ReverseTransform;
import io.sequences.transform.ShiftTransform;
import io.sequences.transform.SkipTransform;
import io.sequences.transform.SliceTransform;
import io.sequences.transform.SortTransform;
import io.sequences.transform.TakeLastTransform;
import io.sequences.transform.TakeTransform;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Immutable, lazily evaluated chain of transformations over a {@link PullSequence}.
 * <p>
 * Every chain method returns a new {@code Sequence} wrapping a stage that pulls from this one; no
 * element is produced until a terminal method ({@link #collect()}, {@link #consume()},
 * {@link #count()}, {@link #first()}, {@link #last()}, {@link #find}, {@link #some},
 * {@link #every}, {@link #includes}, {@link #reduce}, {@link #join}) drives the chain. Exceptions
 * thrown by callbacks surface from that terminal call.
 * <p>
 * {@link #reverse()}, {@link #sort()}, {@link #takeLast(int)} and {@link #dropLast(int)} buffer
 * their whole upstream on first pull and never terminate over an infinite source; {@link #take},
 * {@link #slice}, {@link #find}, {@link #some}, {@link #every} and {@link #includes} stop pulling
 * as soon as they can.
 */
public final class Sequence<T> {
    private final PullSequence<T> source;

    public Sequence(PullSequence<T> source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public static <T> Sequence<T> of(Iterable<T> iterable) {
        return new Sequence<>(PullSequence.of(iterable));
    }

    @SafeVarargs
    public static <T> Sequence<T> of(T... elements) {
        return of(Arrays.asList(elements.clone()));
    }

    public static <T> Sequence<T> empty() {
        return of(Collections.emptyList());
    }

    /** Infinite sequence pulling one value from the supplier per element. */
    public static <T> Sequence<T> generate(Supplier<? extends T> supplier) {
        return new Sequence<>(PullSequence.generate(supplier));
    }

    /** Single-use sequence over an existing iterator. */
    public static <T> Sequence<T> once(Iterator<T> iterator) {
        return new Sequence<>(PullSequence.once(iterator));
    }

    public static Sequence<Integer> range(int start, int endExclusive) {
        return new Sequence<>(new RangeSource(start, endExclusive));
    }

    public PullSequence<T> source() { return source; }

    /**
     * Wraps {@code f(source())} in a new sequence. {@code f} is applied immediately; it should only
     * build the stage and leave pulling to the returned iterable's iterators.
     */
    public <U> Sequence<U> pipe(Function<? super PullSequence<T>, ? extends Iterable<U>> f) {
        Objects.requireNonNull(f, "f");
        Iterable<U> next = Objects.requireNonNull(f.apply(source), "pipe result");
        return new Sequence<>(PullSequence.of(next));
    }

    public <U> Sequence<U> map(IndexedFunction<? super T, ? extends U> f) {
        return pipe(src -> new MapTransform<>(src, f));
    }

    public Sequence<T> filter(IndexedPredicate<? super T> f) {
        return pipe(src -> new FilterTransform<>(src, f));
    }

    /** Lazily runs {@code f} on each element as it is pulled; elements pass through unchanged. */
    public Sequence<T> forEach(IndexedConsumer<? super T> f) {
        return pipe(src -> new ForEachTransform<>(src, f));
    }

    @SafeVarargs
    public final Sequence<T> concat(Iterable<? extends T>... others) {
        List<Iterable<? extends T>> rest = List.of(others);
        return pipe(src -> {
            List<Iterable<? extends T>> parts = new ArrayList<>(rest.size() + 1);
            parts.add(src);
            parts.addAll(rest);
            return new ConcatTransform<T>(parts);
        });
    }

    @SafeVarargs
    public final Sequence<T> push(T... elements) {
        List<T> tail = Arrays.asList(elements.clone());
        return pipe(src -> new ConcatTransform<T>(List.<Iterable<? extends T>>of(src, tail)));
    }

    @SafeVarargs
    public final Sequence<T> unshift(T... elements) {
        List<T> head = Arrays.asList(elements.clone());
        return pipe(src -> new ConcatTransform<T>(List.<Iterable<? extends T>>of(head, src)));
    }

    public Sequence<T> reverse() {
        return pipe(ReverseTransform::new);
    }

    /** Drops the last element; see {@link #last()} to read it. */
    public Sequence<T> pop() {
        return pipe(PopTransform::new);
    }

    /** Drops the first element; see {@link #first()} to read it. */
    public Sequence<T> shift() {
        return pipe(ShiftTransform::new);
    }

    /** Elements at positions {@code start} to {@code end}, both inclusive. */
    public Sequence<T> slice(int start, int end) {
        return pipe(src -> new SliceTransform<>(src, start, end));
    }

    public Sequence<T> take(int amount) {
        return pipe(src -> new TakeTransform<>(src, amount));
    }

    /**
     * Withholds the first {@code amount - 1} elements: {@code drop(3)} over {@code [1, 2, 3, 4, 5]}
     * yields {@code [3, 4, 5]}. See {@link #skip(int)} for removing exactly {@code amount}.
     */
    public Sequence<T> drop(int amount) {
        return pipe(src -> new DropTransform<>(src, amount));
    }

    public Sequence<T> skip(int amount) {
        return pipe(src -> new SkipTransform<>(src, amount));
    }

    public Sequence<T> takeLast(int amount) {
        return pipe(src -> new TakeLastTransform<>(src, amount));
    }

    public Sequence<T> dropLast(int amount) {
        return pipe(src -> new DropLastTransform<>(src, amount));
    }

    /** Fully flattens nested iterables; strings stay whole. */
    public <U> Sequence<U> flatten() {
        return pipe(src -> new FlattenTransform<U>(src));
    }

    /**
     * Flattens at most {@code depth} levels of nesting.
     *
     * @throws IllegalArgumentException if depth is negative
     */
    public <U> Sequence<U> flatten(int depth) {
        return pipe(src -> new FlattenTransform<U>(src, depth));
    }

    public Sequence<Indexed<T>> entries() {
        return map((x, i) -> new Indexed<>(x, i));
    }

    public Sequence<Integer> indexes() {
        return map((x, i) -> i);
    }

    /** Substitutes {@code b} for every element equal to {@code a}. */
    public Sequence<T> replace(T a, T b) {
        return map((x, i) -> Objects.equals(x, a) ? b : x);
    }

    /** Like {@link #replace(Object, Object)} for a replacement of another type. */
    public <U> Sequence<Object> replaceWith(T a, U b) {
        return this.<Object>map((x, i) -> Objects.equals(x, a) ? b : x);
    }

    public Sequence<T> sort() {
        return pipe(SortTransform::new);
    }

    public Sequence<T> sort(Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        return pipe(src -> new SortTransform<>(src, comparator));
    }

    public Sequence<T> metered(Metrics metrics, String stage) {
        Objects.requireNonNull(metrics, "metrics");
        return pipe(src -> new MeteredTransform<>(src, metrics, stage));
    }

    // Terminal operations

    public List<T> collect() {
        List<T> out = new ArrayList<>();
        for (T x : source) out.add(x);
        return Collections.unmodifiableList(out);
    }

    public void consume() {
        Iterator<T> it = source.iterator();
        while (it.hasNext()) it.next();
    }

    public int count() {
        int n = 0;
        Iterator<T> it = source.iterator();
        while (it.hasNext()) {
            it.next();
            n++;
        }
        return n;
    }

    /** Pulls a single element. A {@code null} first element reads as empty. */
    public Optional<T> first() {
        Iterator<T> it = source.iterator();
        return it.hasNext() ? Optional.ofNullable(it.next()) : Optional.empty();
    }

    public Optional<T> last() {
        T result = null;
        for (T x : source) result = x;
        return Optional.ofNullable(result);
    }

    public Optional<T> find(IndexedPredicate<? super T> f) {
        Objects.requireNonNull(f, "f");
        int i = 0;
        for (T x : source) {
            if (f.test(x, i++)) return Optional.ofNullable(x);
        }
        return Optional.empty();
    }

    public boolean some(IndexedPredicate<? super T> f) {
        Objects.requireNonNull(f, "f");
        int i = 0;
        for (T x : source) {
            if (f.test(x, i++)) return true;
        }
        return false;
    }

    public boolean every(IndexedPredicate<? super T> f) {
        Objects.requireNonNull(f, "f");
        return !some(f.negate());
    }

    public boolean includes(T y) {
        return some((x, i) -> Objects.equals(x, y));
    }

    public <U> U reduce(U init, IndexedReducer<U, ? super T> f) {
        Objects.requireNonNull(f, "f");
        int i = 0;
        U result = init;
        for (T x : source) result = f.apply(result, x, i++);
        return result;
    }

    /**
     * Joins the text of each element with {@code separator}. Elements without text ({@code null},
     * or a {@code toString()} that is null or empty) are skipped along with their separator.
     */
    public String join(String separator) {
        Objects.requireNonNull(separator, "separator");
        StringBuilder result = new StringBuilder();
        boolean kept = false;
        for (T x : source) {
            String y = textOf(x);
            if (y == null || y.isEmpty()) continue;
            if (kept) result.append(separator);
            result.append(y);
            kept = true;
        }
        return result.toString();
    }

    /** Sequential stream over this chain; nothing is pulled until the stream runs. */
    public Stream<T> stream() {
        return StreamSupport.stream(source::spliterator, Spliterator.ORDERED, false);
    }

    private static String textOf(Object x) {
        if (x instanceof String s) return s;
        return x == null ? null : x.toString();
    }
}
