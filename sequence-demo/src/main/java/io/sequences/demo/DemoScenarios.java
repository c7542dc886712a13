package io.sequences.demo;

import io.sequences.core.Indexed;
import io.sequences.core.PullSequence;
import io.sequences.core.Sequence;
import io.sequences.metrics.Metrics;
import io.sequences.transform.StageIterator;

import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * The walkthrough scenarios printed by {@link SequenceDemoMain}.
 */
public class DemoScenarios {
    static final List<Object> NESTED = List.of(
            "hello",
            List.of(List.of(List.of(" ")), "w", List.of("o"), "r"),
            List.of(List.of(List.of("l"), "d")),
            "!");

    private final DemoConfig config;
    private final Metrics metrics;
    private final Supplier<Integer> generator;

    public DemoScenarios(DemoConfig config, Metrics metrics, Supplier<Integer> generator) {
        this.config = config;
        this.metrics = metrics;
        this.generator = generator;
    }

    /**
     * Six fixed numbers followed by an endless random stream, cut down to a window of 48 values.
     */
    public String numbers() {
        return Sequence.of(1, 2, 3)
                .push(4, 5, 6)
                .concat(Sequence.generate(generator).metered(metrics, "numbers.generator").source())
                .filter((x, i) -> x != 10)
                .replace(7, 0)
                .take(100)
                .drop(3)
                .takeLast(50)
                .dropLast(2)
                .metered(metrics, "numbers.output")
                .join(config.separator());
    }

    public List<Indexed<String>> hello() {
        return Sequence.of("hello", "world", "!")
                .filter((s, i) -> s.contains("o"))
                .map((s, i) -> s.toUpperCase())
                .entries()
                .collect();
    }

    /** Flattens two levels of {@link #NESTED}, handing each element to the printer as it is pulled. */
    public void arrays(Consumer<Object> printer) {
        Sequence.of(NESTED)
                .flatten(2)
                .forEach((x, i) -> printer.accept(x))
                .consume();
    }

    public List<Integer> odds() {
        return Sequence.of(1, 2, 3, 4, 5, 6, 7, 8)
                .pipe(DemoScenarios::evenUp)
                .collect();
    }

    /** Rounds odd numbers up to the next even one. */
    static PullSequence<Integer> evenUp(PullSequence<Integer> upstream) {
        return () -> {
            Iterator<Integer> it = upstream.iterator();
            return new StageIterator<>() {
                @Override
                protected boolean advance() {
                    if (!it.hasNext()) return false;
                    int x = it.next();
                    emit(x % 2 == 0 ? x : x + 1);
                    return true;
                }
            };
        };
    }
}
