package io.sequences.metrics;

import com.codahale.metrics.MetricRegistry;
import io.sequences.core.Sequence;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MeteredTransformTest {
    @Test
    void counts_elements_pulls_and_exhaustion() {
        MetricRegistry registry = new MetricRegistry();
        Metrics metrics = new Metrics(registry);
        Sequence<Integer> seq = Sequence.of(1, 2, 3, 4).metered(metrics, "source").filter((x, i) -> x % 2 == 0);

        assertEquals(0, registry.meter("sequence.source.rate").getCount());
        assertEquals(List.of(2, 4), seq.collect());

        assertEquals(4, registry.meter("sequence.source.rate").getCount());
        assertEquals(5, registry.timer("sequence.source.pull.time").getCount());
        assertEquals(1, registry.counter("sequence.source.exhausted").getCount());
    }

    @Test
    void short_circuit_does_not_count_as_exhaustion() {
        Metrics metrics = new Metrics(new MetricRegistry());
        int[] next = {0};
        List<Integer> out = Sequence.generate(() -> next[0]++).metered(metrics, "gen").take(3).collect();
        assertEquals(List.of(0, 1, 2), out);
        assertEquals(3, metrics.rate("gen").getCount());
        assertEquals(0, metrics.exhausted("gen").getCount());
    }

    @Test
    void elements_pass_through_unchanged() {
        Metrics metrics = new Metrics(new MetricRegistry());
        assertEquals(List.of("a", "b"), Sequence.of("a", "b").metered(metrics, "pass").collect());
        assertSame(metrics.rate("pass"), metrics.registry().meter("sequence.pass.rate"));
    }
}
