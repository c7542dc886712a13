package io.sequences.transform;

import io.sequences.core.Sequence;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class TakeTransformTest {
    @Test
    void takes_first_n() {
        assertEquals(List.of(1, 2, 3), Sequence.of(1, 2, 3, 4, 5).take(3).collect());
        assertEquals(List.of(1, 2), Sequence.of(1, 2).take(5).collect());
    }

    @Test
    void non_positive_amount_yields_nothing_and_pulls_nothing() {
        AtomicInteger pulls = new AtomicInteger();
        assertTrue(Sequence.generate(pulls::incrementAndGet).take(0).collect().isEmpty());
        assertTrue(Sequence.generate(pulls::incrementAndGet).take(-2).collect().isEmpty());
        assertEquals(0, pulls.get());
    }

    @Test
    void stops_right_after_the_nth_element() {
        AtomicInteger pulls = new AtomicInteger();
        List<Integer> out = Sequence.generate(pulls::incrementAndGet).take(4).collect();
        assertEquals(List.of(1, 2, 3, 4), out);
        assertEquals(4, pulls.get());
    }

    @Test
    void side_effects_only_for_taken_elements() {
        AtomicInteger seen = new AtomicInteger();
        Sequence.of(1, 2, 3, 4, 5).forEach((x, i) -> seen.incrementAndGet()).take(2).consume();
        assertEquals(2, seen.get());
    }
}
