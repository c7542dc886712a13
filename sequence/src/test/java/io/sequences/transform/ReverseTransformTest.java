package io.sequences.transform;

import io.sequences.core.Sequence;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ReverseTransformTest {
    @Test
    void yields_back_to_front() {
        assertEquals(List.of(3, 2, 1), Sequence.of(1, 2, 3).reverse().collect());
        assertTrue(Sequence.empty().reverse().collect().isEmpty());
    }

    @Test
    void drains_upstream_on_first_pull() {
        AtomicInteger pulls = new AtomicInteger();
        Sequence<Integer> reversed = Sequence.of(1, 2, 3, 4).forEach((x, i) -> pulls.incrementAndGet()).reverse();
        assertEquals(0, pulls.get());
        assertEquals(java.util.Optional.of(4), reversed.first());
        assertEquals(4, pulls.get());
    }

    @Test
    void reverse_twice_restores_order() {
        assertEquals(List.of("a", "b", "c"), Sequence.of("a", "b", "c").reverse().reverse().collect());
    }
}
