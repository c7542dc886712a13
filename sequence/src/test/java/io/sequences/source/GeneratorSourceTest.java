package io.sequences.source;

import io.sequences.core.Sequence;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class GeneratorSourceTest {
    @Test
    void never_exhausts_and_pulls_on_demand() {
        int[] calls = {0};
        GeneratorSource<Integer> source = new GeneratorSource<>(() -> ++calls[0]);
        Iterator<Integer> it = source.iterator();
        assertTrue(it.hasNext());
        assertEquals(0, calls[0]);
        assertEquals(1, it.next());
        assertEquals(2, it.next());
        assertTrue(it.hasNext());
    }

    @Test
    void supplier_state_is_shared_across_traversals() {
        Random a = new Random(7);
        Random b = new Random(7);
        Sequence<Integer> seq = new Sequence<>(new GeneratorSource<>(() -> a.nextInt(100)));
        List<Integer> first = seq.take(3).collect();
        List<Integer> second = seq.take(3).collect();
        assertEquals(List.of(b.nextInt(100), b.nextInt(100), b.nextInt(100)), first);
        assertEquals(List.of(b.nextInt(100), b.nextInt(100), b.nextInt(100)), second);
    }

    @Test
    void rejects_null_supplier() {
        assertThrows(NullPointerException.class, () -> new GeneratorSource<>(null));
    }
}
