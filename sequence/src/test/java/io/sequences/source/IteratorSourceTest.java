package io.sequences.source;

import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IteratorSourceTest {
    @Test
    void every_traversal_shares_the_cursor() {
        IteratorSource<String> source = new IteratorSource<>(List.of("a", "b", "c").iterator());
        Iterator<String> first = source.iterator();
        Iterator<String> second = source.iterator();
        assertSame(first, second);
        assertEquals("a", first.next());
        assertEquals("b", second.next());
        assertEquals("c", source.iterator().next());
        assertFalse(first.hasNext());
    }
}
