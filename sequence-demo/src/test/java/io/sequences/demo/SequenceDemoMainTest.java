package io.sequences.demo;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class SequenceDemoMainTest {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        PrintStream o = new PrintStream(out, true, StandardCharsets.UTF_8);
        PrintStream e = new PrintStream(err, true, StandardCharsets.UTF_8);
        return new CommandLine(new SequenceDemoMain(o, e)).execute(args);
    }

    private String stdout() { return out.toString(StandardCharsets.UTF_8); }

    @Test
    void runs_single_scenario() {
        assertEquals(0, run("--scenario", "odds"));
        assertEquals("[2, 2, 4, 4, 6, 6, 8, 8]", stdout().trim());
    }

    @Test
    void arrays_prints_one_element_per_line() {
        assertEquals(0, run("-s", "arrays"));
        String[] lines = stdout().split("\\R");
        assertArrayEquals(new String[]{"hello", "[ ]", "w", "o", "r", "[l]", "d", "!"}, lines);
    }

    @Test
    void all_scenarios_with_metrics() {
        assertEquals(0, run("--seed", "5", "--separator", ",", "--metrics"));
        String text = stdout();
        assertTrue(text.contains("Indexed{value=HELLO, index=0}"), text);
        assertTrue(text.contains("[2, 2, 4, 4, 6, 6, 8, 8]"), text);
        assertTrue(text.contains("emitted=48"), text);
        String numbers = text.split("\\R")[0];
        assertEquals(48, numbers.split(",").length);
    }

    @Test
    void unknown_scenario_exits_with_2() {
        assertEquals(2, run("--scenario", "bogus"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Unknown scenario: bogus"));
        assertEquals("", stdout());
    }

    @Test
    void negative_bound_exits_with_2() {
        assertEquals(2, run("--bound", "-1"));
    }
}
