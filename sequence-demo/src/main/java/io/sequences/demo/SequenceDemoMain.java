package io.sequences.demo;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.inject.Guice;
import com.google.inject.Injector;
import picocli.CommandLine;

import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI that walks through the sequence API on a few fixed inputs and an endless random source.
 */
@CommandLine.Command(name = "sequence-demo", mixinStandardHelpOptions = true, description = "Run lazy sequence pipeline scenarios")
public final class SequenceDemoMain implements Callable<Integer> {
    static final List<String> SCENARIOS = List.of("numbers", "hello", "arrays", "odds");

    @CommandLine.Option(names = {"-s", "--scenario"}, description = "Scenario to run: numbers, hello, arrays, odds or all", defaultValue = "all")
    String scenario;

    @CommandLine.Option(names = "--seed", description = "Seed for the random source; default from SEQUENCES_SEED or the clock")
    Long seed;

    @CommandLine.Option(names = {"-b", "--bound"}, description = "Largest random value; default from SEQUENCES_BOUND or 100")
    Integer bound;

    @CommandLine.Option(names = "--separator", description = "Separator for joined output; default from SEQUENCES_SEPARATOR or '; '")
    String separator;

    @CommandLine.Option(names = "--metrics", description = "Print a metrics summary after the scenarios")
    boolean printMetrics;

    private final PrintStream out;
    private final PrintStream err;

    public SequenceDemoMain() {
        this(System.out, System.err);
    }

    SequenceDemoMain(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SequenceDemoMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        if (!"all".equals(scenario) && !SCENARIOS.contains(scenario)) {
            err.println("Unknown scenario: " + scenario + " (expected one of " + SCENARIOS + " or all)");
            return 2;
        }
        DemoConfig config = DemoConfig.fromEnv();
        if (seed != null) config = config.withSeed(seed);
        if (bound != null) config = config.withBound(bound);
        if (separator != null) config = config.withSeparator(separator);
        if (config.bound() < 0) {
            err.println("Bound must be non-negative");
            return 2;
        }

        Injector injector = Guice.createInjector(new DemoModule(config));
        DemoScenarios scenarios = injector.getInstance(DemoScenarios.class);

        for (String name : SCENARIOS) {
            if (!"all".equals(scenario) && !scenario.equals(name)) continue;
            switch (name) {
                case "numbers" -> out.println(scenarios.numbers());
                case "hello" -> out.println(scenarios.hello());
                case "arrays" -> scenarios.arrays(out::println);
                case "odds" -> out.println(scenarios.odds());
                default -> throw new IllegalStateException("Unhandled scenario: " + name);
            }
        }

        if (printMetrics) printOnce(injector.getInstance(MetricRegistry.class));
        return 0;
    }

    private void printOnce(MetricRegistry r) {
        Meter generated = r.meter("sequence.numbers.generator.rate");
        Meter emitted = r.meter("sequence.numbers.output.rate");
        Timer pulls = r.timer("sequence.numbers.generator.pull.time");
        out.println("metrics:" +
                " generated=" + generated.getCount() +
                " | emitted=" + emitted.getCount() +
                " | exhausted=" + r.counter("sequence.numbers.output.exhausted").getCount() +
                " | pull.p50(ms)=" + nsToMs(pulls.getSnapshot().getMedian()));
    }

    private static String nsToMs(double nanos) { return String.format("%.3f", nanos / 1_000_000.0); }
}
