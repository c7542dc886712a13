package io.sequences.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Names and hands out the Dropwizard metrics recorded by metered stages.
 */
public class Metrics {
    private static final String PREFIX = "sequence.";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Meter rate(String stage) { return registry.meter(PREFIX + stage + ".rate"); }
    public Timer pullTimer(String stage) { return registry.timer(PREFIX + stage + ".pull.time"); }
    public Counter exhausted(String stage) { return registry.counter(PREFIX + stage + ".exhausted"); }
}
