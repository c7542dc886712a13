package io.sequences.demo;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.sequences.metrics.Metrics;

import java.util.Random;
import java.util.function.Supplier;

public class DemoModule extends AbstractModule {
    private final DemoConfig config;

    public DemoModule(DemoConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(DemoConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton Random random() { return new Random(config.seed()); }

    // rounded, so 0 and bound come up half as often as the values between them
    @Provides Supplier<Integer> generator(Random random) {
        int bound = config.bound();
        return () -> (int) Math.round(random.nextDouble() * bound);
    }

    @Provides @Singleton DemoScenarios scenarios(Metrics metrics, Supplier<Integer> generator) {
        return new DemoScenarios(config, metrics, generator);
    }
}
