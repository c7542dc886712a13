package io.sequences.demo;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.TypeLiteral;
import io.sequences.metrics.Metrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

public class DemoModuleTest {
    @AfterEach
    void tearDown() {
        System.clearProperty("sequences.bound");
        System.clearProperty("sequences.separator");
        System.clearProperty("sequences.seed");
    }

    @Test
    void same_seed_gives_same_numbers() {
        DemoConfig config = new DemoConfig(42L, 100, ",");
        String first = Guice.createInjector(new DemoModule(config)).getInstance(DemoScenarios.class).numbers();
        String second = Guice.createInjector(new DemoModule(config)).getInstance(DemoScenarios.class).numbers();
        assertEquals(first, second);
    }

    @Test
    void generator_respects_bound_and_metrics_share_registry() {
        Injector injector = Guice.createInjector(new DemoModule(new DemoConfig(9L, 3, ",")));
        Supplier<Integer> generator = injector.getInstance(Key.get(new TypeLiteral<Supplier<Integer>>() {}));
        for (int i = 0; i < 200; i++) {
            int x = generator.get();
            assertTrue(x >= 0 && x <= 3, "out of bounds: " + x);
        }
        assertSame(injector.getInstance(MetricRegistry.class), injector.getInstance(Metrics.class).registry());
        assertSame(injector.getInstance(DemoScenarios.class), injector.getInstance(DemoScenarios.class));
    }

    @Test
    void config_reads_system_properties() {
        System.setProperty("sequences.seed", "11");
        System.setProperty("sequences.bound", "5");
        System.setProperty("sequences.separator", "|");
        DemoConfig config = DemoConfig.fromEnv();
        assertEquals(new DemoConfig(11L, 5, "|"), config);
        assertEquals(7, config.withBound(7).bound());
    }
}
