package com.tessera.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "tenancy-service");
    }

    @Test
    @DisplayName("should reject a missing registry or service name")
    void rejectsBadArguments() {
        assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("registry");
        assertThatThrownBy(() -> new MetricFactory(registry, " "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("serviceName");
    }

    @Test
    @DisplayName("counters carry the service tag and extra tags")
    void counterTags() {
        factory.counter("calls", "Calls", "kind", "a").increment(2);

        var counter = registry.find("calls").tag("service", "tenancy-service").tag("kind", "a").counter();
        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("asking twice returns the same meter")
    void sameMeter() {
        assertThat(factory.counter("calls", "Calls")).isSameAs(factory.counter("calls", "Calls"));
    }

    @Test
    @DisplayName("timers record durations")
    void timer() {
        factory.timer("work", "Work").record(Duration.ofMillis(5));
        assertThat(registry.find("work").timer().count()).isEqualTo(1);
    }
}
