package me.golemcore.pulse.resilience;

import me.golemcore.pulse.domain.model.CircuitBreakerState;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.testsupport.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;

class CircuitBreakerRegistryTest {

    private final CircuitBreakerRegistry registry = new CircuitBreakerRegistry(new PulseProperties(),
            new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));

    @Test
    void shouldReturnSameBreakerForSameDependency() {
        assertSame(registry.breaker("provider.deepcoder"), registry.breaker("provider.deepcoder"));
        assertNotSame(registry.breaker("provider.deepcoder"), registry.breaker("provider.phi-local"));
    }

    @Test
    void shouldListStatesSortedByName() {
        registry.breaker("provider.phi-local");
        registry.breaker("backup.save");
        registry.breaker("primary.save");

        List<CircuitBreakerState> states = registry.states();

        assertEquals(List.of("backup.save", "primary.save", "provider.phi-local"),
                states.stream().map(CircuitBreakerState::getDependencyName).toList());
    }
}
