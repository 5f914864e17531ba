package me.golemcore.pulse.routing;

import me.golemcore.pulse.domain.model.ModelUsage;
import me.golemcore.pulse.domain.model.ResourceBucket;
import me.golemcore.pulse.domain.model.RoutingDecision;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RouterStateTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void shouldReturnCachedDecisionUntilExpiry() {
        RouterState state = new RouterState();
        state.cache("k", decision("m1"), NOW.plusSeconds(10), 10, NOW);

        assertEquals("m1", state.cachedDecision("k", NOW.plusSeconds(9)).orElseThrow().getSelectedModelId());
        assertTrue(state.cachedDecision("k", NOW.plusSeconds(10)).isEmpty());
        assertEquals(0, state.cacheSize());
    }

    @Test
    void shouldEvictExpiredEntriesFirstWhenFull() {
        RouterState state = new RouterState();
        state.cache("old", decision("m1"), NOW.plusSeconds(1), 2, NOW);
        state.cache("fresh", decision("m2"), NOW.plusSeconds(60), 2, NOW);

        state.cache("new", decision("m3"), NOW.plusSeconds(70), 2, NOW.plusSeconds(5));

        assertEquals(2, state.cacheSize());
        assertTrue(state.cachedDecision("fresh", NOW.plusSeconds(5)).isPresent());
        assertTrue(state.cachedDecision("new", NOW.plusSeconds(5)).isPresent());
    }

    @Test
    void shouldEvictOldestEntriesWhenNothingExpired() {
        RouterState state = new RouterState();
        for (int i = 0; i < 20; i++) {
            state.cache("k" + i, decision("m"), NOW.plus(Duration.ofSeconds(100 + i)), 20, NOW);
        }

        state.cache("k20", decision("m"), NOW.plusSeconds(200), 20, NOW);

        assertEquals(19, state.cacheSize());
        assertTrue(state.cachedDecision("k0", NOW).isEmpty());
        assertTrue(state.cachedDecision("k1", NOW).isEmpty());
        assertTrue(state.cachedDecision("k2", NOW).isPresent());
    }

    @Test
    void shouldInvalidateEntry() {
        RouterState state = new RouterState();
        state.cache("k", decision("m1"), NOW.plusSeconds(10), 10, NOW);

        state.invalidate("k");

        assertTrue(state.cachedDecision("k", NOW).isEmpty());
    }

    @Test
    void shouldReportUsageMostUsedFirst() {
        RouterState state = new RouterState();
        state.recordUsage("b");
        state.recordUsage("a");
        state.recordUsage("c");
        state.recordUsage("c");

        List<ModelUsage> report = state.usageReport();

        assertEquals(List.of("c", "a", "b"), report.stream().map(ModelUsage::modelId).toList());
        assertEquals(50.0, report.get(0).percentage());
        assertEquals(2, state.usageCount("c"));
        assertEquals(0, state.usageCount("unknown"));
    }

    @Test
    void shouldReportEmptyUsageWhenNothingRouted() {
        assertTrue(new RouterState().usageReport().isEmpty());
    }

    private static RoutingDecision decision(String modelId) {
        return RoutingDecision.builder()
                .selectedModelId(modelId)
                .intent("general")
                .confidence(1.0)
                .fallbackChainConsidered(List.of(modelId))
                .decidedAt(NOW)
                .resourceBucket(ResourceBucket.NORMAL)
                .build();
    }
}
