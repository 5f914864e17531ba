package me.golemcore.pulse.domain.service;

import me.golemcore.pulse.domain.model.ResourceSnapshot;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.SystemMetricsPort;
import me.golemcore.pulse.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResourceMonitorTest {

    private MutableClock clock;
    private SystemMetricsPort metricsPort;
    private ResourceMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        metricsPort = mock(SystemMetricsPort.class);
        monitor = new ResourceMonitor(metricsPort, new PulseProperties(), clock);
    }

    @Test
    void shouldServeOptimisticSnapshotBeforeFirstSample() {
        ResourceSnapshot snapshot = monitor.snapshot();

        assertTrue(snapshot.isConnectivity());
        assertEquals(50.0, snapshot.getMemPercent());
        assertEquals(0.0, snapshot.getCpuPercent());
        assertFalse(snapshot.isLocalInferenceAvailable());
        verify(metricsPort, never()).sample();
    }

    @Test
    void shouldReplaceSnapshotOnRefresh() {
        ResourceSnapshot sampled = sample(20.0, 40.0, true);
        when(metricsPort.sample()).thenReturn(sampled);

        monitor.refresh();

        assertSame(sampled, monitor.snapshot());
    }

    @Test
    void shouldKeepLastSnapshotMarkedStaleWhenSamplingFails() {
        when(metricsPort.sample())
                .thenReturn(sample(20.0, 40.0, true))
                .thenThrow(new IllegalStateException("mxbean unavailable"));
        monitor.refresh();

        ResourceSnapshot afterFailure = monitor.refresh();

        assertTrue(afterFailure.isStale());
        assertEquals(20.0, afterFailure.getCpuPercent());
        assertEquals(40.0, afterFailure.getMemPercent());
        assertSame(afterFailure, monitor.snapshot());
    }

    @Test
    void shouldResampleSynchronouslyWhenSnapshotExceedsMaxStaleness() {
        when(metricsPort.sample()).thenAnswer(inv -> sample(10.0, 30.0, true));
        monitor.refresh();
        clock.advance(Duration.ofSeconds(31));

        ResourceSnapshot snapshot = monitor.snapshot();

        assertEquals(clock.instant(), snapshot.getCapturedAt());
        verify(metricsPort, times(2)).sample();
    }

    @Test
    void shouldNotResampleWithinPollIntervalAfterFailedAttempt() {
        when(metricsPort.sample()).thenThrow(new IllegalStateException("down"));
        clock.advance(Duration.ofSeconds(31));

        ResourceSnapshot first = monitor.snapshot();
        clock.advance(Duration.ofSeconds(5));
        ResourceSnapshot second = monitor.snapshot();

        assertTrue(first.isStale());
        assertSame(first, second);
        verify(metricsPort, times(1)).sample();
    }

    @Test
    void shouldReflectConnectivityLoss() {
        when(metricsPort.sample())
                .thenAnswer(inv -> sample(10.0, 30.0, true))
                .thenAnswer(inv -> sample(10.0, 30.0, false));
        monitor.refresh();

        monitor.refresh();

        assertFalse(monitor.snapshot().isConnectivity());
    }

    private ResourceSnapshot sample(double cpu, double mem, boolean online) {
        return ResourceSnapshot.builder()
                .cpuPercent(cpu)
                .memPercent(mem)
                .memAvailableMb(4096)
                .connectivity(online)
                .localInferenceAvailable(false)
                .capturedAt(clock.instant())
                .build();
    }
}
