package me.golemcore.pulse.adapter.outbound.system;

import me.golemcore.pulse.domain.model.ResourceSnapshot;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JvmSystemMetricsAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final long MB = 1024L * 1024L;
    private static final long GB = 1024L * MB;

    // 16 GB host with a warm page cache: little free, most of it reclaimable.
    private static final String WARM_CACHE_MEMINFO = String.join("\n",
            "MemTotal:       16777216 kB",
            "MemFree:          524288 kB",
            "MemAvailable:   12582912 kB",
            "Buffers:          262144 kB",
            "Cached:         11534336 kB",
            "");

    @TempDir
    Path tempDir;

    private PulseProperties properties;
    private JvmSystemMetricsAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new PulseProperties();
        properties.getMonitor().setConnectivityProbeUrl("http://127.0.0.1:1/");
        properties.getMonitor().setProbeTimeout(Duration.ofMillis(500));
        PulseProperties.ProviderProperties ollama = new PulseProperties.ProviderProperties();
        ollama.setBaseUrl("http://127.0.0.1:1");
        properties.getProviders().put("ollama", ollama);
        adapter = new JvmSystemMetricsAdapter(properties, new OkHttpClient(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldReportUnreachableEndpointsAsUnavailable() {
        assertFalse(adapter.probeConnectivity());
        assertFalse(adapter.probeLocalInference());
    }

    @Test
    void shouldSampleHostMetrics() {
        ResourceSnapshot snapshot = adapter.sample();

        assertTrue(snapshot.getCpuPercent() >= 0.0 && snapshot.getCpuPercent() <= 100.0);
        assertTrue(snapshot.getMemPercent() >= 0.0 && snapshot.getMemPercent() <= 100.0);
        assertTrue(snapshot.getMemAvailableMb() >= 0);
        assertFalse(snapshot.isConnectivity());
        assertFalse(snapshot.isStale());
        assertEquals(NOW, snapshot.getCapturedAt());
    }

    // ===== Memory source =====

    @Test
    void shouldCountReclaimableCacheAsAvailableMemory() throws IOException {
        Path meminfo = writeMeminfo(WARM_CACHE_MEMINFO);

        JvmSystemMetricsAdapter.MemoryReading reading = JvmSystemMetricsAdapter.readMemory(meminfo, 16 * GB,
                512 * MB);

        assertEquals(12 * GB, reading.availableBytes());
        assertEquals(25.0, reading.usedPercent(), 0.001);
    }

    @Test
    void shouldCapMeminfoByContainerLimit() throws IOException {
        Path meminfo = writeMeminfo(WARM_CACHE_MEMINFO);

        JvmSystemMetricsAdapter.MemoryReading reading = JvmSystemMetricsAdapter.readMemory(meminfo, 4 * GB,
                1 * GB);

        assertEquals(4 * GB, reading.totalBytes());
        assertEquals(4 * GB, reading.availableBytes());
        assertEquals(0.0, reading.usedPercent(), 0.001);
    }

    @Test
    void shouldFallBackToFreeMemoryWithoutMeminfo() {
        JvmSystemMetricsAdapter.MemoryReading reading = JvmSystemMetricsAdapter.readMemory(
                tempDir.resolve("missing"), 8 * GB, 2 * GB);

        assertEquals(8 * GB, reading.totalBytes());
        assertEquals(2 * GB, reading.availableBytes());
        assertEquals(75.0, reading.usedPercent(), 0.001);
    }

    @Test
    void shouldFallBackToFreeMemoryWhenMemAvailableIsMissing() throws IOException {
        Path meminfo = writeMeminfo("MemTotal:       16777216 kB\nMemFree:          524288 kB\n");

        JvmSystemMetricsAdapter.MemoryReading reading = JvmSystemMetricsAdapter.readMemory(meminfo, 16 * GB,
                512 * MB);

        assertEquals(512 * MB, reading.availableBytes());
    }

    @Test
    void shouldUseMeminfoWhenSampling() throws IOException {
        Path meminfo = writeMeminfo("MemTotal:       1024 kB\nMemAvailable:    512 kB\n");
        JvmSystemMetricsAdapter withFixture = new JvmSystemMetricsAdapter(properties, new OkHttpClient(),
                Clock.fixed(NOW, ZoneOffset.UTC), meminfo);

        ResourceSnapshot snapshot = withFixture.sample();

        assertEquals(50.0, snapshot.getMemPercent(), 0.001);
        assertEquals(0, snapshot.getMemAvailableMb());
    }

    private Path writeMeminfo(String content) throws IOException {
        Path file = tempDir.resolve("meminfo");
        Files.writeString(file, content);
        return file;
    }
}
