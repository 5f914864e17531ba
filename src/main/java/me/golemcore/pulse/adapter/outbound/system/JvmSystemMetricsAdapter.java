package me.golemcore.pulse.adapter.outbound.system;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.adapter.outbound.llm.OllamaProviderAdapter;
import me.golemcore.pulse.domain.model.ResourceSnapshot;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.SystemMetricsPort;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Samples CPU and memory from the platform {@code OperatingSystemMXBean} and
 * probes reachability with short-timeout HTTP calls.
 *
 * <p>
 * Available memory includes reclaimable page cache: on Linux it is
 * {@code MemAvailable} from {@code /proc/meminfo}, capped by the container-aware
 * total reported by the MXBean. Where meminfo is missing or unreadable the
 * MXBean's free memory is used.
 *
 * <p>
 * Connectivity is a HEAD request to {@code pulse.monitor.connectivity-probe-url}
 * (any HTTP response counts as online). Local inference is available when the
 * Ollama server answers {@code GET /api/tags} successfully.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class JvmSystemMetricsAdapter implements SystemMetricsPort {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;
    private static final Path PROC_MEMINFO = Path.of("/proc/meminfo");

    private final PulseProperties properties;
    private final OkHttpClient probeClient;
    private final Clock clock;
    private final Path meminfoPath;

    @Autowired
    public JvmSystemMetricsAdapter(PulseProperties properties, OkHttpClient okHttpClient, Clock clock) {
        this(properties, okHttpClient, clock, PROC_MEMINFO);
    }

    JvmSystemMetricsAdapter(PulseProperties properties, OkHttpClient okHttpClient, Clock clock, Path meminfoPath) {
        this.properties = properties;
        this.clock = clock;
        this.meminfoPath = meminfoPath;
        long probeTimeoutMs = properties.getMonitor().getProbeTimeout().toMillis();
        this.probeClient = okHttpClient.newBuilder()
                .callTimeout(probeTimeoutMs, TimeUnit.MILLISECONDS)
                .connectTimeout(probeTimeoutMs, TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(false)
                .build();
    }

    @Override
    public ResourceSnapshot sample() {
        java.lang.management.OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (!(os instanceof com.sun.management.OperatingSystemMXBean mx)) {
            throw new IllegalStateException("Host metrics not available on this JVM: " + os.getClass().getName());
        }

        MemoryReading memory = readMemory(meminfoPath, mx.getTotalMemorySize(), mx.getFreeMemorySize());
        double cpuLoad = mx.getCpuLoad();
        double cpuPercent = cpuLoad < 0 ? 0.0 : cpuLoad * 100.0;

        ResourceSnapshot snapshot = ResourceSnapshot.builder()
                .cpuPercent(cpuPercent)
                .memAvailableMb((long) (memory.availableBytes() / BYTES_PER_MB))
                .memPercent(memory.usedPercent())
                .connectivity(probeConnectivity())
                .localInferenceAvailable(probeLocalInference())
                .capturedAt(clock.instant())
                .stale(false)
                .build();
        log.trace("[Monitor] Sampled {}", snapshot);
        return snapshot;
    }

    static MemoryReading readMemory(Path meminfo, long mxTotalBytes, long mxFreeBytes) {
        if (mxTotalBytes <= 0) {
            throw new IllegalStateException("Total memory size not reported");
        }
        Optional<MemoryReading> fromMeminfo = parseMeminfo(meminfo);
        if (fromMeminfo.isEmpty()) {
            return new MemoryReading(mxTotalBytes, Math.max(0, Math.min(mxFreeBytes, mxTotalBytes)));
        }
        long total = Math.min(mxTotalBytes, fromMeminfo.get().totalBytes());
        long available = Math.min(fromMeminfo.get().availableBytes(), total);
        return new MemoryReading(total, available);
    }

    private static Optional<MemoryReading> parseMeminfo(Path meminfo) {
        if (meminfo == null || !Files.isReadable(meminfo)) {
            return Optional.empty();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(meminfo);
        } catch (IOException e) {
            log.debug("[Monitor] Cannot read {}: {}", meminfo, e.getMessage());
            return Optional.empty();
        }
        long totalKb = -1;
        long availableKb = -1;
        for (String line : lines) {
            if (line.startsWith("MemTotal:")) {
                totalKb = parseKb(line);
            } else if (line.startsWith("MemAvailable:")) {
                availableKb = parseKb(line);
            }
        }
        if (totalKb <= 0 || availableKb < 0) {
            return Optional.empty();
        }
        return Optional.of(new MemoryReading(totalKb * 1024, availableKb * 1024));
    }

    // "MemAvailable:   12345678 kB"
    private static long parseKb(String line) {
        String[] parts = line.trim().split("\\s+");
        if (parts.length < 2) {
            return -1;
        }
        try {
            return Long.parseLong(parts[1]);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    record MemoryReading(long totalBytes, long availableBytes) {

        double usedPercent() {
            return (totalBytes - availableBytes) * 100.0 / totalBytes;
        }
    }

    boolean probeConnectivity() {
        Request request = new Request.Builder()
                .url(properties.getMonitor().getConnectivityProbeUrl())
                .head()
                .build();
        try (Response response = probeClient.newCall(request).execute()) {
            return true;
        } catch (IOException | IllegalArgumentException e) {
            log.debug("[Monitor] Connectivity probe failed: {}", e.getMessage());
            return false;
        }
    }

    boolean probeLocalInference() {
        Request request = new Request.Builder()
                .url(OllamaProviderAdapter.baseUrl(properties) + "/api/tags")
                .get()
                .build();
        try (Response response = probeClient.newCall(request).execute()) {
            return response.isSuccessful();
        } catch (IOException | IllegalArgumentException e) {
            log.debug("[Monitor] Local inference probe failed: {}", e.getMessage());
            return false;
        }
    }
}
