package me.golemcore.pulse.domain.service;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.ResourceSnapshot;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.SystemMetricsPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps a cached {@link ResourceSnapshot} fresh.
 *
 * <p>
 * A background task re-samples every {@code pulse.monitor.poll-interval}.
 * {@link #snapshot()} is a plain cached read unless the snapshot is older than
 * {@code pulse.monitor.max-staleness}, in which case it refreshes
 * synchronously. A failed sample keeps the last good snapshot, marked stale;
 * while sampling keeps failing, synchronous refreshes are attempted at most
 * once per poll interval.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ResourceMonitor {

    private final SystemMetricsPort metricsPort;
    private final PulseProperties properties;
    private final Clock clock;

    private final AtomicReference<ResourceSnapshot> current;
    private final Object refreshLock = new Object();
    private volatile Instant lastAttemptAt;
    private ScheduledExecutorService scheduler;

    public ResourceMonitor(SystemMetricsPort metricsPort, PulseProperties properties, Clock clock) {
        this.metricsPort = metricsPort;
        this.properties = properties;
        this.clock = clock;
        this.current = new AtomicReference<>(ResourceSnapshot.optimistic(clock.instant()));
    }

    @PostConstruct
    public void start() {
        refresh();
        long intervalMs = properties.getMonitor().getPollInterval().toMillis();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "resource-monitor");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::refresh, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    /**
     * Cached snapshot, refreshed synchronously first if it exceeds the maximum
     * staleness.
     */
    public ResourceSnapshot snapshot() {
        ResourceSnapshot snapshot = current.get();
        if (!isTooOld(snapshot)) {
            return snapshot;
        }
        synchronized (refreshLock) {
            snapshot = current.get();
            if (!isTooOld(snapshot) || recentlyAttempted()) {
                return snapshot;
            }
            return sampleLocked();
        }
    }

    /**
     * Blocking re-sample. Never throws; on failure returns the previous snapshot
     * marked stale.
     */
    public ResourceSnapshot refresh() {
        synchronized (refreshLock) {
            return sampleLocked();
        }
    }

    private ResourceSnapshot sampleLocked() {
        lastAttemptAt = clock.instant();
        try {
            ResourceSnapshot fresh = metricsPort.sample();
            ResourceSnapshot previous = current.getAndSet(fresh);
            logChanges(previous, fresh);
            return fresh;
        } catch (RuntimeException e) {
            ResourceSnapshot stale = current.get().markStale();
            current.set(stale);
            log.warn("[Monitor] Sampling failed, keeping last snapshot from {}: {}", stale.getCapturedAt(),
                    e.getMessage());
            return stale;
        }
    }

    private boolean isTooOld(ResourceSnapshot snapshot) {
        return snapshot.age(clock.instant()).compareTo(properties.getMonitor().getMaxStaleness()) > 0;
    }

    private boolean recentlyAttempted() {
        Instant attempt = lastAttemptAt;
        return attempt != null
                && Duration.between(attempt, clock.instant()).compareTo(properties.getMonitor().getPollInterval()) < 0;
    }

    private void logChanges(ResourceSnapshot previous, ResourceSnapshot fresh) {
        if (previous.isConnectivity() != fresh.isConnectivity()) {
            log.info("[Monitor] Connectivity {}", fresh.isConnectivity() ? "restored" : "lost");
        }
        if (previous.isLocalInferenceAvailable() != fresh.isLocalInferenceAvailable()) {
            log.info("[Monitor] Local inference {}", fresh.isLocalInferenceAvailable() ? "available" : "unavailable");
        }
        log.debug("[Monitor] cpu={}% mem={}% online={} local={}", Math.round(fresh.getCpuPercent()),
                Math.round(fresh.getMemPercent()), fresh.isConnectivity(), fresh.isLocalInferenceAvailable());
    }
}
