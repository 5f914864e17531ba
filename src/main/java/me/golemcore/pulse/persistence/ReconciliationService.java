package me.golemcore.pulse.persistence;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.ReconciliationReport;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the primary/backup reconciliation pass periodically on a single
 * low-priority daemon thread. Passes never overlap.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    private final PrimaryBackupRepository repository;
    private final PulseProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService scheduler;

    @PostConstruct
    public void start() {
        long intervalMs = properties.getRepository().getReconciliationInterval().toMillis();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "reconciliation");
            t.setDaemon(true);
            t.setPriority(Thread.MIN_PRIORITY);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::runPass, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[Reconciliation] Scheduled every {} ms", intervalMs);
    }

    @PreDestroy
    public void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    /**
     * Runs one pass unless another is in progress.
     *
     * @return the pass report, or a skipped report if a pass was already running
     */
    public ReconciliationReport runPass() {
        if (!running.compareAndSet(false, true)) {
            return ReconciliationReport.skipped();
        }
        try {
            return repository.reconcilePending();
        } catch (RuntimeException e) {
            log.error("[Reconciliation] Pass failed", e);
            return ReconciliationReport.skipped();
        } finally {
            running.set(false);
        }
    }
}
