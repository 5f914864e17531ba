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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.Entity;
import me.golemcore.pulse.domain.model.ErrorKind;
import me.golemcore.pulse.domain.model.ReadResult;
import me.golemcore.pulse.domain.model.ReconciliationReport;
import me.golemcore.pulse.domain.model.SyncState;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.EntityRepository;
import me.golemcore.pulse.port.outbound.StorageUnavailableException;
import me.golemcore.pulse.resilience.CircuitBreakerRegistry;
import me.golemcore.pulse.resilience.CircuitOpenException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Resilient composition of a primary and a backup {@link EntityRepository}.
 *
 * <p>
 * Writes go to the primary first. On success the entity is {@code SYNCED} and a
 * best-effort copy is written to the backup in the background. When the primary
 * fails or its breaker is open, the entity is written to the backup as
 * {@code PENDING_PRIMARY} and the write still succeeds; a later
 * {@link #reconcilePending()} pass copies it to the primary. Only when both
 * tiers fail does a write fail with {@link StorageUnavailableException}.
 *
 * <p>
 * Reads are served by the primary. A failed or rejected primary read falls back
 * to exactly one backup read and the envelope is marked degraded.
 *
 * <p>
 * Every tier operation has its own breaker ({@code primary.save},
 * {@code backup.findById}, ...) and is bounded by the storage timeout. Ids
 * failing {@link Entity#isValidId} are rejected with
 * {@link IllegalArgumentException} before any tier or breaker is involved.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class PrimaryBackupRepository {

    private static final Comparator<Entity> BY_CREATED_AT = Comparator.comparing(Entity::getCreatedAt,
            Comparator.nullsFirst(Comparator.naturalOrder()));

    private final EntityRepository primary;
    private final EntityRepository backup;
    private final CircuitBreakerRegistry breakers;
    private final PulseProperties properties;

    public PrimaryBackupRepository(@Qualifier("primaryEntityRepository") EntityRepository primary,
            @Qualifier("backupEntityRepository") EntityRepository backup,
            CircuitBreakerRegistry breakers, PulseProperties properties) {
        this.primary = primary;
        this.backup = backup;
        this.breakers = breakers;
        this.properties = properties;
    }

    // ===== Writes =====

    /**
     * Stores the entity, completing with the entity as stored (its sync state
     * tells which tier holds it).
     */
    public CompletableFuture<Entity> save(Entity entity) {
        if (!Entity.isValidId(entity.getId())) {
            return invalidId(entity.getId());
        }
        Entity synced = entity.withSyncState(SyncState.SYNCED);
        return call(primary, "save", () -> primary.save(synced))
                .thenApply(saved -> {
                    mirrorToBackup(saved);
                    return saved;
                })
                .exceptionallyCompose(primaryError -> {
                    log.warn("[Repository] Primary save failed for {}, writing to backup: {}", entity.getId(),
                            describe(primaryError));
                    Entity pending = entity.withSyncState(SyncState.PENDING_PRIMARY);
                    return call(backup, "save", () -> backup.save(pending))
                            .exceptionallyCompose(backupError -> CompletableFuture.failedFuture(
                                    new StorageUnavailableException(
                                            "Both stores rejected save of " + entity.getId(),
                                            unwrap(backupError))));
                });
    }

    /**
     * Deletes from the primary through its breaker and from the backup best
     * effort. Completes with {@code true} if either tier removed the entity.
     */
    public CompletableFuture<Boolean> delete(String id) {
        if (!Entity.isValidId(id)) {
            return invalidId(id);
        }
        CompletableFuture<Optional<Boolean>> primaryResult = call(primary, "delete", () -> primary.delete(id))
                .thenApply(Optional::of)
                .exceptionally(e -> {
                    log.warn("[Repository] Primary delete failed for {}: {}", id, describe(e));
                    return Optional.empty();
                });
        CompletableFuture<Optional<Boolean>> backupResult = call(backup, "delete", () -> backup.delete(id))
                .thenApply(Optional::of)
                .exceptionally(e -> {
                    log.debug("[Repository] Backup delete failed for {}: {}", id, describe(e));
                    return Optional.empty();
                });
        return primaryResult.thenCombine(backupResult, (p, b) -> {
            if (p.isEmpty() && b.isEmpty()) {
                throw new StorageUnavailableException("Both stores rejected delete of " + id, null);
            }
            return p.orElse(false) || b.orElse(false);
        });
    }

    // ===== Reads =====

    public CompletableFuture<ReadResult<Entity>> findById(String id) {
        if (!Entity.isValidId(id)) {
            return invalidId(id);
        }
        return call(primary, "findById", () -> primary.findById(id))
                .thenCompose(found -> found.isPresent()
                        ? CompletableFuture.completedFuture(ReadResult.of(found.get()))
                        : findPendingInBackup(id))
                .exceptionallyCompose(e -> {
                    log.warn("[Repository] Primary read failed for {}, reading backup: {}", id, describe(e));
                    return call(backup, "findById", () -> backup.findById(id))
                            .thenApply(found -> ReadResult.degraded(found.orElse(null)))
                            .exceptionally(backupError -> {
                                log.error("[Repository] Both stores failed to read {}: {}", id,
                                        describe(backupError));
                                return ReadResult.failed(ErrorKind.STORAGE_UNAVAILABLE);
                            });
                });
    }

    /**
     * Session entities, oldest first. Entities that only reached the backup
     * (awaiting reconciliation) are merged into the primary's answer.
     */
    public CompletableFuture<ReadResult<List<Entity>>> findByOwnerSession(String sessionId) {
        return call(primary, "findByOwnerSession", () -> primary.findByOwnerSession(sessionId))
                .thenCompose(fromPrimary -> mergePendingFromBackup(sessionId, fromPrimary))
                .exceptionallyCompose(e -> {
                    log.warn("[Repository] Primary session read failed for {}, reading backup: {}", sessionId,
                            describe(e));
                    return call(backup, "findByOwnerSession", () -> backup.findByOwnerSession(sessionId))
                            .thenApply(ReadResult::degraded)
                            .exceptionally(backupError -> ReadResult.failed(ErrorKind.STORAGE_UNAVAILABLE));
                });
    }

    /**
     * Number of entities waiting in the backup for the primary.
     */
    public CompletableFuture<Long> countPendingPrimary() {
        return call(backup, "findBySyncState", () -> backup.findBySyncState(SyncState.PENDING_PRIMARY))
                .thenApply(pending -> (long) pending.size());
    }

    // ===== Reconciliation =====

    /**
     * Copies backup entities in {@code PENDING_PRIMARY} to the primary, oldest
     * first, and marks them {@code SYNCED} in the backup. Runs sequentially on
     * the calling thread and stops at the first breaker rejection.
     */
    public ReconciliationReport reconcilePending() {
        List<Entity> pending;
        try {
            pending = call(backup, "findBySyncState", () -> backup.findBySyncState(SyncState.PENDING_PRIMARY))
                    .join();
        } catch (CompletionException e) {
            log.warn("[Reconciliation] Cannot list pending entities: {}", describe(e));
            return ReconciliationReport.skipped();
        }
        if (pending.isEmpty()) {
            return new ReconciliationReport(0, 0, 0, false);
        }

        int batchSize = properties.getRepository().getReconciliationBatchSize();
        int synced = 0;
        int failed = 0;
        for (Entity entity : pending.subList(0, Math.min(batchSize, pending.size()))) {
            Entity target = entity.withSyncState(SyncState.SYNCED);
            try {
                call(primary, "save", () -> primary.save(target)).join();
            } catch (CompletionException e) {
                failed++;
                if (unwrap(e) instanceof CircuitOpenException) {
                    log.info("[Reconciliation] Primary breaker open, stopping pass after {} synced", synced);
                    return new ReconciliationReport(pending.size(), synced, failed, true);
                }
                log.warn("[Reconciliation] Primary save failed for {}: {}", entity.getId(), describe(e));
                continue;
            }
            synced++;
            try {
                call(backup, "save", () -> backup.save(target)).join();
            } catch (CompletionException e) {
                // Primary copy exists; the next pass re-saves it idempotently
                log.warn("[Reconciliation] Could not mark {} as synced in backup: {}", entity.getId(),
                        describe(e));
            }
        }
        log.info("[Reconciliation] Pass finished: {} pending, {} synced, {} failed", pending.size(), synced,
                failed);
        return new ReconciliationReport(pending.size(), synced, failed, false);
    }

    // ===== Internals =====

    private CompletableFuture<ReadResult<Entity>> findPendingInBackup(String id) {
        return call(backup, "findById", () -> backup.findById(id))
                .thenApply(found -> found
                        .filter(entity -> entity.getSyncState() == SyncState.PENDING_PRIMARY)
                        .map(ReadResult::degraded)
                        .orElseGet(() -> ReadResult.of(null)))
                .exceptionally(e -> ReadResult.of(null));
    }

    private CompletableFuture<ReadResult<List<Entity>>> mergePendingFromBackup(String sessionId,
            List<Entity> fromPrimary) {
        return call(backup, "findByOwnerSession", () -> backup.findByOwnerSession(sessionId))
                .thenApply(fromBackup -> {
                    Set<String> known = new HashSet<>();
                    fromPrimary.forEach(entity -> known.add(entity.getId()));
                    List<Entity> merged = new ArrayList<>(fromPrimary);
                    boolean degraded = false;
                    for (Entity entity : fromBackup) {
                        if (entity.getSyncState() == SyncState.PENDING_PRIMARY && known.add(entity.getId())) {
                            merged.add(entity);
                            degraded = true;
                        }
                    }
                    merged.sort(BY_CREATED_AT);
                    return degraded ? ReadResult.degraded(List.copyOf(merged)) : ReadResult.of(List.copyOf(merged));
                })
                .exceptionally(e -> {
                    log.debug("[Repository] Backup merge skipped for session {}: {}", sessionId, describe(e));
                    return ReadResult.of(fromPrimary);
                });
    }

    private void mirrorToBackup(Entity saved) {
        call(backup, "save", () -> backup.save(saved)).whenComplete((ignored, e) -> {
            if (e != null) {
                log.warn("[Repository] Backup copy of {} failed: {}", saved.getId(), describe(e));
            }
        });
    }

    private <T> CompletableFuture<T> call(EntityRepository repository, String operation,
            Supplier<CompletableFuture<T>> action) {
        long timeoutMs = properties.getRepository().getTimeout().toMillis();
        return breakers.breaker(repository.getName() + "." + operation)
                .execute(() -> action.get().orTimeout(timeoutMs, TimeUnit.MILLISECONDS));
    }

    private static <T> CompletableFuture<T> invalidId(String id) {
        return CompletableFuture.failedFuture(new IllegalArgumentException("Invalid entity id: " + id));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        Throwable cause = unwrap(error);
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
