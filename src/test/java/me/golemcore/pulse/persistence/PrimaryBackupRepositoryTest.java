package me.golemcore.pulse.persistence;

import me.golemcore.pulse.domain.model.CircuitState;
import me.golemcore.pulse.domain.model.Entity;
import me.golemcore.pulse.domain.model.EntityKind;
import me.golemcore.pulse.domain.model.ErrorKind;
import me.golemcore.pulse.domain.model.ReadResult;
import me.golemcore.pulse.domain.model.ReconciliationReport;
import me.golemcore.pulse.domain.model.SyncState;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.EntityRepository;
import me.golemcore.pulse.port.outbound.StorageUnavailableException;
import me.golemcore.pulse.resilience.CircuitBreakerRegistry;
import me.golemcore.pulse.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PrimaryBackupRepositoryTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private EntityRepository primary;
    private EntityRepository backup;
    private CircuitBreakerRegistry breakers;
    private PrimaryBackupRepository repository;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        primary = mock(EntityRepository.class);
        backup = mock(EntityRepository.class);
        when(primary.getName()).thenReturn("primary");
        when(backup.getName()).thenReturn("backup");
        PulseProperties properties = new PulseProperties();
        breakers = new CircuitBreakerRegistry(properties, clock);
        repository = new PrimaryBackupRepository(primary, backup, breakers, properties);
    }

    // ===== save =====

    @Test
    void shouldSaveToPrimaryAndMirrorToBackup() {
        when(primary.save(any())).thenAnswer(inv -> CompletableFuture.completedFuture(inv.getArgument(0)));
        when(backup.save(any())).thenAnswer(inv -> CompletableFuture.completedFuture(inv.getArgument(0)));

        Entity saved = repository.save(entity("turn-1")).join();

        assertEquals(SyncState.SYNCED, saved.getSyncState());
        ArgumentCaptor<Entity> mirrored = ArgumentCaptor.forClass(Entity.class);
        verify(backup, timeout(1000)).save(mirrored.capture());
        assertEquals(SyncState.SYNCED, mirrored.getValue().getSyncState());
    }

    @Test
    void shouldWriteToBackupAsPendingWhenPrimaryFails() {
        when(primary.save(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
        when(backup.save(any())).thenAnswer(inv -> CompletableFuture.completedFuture(inv.getArgument(0)));

        Entity saved = repository.save(entity("turn-1")).join();

        assertEquals(SyncState.PENDING_PRIMARY, saved.getSyncState());
    }

    @Test
    void shouldFailWithStorageUnavailableWhenBothStoresFail() {
        when(primary.save(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
        when(backup.save(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk")));

        CompletableFuture<Entity> result = repository.save(entity("turn-1"));

        CompletionException error = assertThrows(CompletionException.class, result::join);
        assertInstanceOf(StorageUnavailableException.class, error.getCause());
    }

    @Test
    void shouldOpenBreakerAndReconcileAfterPrimaryRecovers() {
        List<Entity> backupState = new ArrayList<>();
        when(primary.save(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
        when(backup.save(any())).thenAnswer(inv -> {
            Entity entity = inv.getArgument(0);
            backupState.removeIf(existing -> existing.getId().equals(entity.getId()));
            backupState.add(entity);
            return CompletableFuture.completedFuture(entity);
        });

        for (int i = 1; i <= 3; i++) {
            repository.save(entity("turn-" + i)).join();
        }
        assertEquals(CircuitState.OPEN, breakers.breaker("primary.save").getState().getState());

        Entity fourth = repository.save(entity("turn-4")).join();

        assertEquals(SyncState.PENDING_PRIMARY, fourth.getSyncState());
        verify(primary, times(3)).save(any());

        clock.advance(Duration.ofSeconds(30));
        when(primary.save(any())).thenAnswer(inv -> CompletableFuture.completedFuture(inv.getArgument(0)));
        when(backup.findBySyncState(SyncState.PENDING_PRIMARY)).thenAnswer(inv -> CompletableFuture.completedFuture(
                backupState.stream().filter(e -> e.getSyncState() == SyncState.PENDING_PRIMARY).toList()));

        ReconciliationReport report = repository.reconcilePending();

        assertEquals(4, report.pending());
        assertEquals(4, report.synced());
        assertFalse(report.stoppedEarly());
        assertTrue(backupState.stream().allMatch(e -> e.getSyncState() == SyncState.SYNCED));
        assertEquals(CircuitState.CLOSED, breakers.breaker("primary.save").getState().getState());
    }

    @Test
    void shouldStopReconciliationWhenPrimaryBreakerIsOpen() {
        when(primary.save(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
        when(backup.findBySyncState(SyncState.PENDING_PRIMARY)).thenReturn(CompletableFuture.completedFuture(
                List.of(pending("a"), pending("b"), pending("c"), pending("d"), pending("e"))));

        ReconciliationReport report = repository.reconcilePending();

        assertTrue(report.stoppedEarly());
        assertEquals(0, report.synced());
        verify(primary, times(3)).save(any());
        verify(backup, never()).save(any());
    }

    // ===== findById =====

    @Test
    void shouldReadFromPrimary() {
        Entity stored = entity("turn-1");
        when(primary.findById("turn-1")).thenReturn(CompletableFuture.completedFuture(Optional.of(stored)));
        when(backup.findById("turn-1")).thenReturn(CompletableFuture.completedFuture(Optional.empty()));

        ReadResult<Entity> result = repository.findById("turn-1").join();

        assertSame(stored, result.getValue());
        assertFalse(result.isDegraded());
    }

    @Test
    void shouldReadBackupOnceAndMarkDegradedWhenPrimaryFails() {
        Entity stored = entity("turn-1");
        when(primary.findById("turn-1")).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
        when(backup.findById("turn-1")).thenReturn(CompletableFuture.completedFuture(Optional.of(stored)));

        ReadResult<Entity> result = repository.findById("turn-1").join();

        assertTrue(result.isSuccess());
        assertTrue(result.isDegraded());
        assertSame(stored, result.getValue());
        verify(backup, times(1)).findById("turn-1");
    }

    @Test
    void shouldReturnStorageUnavailableWhenBothStoresFailToRead() {
        when(primary.findById("turn-1")).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
        when(backup.findById("turn-1")).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("io")));

        ReadResult<Entity> result = repository.findById("turn-1").join();

        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.STORAGE_UNAVAILABLE, result.getErrorKind());
    }

    @Test
    void shouldSurfacePendingBackupEntityOnPrimaryMiss() {
        Entity pending = pending("turn-9");
        when(primary.findById("turn-9")).thenReturn(CompletableFuture.completedFuture(Optional.empty()));
        when(backup.findById("turn-9")).thenReturn(CompletableFuture.completedFuture(Optional.of(pending)));

        ReadResult<Entity> result = repository.findById("turn-9").join();

        assertSame(pending, result.getValue());
        assertTrue(result.isDegraded());
    }

    @Test
    void shouldReturnEmptyResultWhenEntityIsUnknown() {
        when(primary.findById("missing")).thenReturn(CompletableFuture.completedFuture(Optional.empty()));
        when(backup.findById("missing")).thenReturn(CompletableFuture.completedFuture(Optional.empty()));

        ReadResult<Entity> result = repository.findById("missing").join();

        assertTrue(result.isSuccess());
        assertNull(result.getValue());
        assertFalse(result.isDegraded());
    }

    // ===== findByOwnerSession =====

    @Test
    void shouldMergePendingBackupEntitiesIntoSessionRead() {
        Entity older = entity("turn-1");
        clock.advance(Duration.ofMinutes(1));
        Entity newer = pending("turn-2");
        when(primary.findByOwnerSession("s1")).thenReturn(CompletableFuture.completedFuture(List.of(older)));
        when(backup.findByOwnerSession("s1"))
                .thenReturn(CompletableFuture.completedFuture(List.of(older.withSyncState(SyncState.SYNCED), newer)));

        ReadResult<List<Entity>> result = repository.findByOwnerSession("s1").join();

        assertTrue(result.isDegraded());
        assertEquals(List.of("turn-1", "turn-2"), result.getValue().stream().map(Entity::getId).toList());
    }

    // ===== delete =====

    @Test
    void shouldReportDeletedWhenEitherStoreRemovedEntity() {
        when(primary.delete("turn-1")).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
        when(backup.delete("turn-1")).thenReturn(CompletableFuture.completedFuture(true));

        assertTrue(repository.delete("turn-1").join());
    }

    @Test
    void shouldFailDeleteWhenBothStoresFail() {
        when(primary.delete("turn-1")).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
        when(backup.delete("turn-1")).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("io")));

        CompletionException error = assertThrows(CompletionException.class,
                () -> repository.delete("turn-1").join());
        assertInstanceOf(StorageUnavailableException.class, error.getCause());
    }

    @Test
    void shouldCountPendingEntities() {
        when(backup.findBySyncState(SyncState.PENDING_PRIMARY))
                .thenReturn(CompletableFuture.completedFuture(List.of(pending("a"), pending("b"))));

        assertEquals(2L, repository.countPendingPrimary().join());
    }

    private Entity entity(String id) {
        return Entity.builder()
                .id(id)
                .ownerSessionId("s1")
                .kind(EntityKind.CHAT_TURN)
                .payload(Map.of("user", "hi", "assistant", "hello"))
                .createdAt(clock.instant())
                .build();
    }

    private Entity pending(String id) {
        return entity(id).withSyncState(SyncState.PENDING_PRIMARY);
    }
}
