package me.golemcore.pulse.adapter.outbound.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.pulse.domain.model.Entity;
import me.golemcore.pulse.domain.model.EntityKind;
import me.golemcore.pulse.domain.model.SyncState;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalEntityRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private LocalEntityRepository repository;

    @BeforeEach
    void setUp() {
        PulseProperties properties = new PulseProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        repository = new LocalEntityRepository(storage, properties, objectMapper);
    }

    @Test
    void shouldSaveAndReadEntity() {
        Entity entity = entity("turn-1", "s1", T0, SyncState.PENDING_PRIMARY);

        repository.save(entity).join();
        Optional<Entity> found = repository.findById("turn-1").join();

        assertTrue(found.isPresent());
        assertEquals(entity, found.get());
        assertTrue(Files.exists(tempDir.resolve("entities").resolve("turn-1.json")));
    }

    @Test
    void shouldReturnEmptyForUnknownId() {
        assertTrue(repository.findById("nope").join().isEmpty());
    }

    @Test
    void shouldRejectUnsafeIdsWithFailedFutures() {
        CompletableFuture<Optional<Entity>> read = repository.findById("../etc/passwd");
        CompletableFuture<Entity> write = repository.save(entity("a/b", "s1", T0, SyncState.SYNCED));
        CompletableFuture<Boolean> delete = repository.delete("user:42");

        CompletionException readError = assertThrows(CompletionException.class, read::join);
        assertInstanceOf(IllegalArgumentException.class, readError.getCause());
        CompletionException writeError = assertThrows(CompletionException.class, write::join);
        assertInstanceOf(IllegalArgumentException.class, writeError.getCause());
        assertTrue(delete.isCompletedExceptionally());
        assertFalse(Files.exists(tempDir.resolve("a")));
    }

    @Test
    void shouldFindSessionEntitiesOldestFirst() {
        repository.save(entity("b", "s1", T0.plusSeconds(60), SyncState.SYNCED)).join();
        repository.save(entity("a", "s1", T0, SyncState.SYNCED)).join();
        repository.save(entity("c", "s2", T0, SyncState.SYNCED)).join();

        List<Entity> session = repository.findByOwnerSession("s1").join();

        assertEquals(List.of("a", "b"), session.stream().map(Entity::getId).toList());
    }

    @Test
    void shouldFindBySyncState() {
        repository.save(entity("a", "s1", T0, SyncState.SYNCED)).join();
        repository.save(entity("b", "s1", T0, SyncState.PENDING_PRIMARY)).join();

        List<Entity> pending = repository.findBySyncState(SyncState.PENDING_PRIMARY).join();

        assertEquals(List.of("b"), pending.stream().map(Entity::getId).toList());
    }

    @Test
    void shouldOverwriteOnSecondSave() {
        repository.save(entity("a", "s1", T0, SyncState.PENDING_PRIMARY)).join();
        repository.save(entity("a", "s1", T0, SyncState.SYNCED)).join();

        assertEquals(SyncState.SYNCED, repository.findById("a").join().orElseThrow().getSyncState());
        assertTrue(repository.findBySyncState(SyncState.PENDING_PRIMARY).join().isEmpty());
    }

    @Test
    void shouldDeleteEntity() {
        repository.save(entity("a", "s1", T0, SyncState.SYNCED)).join();

        assertTrue(repository.delete("a").join());
        assertFalse(repository.delete("a").join());
        assertTrue(repository.findById("a").join().isEmpty());
    }

    @Test
    void shouldSkipCorruptFilesWhenScanning() throws Exception {
        repository.save(entity("a", "s1", T0, SyncState.SYNCED)).join();
        Files.writeString(tempDir.resolve("entities").resolve("broken.json"), "{oops");

        List<Entity> session = repository.findByOwnerSession("s1").join();

        assertEquals(1, session.size());
    }

    private static Entity entity(String id, String sessionId, Instant createdAt, SyncState state) {
        return Entity.builder()
                .id(id)
                .ownerSessionId(sessionId)
                .kind(EntityKind.CHAT_TURN)
                .payload(Map.of("user", "hello", "assistant", "hi there"))
                .createdAt(createdAt)
                .syncState(state)
                .build();
    }
}
