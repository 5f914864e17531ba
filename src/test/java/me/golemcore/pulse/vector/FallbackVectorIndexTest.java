package me.golemcore.pulse.vector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.pulse.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.pulse.domain.model.BackendOrigin;
import me.golemcore.pulse.domain.model.ScoredVectorRecord;
import me.golemcore.pulse.domain.model.VectorRecord;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FallbackVectorIndexTest {

    @TempDir
    Path tempDir;

    private PulseProperties properties;
    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        properties = new PulseProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    }

    @Test
    void shouldReloadPersistedRecordsOnStartup() {
        FallbackVectorIndex index = new FallbackVectorIndex(storage, properties, objectMapper);
        index.init();
        index.upsert(record("memory/1", new float[] { 0.5f, 0.5f }, Map.of("kind", "MEMORY"))).join();

        FallbackVectorIndex reloaded = new FallbackVectorIndex(storage, properties, objectMapper);
        reloaded.init();

        assertEquals(1, reloaded.size());
        List<ScoredVectorRecord> results = reloaded.query(new float[] { 0.5f, 0.5f }, 1, Map.of());
        assertEquals("memory/1", results.get(0).record().getId());
        assertArrayEquals(new float[] { 0.5f, 0.5f }, results.get(0).record().getEmbedding());
        assertEquals("MEMORY", results.get(0).record().getMetadata().get("kind"));
    }

    @Test
    void shouldReplaceRecordWithSameId() {
        FallbackVectorIndex index = new FallbackVectorIndex(storage, properties, objectMapper);
        index.upsert(record("a", new float[] { 1, 0 }, Map.of())).join();
        index.upsert(record("a", new float[] { 0, 1 }, Map.of())).join();

        assertEquals(1, index.size());
        assertEquals(1.0, index.query(new float[] { 0, 1 }, 1, Map.of()).get(0).score(), 1e-6);
    }

    @Test
    void shouldSkipRecordsOfOtherDimensionsAndNonMatchingFilter() {
        FallbackVectorIndex index = new FallbackVectorIndex(storage, properties, objectMapper);
        index.upsert(record("two-d", new float[] { 1, 0 }, Map.of("kind", "MEMORY"))).join();
        index.upsert(record("three-d", new float[] { 1, 0, 0 }, Map.of("kind", "MEMORY"))).join();
        index.upsert(record("turn", new float[] { 1, 0 }, Map.of("kind", "CHAT_TURN"))).join();

        List<ScoredVectorRecord> results = index.query(new float[] { 1, 0 }, 10, Map.of("kind", "MEMORY"));

        assertEquals(List.of("two-d"), results.stream().map(s -> s.record().getId()).toList());
    }

    @Test
    void shouldSkipUnreadableFilesOnLoad() throws Exception {
        Files.writeString(tempDir.resolve("vectors").resolve("broken.json"), "{not json");
        FallbackVectorIndex index = new FallbackVectorIndex(storage, properties, objectMapper);

        index.init();

        assertEquals(0, index.size());
        assertTrue(Files.exists(tempDir.resolve("vectors").resolve("broken.json")));
    }

    private static VectorRecord record(String id, float[] vector, Map<String, String> metadata) {
        return VectorRecord.builder()
                .id(id)
                .embedding(vector)
                .metadata(metadata)
                .backendOrigin(BackendOrigin.FALLBACK)
                .createdAt(Instant.parse("2026-03-01T10:00:00Z"))
                .build();
    }
}
