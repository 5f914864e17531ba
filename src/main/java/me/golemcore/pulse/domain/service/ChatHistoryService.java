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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.Entity;
import me.golemcore.pulse.domain.model.EntityKind;
import me.golemcore.pulse.domain.model.ErrorKind;
import me.golemcore.pulse.domain.model.ReadResult;
import me.golemcore.pulse.domain.model.ScoredVectorRecord;
import me.golemcore.pulse.domain.model.WriteAck;
import me.golemcore.pulse.execution.ErrorClassifier;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.persistence.PrimaryBackupRepository;
import me.golemcore.pulse.persistence.SessionWriteQueue;
import me.golemcore.pulse.port.outbound.EmbeddingPort;
import me.golemcore.pulse.vector.VectorStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Session history: chat turns and memories persisted through the
 * primary/backup repository and indexed in the vector store for recall.
 *
 * <p>
 * Writes of one session are applied in submission order. Indexing happens
 * after a successful write and never fails the write: an unavailable embedder
 * or vector store only costs recall.
 */
@Service
@Slf4j
public class ChatHistoryService {

    public static final String PAYLOAD_USER = "user";
    public static final String PAYLOAD_ASSISTANT = "assistant";
    public static final String PAYLOAD_MODEL = "modelId";
    public static final String PAYLOAD_CATEGORY = "category";
    public static final String PAYLOAD_CONTENT = "content";

    public static final String META_SESSION = "sessionId";
    public static final String META_KIND = "kind";
    public static final String META_TEXT = "text";
    public static final String META_CATEGORY = "category";

    private final PrimaryBackupRepository repository;
    private final SessionWriteQueue writeQueue;
    private final VectorStore vectorStore;
    private final EmbeddingPort embeddingPort;
    private final PulseProperties properties;
    private final Clock clock;

    public ChatHistoryService(PrimaryBackupRepository repository, SessionWriteQueue writeQueue,
            VectorStore vectorStore, EmbeddingPort embeddingPort, PulseProperties properties, Clock clock) {
        this.repository = repository;
        this.writeQueue = writeQueue;
        this.vectorStore = vectorStore;
        this.embeddingPort = embeddingPort;
        this.properties = properties;
        this.clock = clock;
    }

    // ===== Writes =====

    public CompletableFuture<WriteAck> write(Entity entity) {
        String invalid = validate(entity);
        if (invalid != null) {
            log.warn("[History] Rejected write: {}", invalid);
            return CompletableFuture.completedFuture(
                    WriteAck.failed(entity != null ? entity.getId() : null, ErrorKind.VALIDATION));
        }
        return writeQueue.submit(entity.getOwnerSessionId(), () -> repository.save(entity))
                .thenApply(WriteAck::stored)
                .exceptionally(e -> {
                    ErrorKind kind = ErrorClassifier.classify(e);
                    log.error("[History] Write of {} failed ({}): {}", entity.getId(), kind,
                            ErrorClassifier.unwrap(e).getMessage());
                    return WriteAck.failed(entity.getId(), kind);
                });
    }

    /**
     * Persists a completed exchange as a chat turn and indexes it.
     */
    public CompletableFuture<WriteAck> recordInteraction(String sessionId, String userInput, String response,
            String modelId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PAYLOAD_USER, userInput);
        payload.put(PAYLOAD_ASSISTANT, response);
        payload.put(PAYLOAD_MODEL, modelId);
        Entity entity = newEntity(sessionId, EntityKind.CHAT_TURN, payload);
        String text = "User: " + userInput + "\nAssistant: " + response;
        return writeAndIndex(entity, text, Map.of());
    }

    public CompletableFuture<WriteAck> addMemory(String sessionId, String category, String content) {
        if (content == null || content.isBlank()) {
            return CompletableFuture.completedFuture(WriteAck.failed(null, ErrorKind.VALIDATION));
        }
        String resolvedCategory = category != null && !category.isBlank() ? category : "general";
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PAYLOAD_CATEGORY, resolvedCategory);
        payload.put(PAYLOAD_CONTENT, content);
        Entity entity = newEntity(sessionId, EntityKind.MEMORY, payload);
        return writeAndIndex(entity, content, Map.of(META_CATEGORY, resolvedCategory));
    }

    // ===== Reads =====

    public CompletableFuture<ReadResult<Entity>> read(String id) {
        if (!Entity.isValidId(id)) {
            log.warn("[History] Rejected read of invalid id: {}", id);
            return CompletableFuture.completedFuture(ReadResult.failed(ErrorKind.VALIDATION));
        }
        return repository.findById(id);
    }

    /**
     * The last {@code limit} chat turns of a session, oldest first.
     */
    public CompletableFuture<ReadResult<List<Entity>>> recentTurns(String sessionId, int limit) {
        return repository.findByOwnerSession(sessionId).thenApply(result -> {
            if (!result.isSuccess()) {
                return result;
            }
            List<Entity> turns = result.getValue().stream()
                    .filter(entity -> entity.getKind() == EntityKind.CHAT_TURN)
                    .toList();
            List<Entity> recent = turns.subList(Math.max(0, turns.size() - limit), turns.size());
            return result.isDegraded() ? ReadResult.degraded(List.copyOf(recent)) : ReadResult.of(List.copyOf(recent));
        });
    }

    /**
     * Embeds the query text and returns the nearest indexed records. Fails when
     * no embedding model is configured.
     */
    public CompletableFuture<List<ScoredVectorRecord>> search(String queryText, int k, Map<String, String> filter) {
        if (!embeddingPort.isAvailable()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Embedding model not configured"));
        }
        return embed(queryText).thenCompose(vector -> vectorStore.queryAsync(vector, k, filter));
    }

    // ===== Internals =====

    private CompletableFuture<WriteAck> writeAndIndex(Entity entity, String text, Map<String, String> extraMetadata) {
        return write(entity).thenCompose(ack -> {
            if (!ack.isSuccess()) {
                return CompletableFuture.completedFuture(ack);
            }
            Map<String, String> metadata = new HashMap<>(extraMetadata);
            metadata.put(META_SESSION, entity.getOwnerSessionId());
            metadata.put(META_KIND, entity.getKind().name());
            metadata.put(META_TEXT, text);
            return index(entity.getId(), text, metadata).thenApply(ignored -> ack);
        });
    }

    private CompletableFuture<Void> index(String id, String text, Map<String, String> metadata) {
        if (!embeddingPort.isAvailable()) {
            log.debug("[History] Embeddings not configured, {} is not indexed", id);
            return CompletableFuture.completedFuture(null);
        }
        return embed(text)
                .thenAccept(vector -> vectorStore.upsert(id, vector, metadata))
                .exceptionally(e -> {
                    log.warn("[History] Indexing of {} failed: {}", id, ErrorClassifier.unwrap(e).getMessage());
                    return null;
                });
    }

    private CompletableFuture<float[]> embed(String text) {
        long timeoutMs = properties.getEmbedding().getTimeout().toMillis();
        return embeddingPort.embed(text).orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    private Entity newEntity(String sessionId, EntityKind kind, Map<String, Object> payload) {
        return Entity.builder()
                .id(UUID.randomUUID().toString())
                .ownerSessionId(sessionId)
                .kind(kind)
                .payload(payload)
                .createdAt(clock.instant())
                .build();
    }

    private static String validate(Entity entity) {
        if (entity == null) {
            return "entity is null";
        }
        if (!Entity.isValidId(entity.getId())) {
            return "entity id '" + entity.getId() + "' is not a valid id";
        }
        if (entity.getOwnerSessionId() == null || entity.getOwnerSessionId().isBlank()) {
            return "owner session of " + entity.getId() + " is blank";
        }
        if (entity.getKind() == null) {
            return "kind of " + entity.getId() + " is missing";
        }
        return null;
    }
}
