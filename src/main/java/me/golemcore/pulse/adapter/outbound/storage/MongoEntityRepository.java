package me.golemcore.pulse.adapter.outbound.storage;

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

import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.Sorts;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.Entity;
import me.golemcore.pulse.domain.model.EntityKind;
import me.golemcore.pulse.domain.model.SyncState;
import me.golemcore.pulse.infrastructure.concurrent.InterruptibleFuture;
import me.golemcore.pulse.port.outbound.EntityRepository;
import org.bson.Document;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Primary entity repository backed by MongoDB.
 *
 * <p>
 * The sync driver blocks, so every call runs on the storage executor. Saves
 * are upserts keyed by the entity id, which makes re-saving during
 * reconciliation idempotent.
 *
 * @since 1.0
 */
@Component("primaryEntityRepository")
@Slf4j
public class MongoEntityRepository implements EntityRepository {

    static final String FIELD_ID = "_id";
    static final String FIELD_SESSION = "ownerSessionId";
    static final String FIELD_KIND = "kind";
    static final String FIELD_PAYLOAD = "payload";
    static final String FIELD_CREATED_AT = "createdAt";
    static final String FIELD_SYNC_STATE = "syncState";

    private final MongoCollection<Document> collection;
    private final ExecutorService executor;

    public MongoEntityRepository(MongoCollection<Document> entityCollection,
            @Qualifier("storageExecutor") ExecutorService executor) {
        this.collection = entityCollection;
        this.executor = executor;
    }

    @PostConstruct
    public void init() {
        executor.execute(() -> {
            try {
                collection.createIndex(Indexes.ascending(FIELD_SESSION, FIELD_CREATED_AT));
                collection.createIndex(Indexes.ascending(FIELD_SYNC_STATE));
                log.debug("[PrimaryStore] Indexes ensured");
            } catch (MongoException e) {
                log.warn("[PrimaryStore] Could not ensure indexes: {}", e.getMessage());
            }
        });
    }

    @Override
    public String getName() {
        return "primary";
    }

    @Override
    public CompletableFuture<Optional<Entity>> findById(String id) {
        return InterruptibleFuture.supplyAsync(
                () -> Optional.ofNullable(collection.find(Filters.eq(FIELD_ID, id)).first())
                        .map(MongoEntityRepository::toEntity),
                executor);
    }

    @Override
    public CompletableFuture<Entity> save(Entity entity) {
        return InterruptibleFuture.supplyAsync(() -> {
            collection.replaceOne(Filters.eq(FIELD_ID, entity.getId()), toDocument(entity),
                    new ReplaceOptions().upsert(true));
            return entity;
        }, executor);
    }

    @Override
    public CompletableFuture<Boolean> delete(String id) {
        return InterruptibleFuture.supplyAsync(
                () -> collection.deleteOne(Filters.eq(FIELD_ID, id)).getDeletedCount() > 0,
                executor);
    }

    @Override
    public CompletableFuture<List<Entity>> findByOwnerSession(String sessionId) {
        return InterruptibleFuture.supplyAsync(() -> toEntities(collection
                .find(Filters.eq(FIELD_SESSION, sessionId))
                .sort(Sorts.ascending(FIELD_CREATED_AT))
                .into(new ArrayList<>())), executor);
    }

    @Override
    public CompletableFuture<List<Entity>> findBySyncState(SyncState state) {
        return InterruptibleFuture.supplyAsync(() -> toEntities(collection
                .find(Filters.eq(FIELD_SYNC_STATE, state.name()))
                .sort(Sorts.ascending(FIELD_CREATED_AT))
                .into(new ArrayList<>())), executor);
    }

    static Document toDocument(Entity entity) {
        Document payload = new Document();
        if (entity.getPayload() != null) {
            payload.putAll(entity.getPayload());
        }
        return new Document(FIELD_ID, entity.getId())
                .append(FIELD_SESSION, entity.getOwnerSessionId())
                .append(FIELD_KIND, entity.getKind() != null ? entity.getKind().name() : null)
                .append(FIELD_PAYLOAD, payload)
                .append(FIELD_CREATED_AT, entity.getCreatedAt() != null ? Date.from(entity.getCreatedAt()) : null)
                .append(FIELD_SYNC_STATE, entity.getSyncState().name());
    }

    static Entity toEntity(Document document) {
        Document payload = document.get(FIELD_PAYLOAD, Document.class);
        Map<String, Object> payloadMap = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
        Date createdAt = document.getDate(FIELD_CREATED_AT);
        String kind = document.getString(FIELD_KIND);
        String syncState = document.getString(FIELD_SYNC_STATE);
        return Entity.builder()
                .id(document.getString(FIELD_ID))
                .ownerSessionId(document.getString(FIELD_SESSION))
                .kind(kind != null ? EntityKind.valueOf(kind) : null)
                .payload(payloadMap)
                .createdAt(createdAt != null ? createdAt.toInstant() : null)
                .syncState(syncState != null ? SyncState.valueOf(syncState) : SyncState.SYNCED)
                .build();
    }

    private static List<Entity> toEntities(List<Document> documents) {
        List<Entity> entities = new ArrayList<>(documents.size());
        for (Document document : documents) {
            entities.add(toEntity(document));
        }
        return entities;
    }
}
