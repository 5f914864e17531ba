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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.Entity;
import me.golemcore.pulse.domain.model.SyncState;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.EntityRepository;
import me.golemcore.pulse.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Backup entity repository over the local workspace.
 *
 * <p>
 * Each entity is one JSON file {@code entities/<id>.json}, written atomically
 * through {@link StoragePort}. Ids failing {@link Entity#isValidId} are
 * rejected with a failed future. Queries by session or sync state scan the
 * directory; unreadable files are skipped with a warning.
 *
 * @since 1.0
 */
@Component("backupEntityRepository")
@RequiredArgsConstructor
@Slf4j
public class LocalEntityRepository implements EntityRepository {

    private static final String FILE_SUFFIX = ".json";
    private static final Comparator<Entity> BY_CREATED_AT = Comparator.comparing(Entity::getCreatedAt,
            Comparator.nullsFirst(Comparator.naturalOrder()));

    private final StoragePort storagePort;
    private final PulseProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public String getName() {
        return "backup";
    }

    @Override
    public CompletableFuture<Optional<Entity>> findById(String id) {
        if (!Entity.isValidId(id)) {
            return invalidId(id);
        }
        return storagePort.getText(directory(), fileName(id))
                .thenApply(json -> json == null ? Optional.empty() : Optional.of(parse(json)));
    }

    @Override
    public CompletableFuture<Entity> save(Entity entity) {
        if (!Entity.isValidId(entity.getId())) {
            return invalidId(entity.getId());
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(entity);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new UncheckedIOException(e));
        }
        return storagePort.putTextAtomic(directory(), fileName(entity.getId()), json)
                .thenApply(ignored -> entity);
    }

    @Override
    public CompletableFuture<Boolean> delete(String id) {
        if (!Entity.isValidId(id)) {
            return invalidId(id);
        }
        String fileName = fileName(id);
        return storagePort.exists(directory(), fileName).thenCompose(exists -> {
            if (!Boolean.TRUE.equals(exists)) {
                return CompletableFuture.completedFuture(false);
            }
            return storagePort.deleteObject(directory(), fileName).thenApply(ignored -> true);
        });
    }

    @Override
    public CompletableFuture<List<Entity>> findByOwnerSession(String sessionId) {
        return loadMatching(entity -> Objects.equals(sessionId, entity.getOwnerSessionId()));
    }

    @Override
    public CompletableFuture<List<Entity>> findBySyncState(SyncState state) {
        return loadMatching(entity -> entity.getSyncState() == state);
    }

    private CompletableFuture<List<Entity>> loadMatching(Predicate<Entity> predicate) {
        return storagePort.listObjects(directory(), null).thenCompose(names -> {
            List<CompletableFuture<Entity>> reads = names.stream()
                    .filter(name -> name.endsWith(FILE_SUFFIX))
                    .map(this::readQuietly)
                    .toList();
            return CompletableFuture.allOf(reads.toArray(CompletableFuture[]::new))
                    .thenApply(ignored -> {
                        List<Entity> matching = new ArrayList<>();
                        for (CompletableFuture<Entity> read : reads) {
                            Entity entity = read.join();
                            if (entity != null && predicate.test(entity)) {
                                matching.add(entity);
                            }
                        }
                        matching.sort(BY_CREATED_AT);
                        return matching;
                    });
        });
    }

    private CompletableFuture<Entity> readQuietly(String fileName) {
        return storagePort.getText(directory(), fileName)
                .thenApply(json -> json == null ? null : parse(json))
                .exceptionally(e -> {
                    log.warn("[BackupStore] Skipping unreadable entity file {}: {}", fileName, e.getMessage());
                    return null;
                });
    }

    private Entity parse(String json) {
        try {
            return objectMapper.readValue(json, Entity.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private String directory() {
        return properties.getStorage().getDirectories().getEntities();
    }

    private static String fileName(String id) {
        return id + FILE_SUFFIX;
    }

    private static <T> CompletableFuture<T> invalidId(String id) {
        return CompletableFuture.failedFuture(new IllegalArgumentException("Invalid entity id: " + id));
    }
}
