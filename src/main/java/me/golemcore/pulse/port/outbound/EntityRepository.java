package me.golemcore.pulse.port.outbound;

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

import me.golemcore.pulse.domain.model.Entity;
import me.golemcore.pulse.domain.model.SyncState;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Repository port implemented by both the networked primary store and the
 * local backup store.
 */
public interface EntityRepository {

    /**
     * Short name used in logs and breaker names ("primary", "backup").
     */
    String getName();

    CompletableFuture<Optional<Entity>> findById(String id);

    /**
     * Insert or replace the entity. Completes with the entity as stored.
     */
    CompletableFuture<Entity> save(Entity entity);

    /**
     * @return {@code true} if an entity was removed
     */
    CompletableFuture<Boolean> delete(String id);

    /**
     * Entities of a session ordered by creation time, oldest first.
     */
    CompletableFuture<List<Entity>> findByOwnerSession(String sessionId);

    CompletableFuture<List<Entity>> findBySyncState(SyncState state);
}
