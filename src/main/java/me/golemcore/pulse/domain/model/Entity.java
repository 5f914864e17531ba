package me.golemcore.pulse.domain.model;

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

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Persisted unit of session state: a chat turn or a memory.
 *
 * <p>
 * Ids are ASCII letters, digits, {@code .}, {@code _} and {@code -}, start
 * with a letter or digit and are at most 128 characters long, so every tier can
 * use them verbatim as a key or file name.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Entity {

    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    String id;
    String ownerSessionId;
    EntityKind kind;
    Map<String, Object> payload;
    Instant createdAt;

    @Builder.Default
    SyncState syncState = SyncState.SYNCED;

    public Entity withSyncState(SyncState state) {
        return state == syncState ? this : toBuilder().syncState(state).build();
    }

    public static boolean isValidId(String id) {
        return id != null && ID_PATTERN.matcher(id).matches();
    }

    public String payloadText(String key) {
        Object value = payload != null ? payload.get(key) : null;
        return value != null ? value.toString() : null;
    }
}
