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

/**
 * Acknowledgement of a history write. A successful write reports where the
 * entity landed through its {@link SyncState}.
 */
@Value
@Builder
public class WriteAck {

    boolean success;
    String entityId;
    SyncState syncState;
    ErrorKind errorKind;
    String message;

    public static WriteAck stored(Entity entity) {
        return WriteAck.builder()
                .success(true)
                .entityId(entity.getId())
                .syncState(entity.getSyncState())
                .build();
    }

    public static WriteAck failed(String entityId, ErrorKind errorKind) {
        return WriteAck.builder()
                .success(false)
                .entityId(entityId)
                .errorKind(errorKind)
                .message(errorKind.getUserMessage())
                .build();
    }
}
