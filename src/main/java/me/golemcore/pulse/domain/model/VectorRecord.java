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

/**
 * Embedding with metadata. {@code backendOrigin} is informational only.
 * {@link #getEmbedding()} returns a copy, so a stored record cannot be changed
 * through it.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class VectorRecord {

    String id;
    float[] embedding;
    Map<String, String> metadata;
    BackendOrigin backendOrigin;
    Instant createdAt;

    public float[] getEmbedding() {
        return embedding != null ? embedding.clone() : null;
    }

    public boolean matches(Map<String, String> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        if (metadata == null) {
            return false;
        }
        for (Map.Entry<String, String> entry : filter.entrySet()) {
            if (!entry.getValue().equals(metadata.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }
}
