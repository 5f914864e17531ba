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

import me.golemcore.pulse.domain.model.ScoredVectorRecord;
import me.golemcore.pulse.domain.model.VectorRecord;

import java.util.List;
import java.util.Map;

/**
 * Optional native vector index. Calls are synchronous; any runtime exception
 * is treated by the vector store as a permanent backend failure.
 */
public interface NativeVectorBackend {

    /**
     * Capability check performed once when the vector store is created.
     *
     * @return {@code true} if the backend library is present and enabled
     */
    boolean probe();

    void upsert(VectorRecord record);

    /**
     * Nearest records by cosine similarity, restricted to records whose metadata
     * contains every filter entry.
     */
    List<ScoredVectorRecord> query(float[] vector, int k, Map<String, String> filter);
}
