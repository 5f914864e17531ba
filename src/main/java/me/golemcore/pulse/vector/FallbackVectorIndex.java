package me.golemcore.pulse.vector;

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
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.ScoredVectorRecord;
import me.golemcore.pulse.domain.model.VectorRecord;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Brute-force vector index kept in memory and persisted to the local workspace
 * ({@code vectors/}), the same storage tier that backs the backup repository.
 *
 * <p>
 * Queries scan every record, so results are exact: this index is also the
 * reference ranking the native backend is compared against.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FallbackVectorIndex {

    private static final String FILE_SUFFIX = ".json";

    private final StoragePort storagePort;
    private final PulseProperties properties;
    private final ObjectMapper objectMapper;

    private final Map<String, VectorRecord> records = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        try {
            List<String> names = storagePort.listObjects(directory(), null).join();
            for (String name : names) {
                if (name.endsWith(FILE_SUFFIX)) {
                    loadRecord(name);
                }
            }
            log.info("[Vector] Fallback index loaded {} records", records.size());
        } catch (CompletionException e) {
            log.warn("[Vector] Could not load fallback index, starting empty: {}", e.getMessage());
        }
    }

    /**
     * Stores the record in memory immediately and persists it asynchronously.
     *
     * @return completes when the record is on disk; persistence failures are
     *         logged and do not fail the future
     */
    public CompletableFuture<Void> upsert(VectorRecord record) {
        records.put(record.getId(), record);
        String json;
        try {
            json = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            log.warn("[Vector] Failed to serialize record {}: {}", record.getId(), e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
        return storagePort.putTextAtomic(directory(), fileName(record.getId()), json)
                .exceptionally(e -> {
                    log.warn("[Vector] Failed to persist record {}: {}", record.getId(), e.getMessage());
                    return null;
                });
    }

    /**
     * Exact top-k by cosine similarity among records matching the filter.
     * Records of a different dimension than the query are skipped.
     */
    public List<ScoredVectorRecord> query(float[] vector, int k, Map<String, String> filter) {
        List<ScoredVectorRecord> scored = new ArrayList<>();
        for (VectorRecord record : records.values()) {
            float[] embedding = record.getEmbedding();
            if (embedding == null || embedding.length != vector.length || !record.matches(filter)) {
                continue;
            }
            scored.add(new ScoredVectorRecord(record, VectorSimilarity.cosine(vector, embedding)));
        }
        scored.sort(VectorSimilarity.RANKING);
        return scored.size() > k ? List.copyOf(scored.subList(0, k)) : List.copyOf(scored);
    }

    public int size() {
        return records.size();
    }

    private void loadRecord(String name) {
        try {
            String json = storagePort.getText(directory(), name).join();
            if (json != null) {
                VectorRecord record = objectMapper.readValue(json, VectorRecord.class);
                records.put(record.getId(), record);
            }
        } catch (JsonProcessingException | CompletionException e) {
            log.warn("[Vector] Skipping unreadable vector file {}: {}", name, e.getMessage());
        }
    }

    private String directory() {
        return properties.getStorage().getDirectories().getVectors();
    }

    // Record ids are arbitrary strings; hashing keeps file names safe
    private static String fileName(String id) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(id.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest) + FILE_SUFFIX;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
