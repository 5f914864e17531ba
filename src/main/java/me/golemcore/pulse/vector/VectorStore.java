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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.BackendOrigin;
import me.golemcore.pulse.domain.model.ScoredVectorRecord;
import me.golemcore.pulse.domain.model.VectorRecord;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.NativeVectorBackend;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Similarity index with a native backend and a brute-force fallback.
 *
 * <p>
 * The backend is chosen once at construction by probing the native backend.
 * After that, the first unexpected native error switches every later call to
 * the fallback for the rest of the process; there is no switching back. The
 * fallback index receives every upsert even while the native backend is
 * active, so a downgrade loses no records.
 *
 * <p>
 * Results are ordered by cosine similarity descending, ties broken by the most
 * recent {@code createdAt}. {@code k <= 0} means the default, and {@code k} is
 * silently capped at {@code pulse.vector.max-k}.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class VectorStore {

    private final FallbackVectorIndex fallbackIndex;
    private final NativeVectorBackend nativeBackend;
    private final PulseProperties properties;
    private final Clock clock;
    private final AtomicReference<BackendOrigin> activeBackend;

    public VectorStore(FallbackVectorIndex fallbackIndex, Optional<NativeVectorBackend> nativeBackend,
            PulseProperties properties, Clock clock) {
        this.fallbackIndex = fallbackIndex;
        this.nativeBackend = nativeBackend.orElse(null);
        this.properties = properties;
        this.clock = clock;
        BackendOrigin initial = probeNative() ? BackendOrigin.NATIVE : BackendOrigin.FALLBACK;
        this.activeBackend = new AtomicReference<>(initial);
        log.info("[Vector] Using {} backend", initial);
    }

    public VectorRecord upsert(String id, float[] vector, Map<String, String> metadata) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Vector id must not be blank");
        }
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Vector must not be empty");
        }

        BackendOrigin origin = activeBackend.get();
        VectorRecord record = VectorRecord.builder()
                .id(id)
                .embedding(vector.clone())
                .metadata(metadata != null ? Map.copyOf(metadata) : Map.of())
                .backendOrigin(origin)
                .createdAt(clock.instant())
                .build();

        fallbackIndex.upsert(record);
        if (origin == BackendOrigin.NATIVE) {
            try {
                nativeBackend.upsert(record);
            } catch (RuntimeException e) {
                downgrade("upsert", e);
                // Only the fallback copy exists now
                record = record.toBuilder().backendOrigin(BackendOrigin.FALLBACK).build();
                fallbackIndex.upsert(record);
                origin = BackendOrigin.FALLBACK;
            }
        }
        log.trace("[Vector] Upserted {} via {}", id, origin);
        return record;
    }

    public List<ScoredVectorRecord> query(float[] vector, int k, Map<String, String> filter) {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Query vector must not be empty");
        }
        int limit = effectiveK(k);

        if (activeBackend.get() == BackendOrigin.NATIVE) {
            try {
                List<ScoredVectorRecord> results = new ArrayList<>(nativeBackend.query(vector, limit, filter));
                results.sort(VectorSimilarity.RANKING);
                return results.size() > limit ? List.copyOf(results.subList(0, limit)) : List.copyOf(results);
            } catch (RuntimeException e) {
                downgrade("query", e);
            }
        }
        return fallbackIndex.query(vector, limit, filter);
    }

    /**
     * {@link #query} bounded by {@code pulse.vector.query-timeout}.
     */
    public CompletableFuture<List<ScoredVectorRecord>> queryAsync(float[] vector, int k, Map<String, String> filter) {
        long timeoutMs = properties.getVector().getQueryTimeout().toMillis();
        return CompletableFuture.supplyAsync(() -> query(vector, k, filter))
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public BackendOrigin getActiveBackend() {
        return activeBackend.get();
    }

    int effectiveK(int k) {
        PulseProperties.VectorProperties vector = properties.getVector();
        if (k <= 0) {
            return Math.min(vector.getDefaultK(), vector.getMaxK());
        }
        return Math.min(k, vector.getMaxK());
    }

    private boolean probeNative() {
        if (nativeBackend == null) {
            return false;
        }
        try {
            return nativeBackend.probe();
        } catch (RuntimeException | LinkageError e) {
            log.warn("[Vector] Native backend probe failed: {}", e.toString());
            return false;
        }
    }

    private void downgrade(String operation, RuntimeException error) {
        if (activeBackend.compareAndSet(BackendOrigin.NATIVE, BackendOrigin.FALLBACK)) {
            log.error("[Vector] Native backend failed during {}, using fallback for the rest of the process",
                    operation, error);
        }
    }
}
