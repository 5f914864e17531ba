package me.golemcore.pulse.adapter.outbound.vector;

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

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.BackendOrigin;
import me.golemcore.pulse.domain.model.ScoredVectorRecord;
import me.golemcore.pulse.domain.model.VectorRecord;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.NativeVectorBackend;
import me.golemcore.pulse.vector.VectorSimilarity;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

/**
 * Native vector backend over langchain4j's {@link InMemoryEmbeddingStore}.
 *
 * <p>
 * Record metadata is stored as segment metadata, plus the creation time under
 * a reserved key so ties can be ranked by recency. Scores are reported as raw
 * cosine similarity so they compare directly with the fallback index.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class Langchain4jVectorBackend implements NativeVectorBackend {

    static final String STORE_CLASS = "dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore";
    static final String CREATED_AT_KEY = "_createdAt";
    static final String TEXT_KEY = "text";

    private final PulseProperties properties;
    private final Object writeLock = new Object();
    private InMemoryEmbeddingStore<TextSegment> store;

    public Langchain4jVectorBackend(PulseProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean probe() {
        if (!properties.getVector().isNativeEnabled()) {
            log.info("[Vector] Native backend disabled by configuration");
            return false;
        }
        try {
            Class.forName(STORE_CLASS, false, getClass().getClassLoader());
        } catch (ClassNotFoundException e) {
            log.info("[Vector] Native backend library not on classpath");
            return false;
        }
        store = new InMemoryEmbeddingStore<>();
        return true;
    }

    @Override
    public void upsert(VectorRecord record) {
        InMemoryEmbeddingStore<TextSegment> current = requireStore();
        Metadata metadata = new Metadata();
        if (record.getMetadata() != null) {
            record.getMetadata().forEach(metadata::put);
        }
        metadata.put(CREATED_AT_KEY, record.getCreatedAt().toEpochMilli());
        String text = record.getMetadata() != null && record.getMetadata().get(TEXT_KEY) != null
                && !record.getMetadata().get(TEXT_KEY).isBlank()
                        ? record.getMetadata().get(TEXT_KEY)
                        : record.getId();

        synchronized (writeLock) {
            current.removeAll(List.of(record.getId()));
            current.addAll(List.of(record.getId()), List.of(Embedding.from(record.getEmbedding())),
                    List.of(TextSegment.from(text, metadata)));
        }
    }

    /**
     * Top {@code k} by cosine similarity, newest first among equal scores. The
     * store breaks ties at the cutoff arbitrarily, so the search is widened
     * until every match tied with the k-th score is in hand, then re-ranked and
     * trimmed.
     */
    @Override
    public List<ScoredVectorRecord> query(float[] vector, int k, Map<String, String> filter) {
        if (k <= 0) {
            return List.of();
        }
        InMemoryEmbeddingStore<TextSegment> current = requireStore();
        Filter metadataFilter = toFilter(filter);
        int fetch = k;
        List<EmbeddingMatch<TextSegment>> matches;
        while (true) {
            matches = search(current, vector, fetch, metadataFilter);
            if (matches.size() < fetch || matches.get(fetch - 1).score() < matches.get(k - 1).score()
                    || fetch == Integer.MAX_VALUE) {
                break;
            }
            fetch = fetch > Integer.MAX_VALUE / 2 ? Integer.MAX_VALUE : fetch * 2;
        }

        List<ScoredVectorRecord> results = new ArrayList<>();
        for (EmbeddingMatch<TextSegment> match : matches) {
            float[] embedding = match.embedding().vector();
            if (embedding.length != vector.length) {
                continue;
            }
            results.add(new ScoredVectorRecord(toRecord(match), VectorSimilarity.cosine(vector, embedding)));
        }
        results.sort(VectorSimilarity.RANKING);
        return results.size() > k ? List.copyOf(results.subList(0, k)) : results;
    }

    private static List<EmbeddingMatch<TextSegment>> search(InMemoryEmbeddingStore<TextSegment> store,
            float[] vector, int maxResults, Filter filter) {
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(Embedding.from(vector))
                .maxResults(maxResults)
                .minScore(0.0)
                .filter(filter)
                .build();
        return store.search(request).matches();
    }

    private InMemoryEmbeddingStore<TextSegment> requireStore() {
        InMemoryEmbeddingStore<TextSegment> current = store;
        if (current == null) {
            throw new IllegalStateException("Native vector backend was not initialized");
        }
        return current;
    }

    private static Filter toFilter(Map<String, String> filter) {
        if (filter == null || filter.isEmpty()) {
            return null;
        }
        Filter combined = null;
        for (Map.Entry<String, String> entry : filter.entrySet()) {
            Filter condition = metadataKey(entry.getKey()).isEqualTo(entry.getValue());
            combined = combined == null ? condition : combined.and(condition);
        }
        return combined;
    }

    private static VectorRecord toRecord(EmbeddingMatch<TextSegment> match) {
        Map<String, String> metadata = new LinkedHashMap<>();
        Instant createdAt = null;
        if (match.embedded() != null) {
            Metadata segmentMetadata = match.embedded().metadata();
            Long createdAtMillis = segmentMetadata.getLong(CREATED_AT_KEY);
            createdAt = createdAtMillis != null ? Instant.ofEpochMilli(createdAtMillis) : null;
            segmentMetadata.toMap().forEach((key, value) -> {
                if (!CREATED_AT_KEY.equals(key) && value != null) {
                    metadata.put(key, value.toString());
                }
            });
        }
        return VectorRecord.builder()
                .id(match.embeddingId())
                .embedding(match.embedding().vector())
                .metadata(metadata)
                .backendOrigin(BackendOrigin.NATIVE)
                .createdAt(createdAt)
                .build();
    }
}
