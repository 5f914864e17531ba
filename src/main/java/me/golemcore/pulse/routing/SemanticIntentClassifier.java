package me.golemcore.pulse.routing;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.IntentClassification;
import me.golemcore.pulse.infrastructure.config.ModelProfileService;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.EmbeddingPort;
import me.golemcore.pulse.port.outbound.IntentClassifierPort;
import me.golemcore.pulse.vector.VectorSimilarity;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Embedding-based intent classifier.
 *
 * <p>
 * Each intent description from the model table is embedded once, on first use.
 * A query is classified as the intent whose description embedding is most
 * similar, with the cosine similarity (floored at 0) as confidence. When the
 * embedder is unavailable or fails, the result is
 * {@link IntentClassification#none()} and the router falls back to keywords.
 *
 * @since 1.0
 * @see KeywordIntentClassifier
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class SemanticIntentClassifier implements IntentClassifierPort {

    private final EmbeddingPort embeddingPort;
    private final ModelProfileService modelProfileService;
    private final PulseProperties properties;

    private final Map<String, float[]> intentEmbeddings = new ConcurrentHashMap<>();
    private volatile boolean indexed = false;

    @Override
    public IntentClassification classify(String text) {
        if (text == null || text.isBlank() || !embeddingPort.isAvailable()) {
            return IntentClassification.none();
        }
        long timeoutMs = properties.getEmbedding().getTimeout().toMillis();
        try {
            ensureIndexed(timeoutMs);
            if (intentEmbeddings.isEmpty()) {
                return IntentClassification.none();
            }

            float[] query = embeddingPort.embed(text).orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
            String bestIntent = null;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (Map.Entry<String, float[]> entry : intentEmbeddings.entrySet()) {
                if (entry.getValue().length != query.length) {
                    continue;
                }
                double score = VectorSimilarity.cosine(query, entry.getValue());
                if (score > bestScore) {
                    bestScore = score;
                    bestIntent = entry.getKey();
                }
            }
            if (bestIntent == null) {
                return IntentClassification.none();
            }
            log.debug("[SemanticClassifier] {} (score: {})", bestIntent, String.format("%.3f", bestScore));
            return new IntentClassification(bestIntent, Math.max(0.0, bestScore));
        } catch (CompletionException | IllegalStateException e) {
            log.warn("[SemanticClassifier] Classification failed, deferring to keywords: {}", e.getMessage());
            return IntentClassification.none();
        }
    }

    private synchronized void ensureIndexed(long timeoutMs) {
        if (indexed) {
            return;
        }
        Map<String, String> descriptions = modelProfileService.getTable().intentDescriptions();
        if (descriptions.isEmpty()) {
            log.warn("[SemanticClassifier] Model table has no intent descriptions");
            indexed = true;
            return;
        }

        List<String> intents = new ArrayList<>(descriptions.keySet());
        List<String> texts = intents.stream()
                .map(intent -> intent + ": " + descriptions.get(intent))
                .toList();
        List<float[]> embeddings = embeddingPort.embedBatch(texts)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .join();
        for (int i = 0; i < intents.size(); i++) {
            intentEmbeddings.put(intents.get(i), embeddings.get(i));
        }
        indexed = true;
        log.info("[SemanticClassifier] Indexed {} intents", intents.size());
    }
}
