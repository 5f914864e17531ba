package me.golemcore.pulse.adapter.outbound.embedding;

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

import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.EmbeddingPort;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j and an OpenAI-compatible embeddings
 * endpoint.
 *
 * <p>
 * Used by the semantic intent classifier, memory indexing and semantic search.
 * The model is created lazily on first use; without an API key the adapter
 * reports itself unavailable and callers degrade (keyword classification,
 * empty recall).
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code pulse.providers.<embedding.provider>.api-key} - API key
 * <li>{@code pulse.providers.<embedding.provider>.base-url} - optional endpoint
 * <li>{@code pulse.embedding.model} - embedding model name
 * </ul>
 *
 * @see me.golemcore.pulse.port.outbound.EmbeddingPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private static final String DEFAULT_MODEL = "text-embedding-3-small";

    private final PulseProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        PulseProperties.EmbeddingProperties embedding = properties.getEmbedding();
        PulseProperties.ProviderProperties provider = properties.getProviders().get(embedding.getProvider());
        String apiKey = provider != null ? provider.getApiKey() : null;
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[Embedding] API key for provider '{}' not configured, embedding service unavailable",
                    embedding.getProvider());
            initialized = true;
            return;
        }

        String model = getModel();
        try {
            var builder = OpenAiEmbeddingModel.builder()
                    .apiKey(apiKey)
                    .modelName(model)
                    .timeout(embedding.getTimeout())
                    .maxRetries(0);
            if (provider.getBaseUrl() != null && !provider.getBaseUrl().isBlank()) {
                builder.baseUrl(provider.getBaseUrl());
            }
            if (embedding.getDimensions() != null) {
                builder.dimensions(embedding.getDimensions());
            }
            embeddingModel = builder.build();
            log.info("[Embedding] Model initialized: {}", model);
        } catch (RuntimeException e) {
            log.error("[Embedding] Failed to initialize embedding model", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            EmbeddingModel model = requireModel();
            Response<Embedding> response = model.embed(text);
            return response.content().vector();
        });
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        return CompletableFuture.supplyAsync(() -> {
            EmbeddingModel model = requireModel();

            List<TextSegment> segments = texts.stream()
                    .map(TextSegment::from)
                    .toList();

            Response<List<Embedding>> response = model.embedAll(segments);

            return response.content().stream()
                    .map(Embedding::vector)
                    .toList();
        });
    }

    @Override
    public String getModel() {
        String model = properties.getEmbedding().getModel();
        return model != null && !model.isBlank() ? model : DEFAULT_MODEL;
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }

    private EmbeddingModel requireModel() {
        ensureInitialized();
        EmbeddingModel model = embeddingModel;
        if (model == null) {
            throw new IllegalStateException("Embedding model not available");
        }
        return model;
    }
}
