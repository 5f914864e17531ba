package me.golemcore.pulse.adapter.outbound.llm;

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

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.ProviderKind;
import me.golemcore.pulse.domain.model.ProviderRequest;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;

/**
 * Local inference provider backed by an Ollama server.
 *
 * <p>
 * Whether the server is actually up is tracked by the resource monitor; this
 * adapter only needs an endpoint, {@code pulse.providers.ollama.base-url},
 * defaulting to {@value #DEFAULT_BASE_URL}.
 */
@Component
@Slf4j
public class OllamaProviderAdapter extends Langchain4jProviderAdapter {

    public static final String PROVIDER_NAME = "ollama";
    public static final String DEFAULT_BASE_URL = "http://localhost:11434";

    private final PulseProperties properties;

    public OllamaProviderAdapter(PulseProperties properties,
            @Qualifier("providerCallExecutor") ExecutorService executor) {
        super(executor);
        this.properties = properties;
    }

    @Override
    public ProviderKind getKind() {
        return ProviderKind.LOCAL_INFERENCE;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    public static String baseUrl(PulseProperties properties) {
        PulseProperties.ProviderProperties config = properties.getProviders().get(PROVIDER_NAME);
        return config != null && config.getBaseUrl() != null && !config.getBaseUrl().isBlank()
                ? config.getBaseUrl()
                : DEFAULT_BASE_URL;
    }

    @Override
    protected ChatModel createModel(ProviderRequest request) {
        log.debug("[Provider] Creating Ollama model {}", request.getModelName());
        return OllamaChatModel.builder()
                .baseUrl(baseUrl(properties))
                .modelName(request.getModelName())
                .maxRetries(0)
                .timeout(request.getTimeout())
                .build();
    }
}
