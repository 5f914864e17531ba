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
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.ErrorKind;
import me.golemcore.pulse.domain.model.ProviderKind;
import me.golemcore.pulse.domain.model.ProviderRequest;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.ProviderException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;

/**
 * Cloud provider reaching hosted models through OpenRouter's OpenAI-compatible
 * API.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code pulse.providers.openrouter.api-key} - required</li>
 * <li>{@code pulse.providers.openrouter.base-url} - defaults to
 * {@value #DEFAULT_BASE_URL}</li>
 * </ul>
 */
@Component
@Slf4j
public class OpenRouterProviderAdapter extends Langchain4jProviderAdapter {

    static final String PROVIDER_NAME = "openrouter";
    static final String DEFAULT_BASE_URL = "https://openrouter.ai/api/v1";

    private final PulseProperties properties;

    public OpenRouterProviderAdapter(PulseProperties properties,
            @Qualifier("providerCallExecutor") ExecutorService executor) {
        super(executor);
        this.properties = properties;
    }

    @Override
    public ProviderKind getKind() {
        return ProviderKind.CLOUD_API;
    }

    @Override
    public boolean isAvailable() {
        PulseProperties.ProviderProperties config = properties.getProviders().get(PROVIDER_NAME);
        return config != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    protected ChatModel createModel(ProviderRequest request) {
        if (!isAvailable()) {
            throw new ProviderException(ErrorKind.AUTH, request.getModelId(),
                    "OpenRouter API key not configured (pulse.providers.openrouter.api-key)");
        }
        PulseProperties.ProviderProperties config = properties.getProviders().get(PROVIDER_NAME);
        String baseUrl = config.getBaseUrl() != null && !config.getBaseUrl().isBlank()
                ? config.getBaseUrl()
                : DEFAULT_BASE_URL;

        log.debug("[Provider] Creating OpenRouter model {}", request.getModelName());
        return OpenAiChatModel.builder()
                .baseUrl(baseUrl)
                .apiKey(config.getApiKey())
                .modelName(request.getModelName())
                .maxRetries(0)
                .timeout(request.getTimeout())
                .build();
    }
}
