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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.ErrorKind;
import me.golemcore.pulse.domain.model.ProviderRequest;
import me.golemcore.pulse.infrastructure.concurrent.InterruptibleFuture;
import me.golemcore.pulse.port.outbound.ProviderException;
import me.golemcore.pulse.port.outbound.ProviderPort;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Base class for providers backed by a langchain4j {@link ChatModel}.
 *
 * <p>
 * Chat models are created lazily per model name and timeout and reused. Each
 * call runs on the provider executor inside an {@link InterruptibleFuture}, so
 * cancelling or timing out the returned future interrupts the blocked HTTP
 * call. Retries are disabled in the models; the invocation executor owns retry
 * and backoff.
 */
@Slf4j
public abstract class Langchain4jProviderAdapter implements ProviderPort {

    private final ExecutorService executor;
    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    protected Langchain4jProviderAdapter(ExecutorService executor) {
        this.executor = executor;
    }

    @Override
    public CompletableFuture<String> invoke(ProviderRequest request) {
        if (request.getPrompt() == null || request.getPrompt().isBlank()) {
            return CompletableFuture.failedFuture(
                    new ProviderException(ErrorKind.VALIDATION, request.getModelId(), "Prompt must not be blank"));
        }
        return InterruptibleFuture.supplyAsync(() -> call(request), executor);
    }

    /**
     * Creates the chat model for a request's model name and timeout.
     *
     * @throws ProviderException
     *             if the provider is not configured
     */
    protected abstract ChatModel createModel(ProviderRequest request);

    private String call(ProviderRequest request) {
        try {
            ChatModel model = models.computeIfAbsent(request.getModelName() + "|" + request.getTimeout(),
                    key -> createModel(request));

            List<ChatMessage> messages = new ArrayList<>();
            if (request.getContext() != null && !request.getContext().isBlank()) {
                messages.add(SystemMessage.from(request.getContext()));
            }
            messages.add(UserMessage.from(request.getPrompt()));

            ChatRequest chatRequest = ChatRequest.builder()
                    .messages(messages)
                    .maxOutputTokens(request.getMaxTokens() > 0 ? request.getMaxTokens() : null)
                    .build();

            log.trace("[Provider] {} calling {} ({})", getKind(), request.getModelId(), request.getModelName());
            ChatResponse response = model.chat(chatRequest);
            AiMessage message = response.aiMessage();
            String text = message != null ? message.text() : null;
            if (text == null || text.isBlank()) {
                throw new ProviderException(ErrorKind.MODEL_UNAVAILABLE, request.getModelId(),
                        "Empty response from " + request.getModelId());
            }
            return text;
        } catch (RuntimeException e) {
            throw ProviderErrorTranslator.translate(e, request.getModelId());
        }
    }
}
