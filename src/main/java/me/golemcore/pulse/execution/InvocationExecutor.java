package me.golemcore.pulse.execution;

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
import me.golemcore.pulse.adapter.outbound.llm.ProviderRegistry;
import me.golemcore.pulse.domain.model.CancellationToken;
import me.golemcore.pulse.domain.model.ErrorKind;
import me.golemcore.pulse.domain.model.InvocationResult;
import me.golemcore.pulse.domain.model.ModelProfile;
import me.golemcore.pulse.domain.model.ProviderRequest;
import me.golemcore.pulse.domain.model.RoutingDecision;
import me.golemcore.pulse.infrastructure.config.ModelProfileService;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.ProviderException;
import me.golemcore.pulse.port.outbound.ProviderPort;
import me.golemcore.pulse.resilience.CircuitBreakerRegistry;
import me.golemcore.pulse.routing.AdaptiveRouter;
import me.golemcore.pulse.routing.RouterState;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs a routing decision against the model providers.
 *
 * <p>
 * Every call goes through the model's circuit breaker and is bounded by
 * {@code pulse.executor.model-timeout}. Transient failures (connectivity,
 * rate limits, timeouts) are retried on the same model with exponential
 * backoff. Authentication, validation and cancellation failures end the
 * invocation at once. Anything else, or retries running out, marks the model
 * failed and asks the router for the next candidate, until the chain and the
 * hard default are exhausted.
 *
 * <p>
 * The returned future always completes normally; failures are reported
 * through {@link InvocationResult}.
 */
@Service
@Slf4j
public class InvocationExecutor {

    private static final String BREAKER_PREFIX = "provider.";

    private final ProviderRegistry providerRegistry;
    private final ModelProfileService modelProfileService;
    private final AdaptiveRouter router;
    private final CircuitBreakerRegistry breakers;
    private final PulseProperties properties;
    private final BackoffPolicy backoffPolicy;
    private final ExecutorService executor;

    public InvocationExecutor(ProviderRegistry providerRegistry, ModelProfileService modelProfileService,
            AdaptiveRouter router, CircuitBreakerRegistry breakers, PulseProperties properties,
            BackoffPolicy backoffPolicy, @Qualifier("invocationExecutor") ExecutorService executor) {
        this.providerRegistry = providerRegistry;
        this.modelProfileService = modelProfileService;
        this.router = router;
        this.breakers = breakers;
        this.properties = properties;
        this.backoffPolicy = backoffPolicy;
        this.executor = executor;
    }

    public CompletableFuture<InvocationResult> invoke(RouterState state, RoutingDecision decision, String prompt,
            String context, CancellationToken token) {
        if (prompt == null || prompt.isBlank()) {
            return CompletableFuture.completedFuture(
                    InvocationResult.failed(ErrorKind.VALIDATION, List.of(), 0));
        }
        return CompletableFuture.supplyAsync(() -> execute(state, decision, prompt, context, token), executor);
    }

    private InvocationResult execute(RouterState state, RoutingDecision decision, String prompt, String context,
            CancellationToken token) {
        int maxRetries = Math.max(0, properties.getExecutor().getMaxRetries());
        Set<String> failedModels = new LinkedHashSet<>();
        List<String> attemptedModels = new ArrayList<>();
        ErrorKind lastError = ErrorKind.MODEL_UNAVAILABLE;
        int attempts = 0;
        RoutingDecision current = decision;

        while (true) {
            String modelId = current.getSelectedModelId();
            attemptedModels.add(modelId);

            for (int attempt = 0; attempt <= maxRetries; attempt++) {
                if (token.isCancelled()) {
                    log.info("[Executor] Cancelled before calling {}: {}", modelId, token.getReason());
                    return InvocationResult.failed(ErrorKind.CANCELLED, attemptedModels, attempts);
                }
                attempts++;
                try {
                    String text = callModel(modelId, prompt, context, token);
                    log.info("[Executor] {} answered ({} chars, attempt {})", modelId, text.length(), attempts);
                    return InvocationResult.succeeded(modelId, text, attemptedModels, attempts);
                } catch (RuntimeException e) {
                    ErrorKind kind = token.isCancelled() ? ErrorKind.CANCELLED : ErrorClassifier.classify(e);
                    lastError = kind;
                    if (kind.isFatal()) {
                        log.warn("[Executor] {} failed with {}, giving up: {}", modelId, kind, describe(e));
                        return InvocationResult.failed(kind, attemptedModels, attempts);
                    }
                    if (!kind.isRetryable() || attempt == maxRetries) {
                        log.warn("[Executor] {} failed with {} (attempt {}/{}): {}", modelId, kind, attempt + 1,
                                maxRetries + 1, describe(e));
                        break;
                    }
                    Duration delay = backoffPolicy.delay(attempt);
                    log.warn("[Executor] {} failed with {} (attempt {}/{}), retrying in {}ms", modelId, kind,
                            attempt + 1, maxRetries + 1, delay.toMillis());
                    if (!token.sleep(delay)) {
                        return InvocationResult.failed(ErrorKind.CANCELLED, attemptedModels, attempts);
                    }
                }
            }

            failedModels.add(modelId);
            Optional<RoutingDecision> next = router.reselect(state, current, failedModels);
            if (next.isEmpty()) {
                log.warn("[Executor] All candidates failed {}, last error: {}", attemptedModels, lastError);
                return InvocationResult.failed(lastError, attemptedModels, attempts);
            }
            current = next.get();
        }
    }

    private String callModel(String modelId, String prompt, String context, CancellationToken token) {
        ModelProfile profile = modelProfileService.getTable().find(modelId)
                .orElseThrow(() -> new ProviderException(ErrorKind.MODEL_UNAVAILABLE, modelId,
                        "Model not in table: " + modelId));
        ProviderPort provider = providerRegistry.get(profile.getProviderKind())
                .orElseThrow(() -> new ProviderException(ErrorKind.MODEL_UNAVAILABLE, modelId,
                        "No provider for " + profile.getProviderKind()));

        Duration timeout = properties.getExecutor().getModelTimeout();
        ProviderRequest request = ProviderRequest.builder()
                .modelId(modelId)
                .modelName(profile.getModelName())
                .prompt(prompt)
                .context(context)
                .maxTokens(properties.getExecutor().getMaxTokens())
                .timeout(timeout)
                .build();

        CompletableFuture<String> call = breakers.breaker(BREAKER_PREFIX + modelId)
                .execute(() -> provider.invoke(request).orTimeout(timeout.toMillis(),
                        TimeUnit.MILLISECONDS));
        try (CancellationToken.Registration ignored = token.register(call)) {
            return call.join();
        }
    }

    private static String describe(Throwable error) {
        Throwable cause = ErrorClassifier.unwrap(error);
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
