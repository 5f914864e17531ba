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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.IntentClassification;
import me.golemcore.pulse.domain.model.ModelProfile;
import me.golemcore.pulse.domain.model.ModelTable;
import me.golemcore.pulse.domain.model.ProviderKind;
import me.golemcore.pulse.domain.model.ResourceBucket;
import me.golemcore.pulse.domain.model.ResourceRequirement;
import me.golemcore.pulse.domain.model.ResourceSnapshot;
import me.golemcore.pulse.domain.model.RoutingDecision;
import me.golemcore.pulse.domain.model.RoutingRequest;
import me.golemcore.pulse.domain.service.ResourceMonitor;
import me.golemcore.pulse.infrastructure.config.ModelProfileService;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.IntentClassifierPort;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Selects a model for a query from intent, declared resource requirements and
 * live system health.
 *
 * <p>
 * Routing steps:
 * <ol>
 * <li>An explicit model that exists and passes the resource filter is used
 * as-is with confidence 1.0.</li>
 * <li>A recent decision for the same query, resource bucket and intent hint is
 * served from the cache.</li>
 * <li>The intent is the caller's hint if given, otherwise the semantic
 * classifier's answer, falling back to keywords below
 * {@code pulse.router.min-confidence} and to the default intent when keywords
 * find nothing.</li>
 * <li>Candidates declaring the intent are ordered by priority with the leader
 * model last, then filtered: under memory or CPU pressure only LOW models
 * remain, offline only offline-capable ones, and local inference models are
 * dropped while the local server is down.</li>
 * <li>The first survivor wins; with none left the hard default is used.</li>
 * </ol>
 *
 * <p>
 * The router holds no mutable state of its own: the cache and usage counters
 * live in the {@link RouterState} passed by the caller.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class AdaptiveRouter {

    static final String EXPLICIT_INTENT = "explicit";

    private final ModelProfileService modelProfileService;
    private final ResourceMonitor resourceMonitor;
    private final IntentClassifierPort intentClassifier;
    private final KeywordIntentClassifier keywordClassifier;
    private final PulseProperties properties;
    private final Clock clock;

    public AdaptiveRouter(ModelProfileService modelProfileService, ResourceMonitor resourceMonitor,
            IntentClassifierPort intentClassifier, KeywordIntentClassifier keywordClassifier,
            PulseProperties properties, Clock clock) {
        this.modelProfileService = modelProfileService;
        this.resourceMonitor = resourceMonitor;
        this.intentClassifier = intentClassifier;
        this.keywordClassifier = keywordClassifier;
        this.properties = properties;
        this.clock = clock;
    }

    public RoutingDecision route(RouterState state, RoutingRequest request) {
        ModelTable table = modelProfileService.getTable();
        ResourceSnapshot snapshot = resourceMonitor.snapshot();
        PulseProperties.RouterProperties config = properties.getRouter();
        ResourceBucket bucket = ResourceBucket.of(snapshot, config.getMemoryConstrainedPercent(),
                config.getCpuConstrainedPercent());
        Instant now = clock.instant();

        Optional<RoutingDecision> explicit = routeExplicit(table, snapshot, bucket, request, now);
        if (explicit.isPresent()) {
            state.recordUsage(explicit.get().getSelectedModelId());
            return explicit.get();
        }

        String cacheKey = cacheKey(request.query(), bucket, request.intentHint());
        Optional<RoutingDecision> cached = state.cachedDecision(cacheKey, now);
        if (cached.isPresent() && isStillValid(cached.get(), table, snapshot)) {
            RoutingDecision decision = cached.get();
            state.recordUsage(decision.getSelectedModelId());
            log.debug("[Router] Cache hit: {} (intent: {})", decision.getSelectedModelId(), decision.getIntent());
            return decision.toBuilder().cached(true).build();
        }

        IntentClassification classification = resolveIntent(request);
        List<String> chain = candidateChain(table, snapshot, classification.intent());

        RoutingDecision decision = RoutingDecision.builder()
                .selectedModelId(chain.get(0))
                .intent(classification.intent())
                .confidence(classification.confidence())
                .fallbackChainConsidered(chain)
                .decidedAt(now)
                .cacheKey(cacheKey)
                .resourceBucket(bucket)
                .cached(false)
                .build();

        state.cache(cacheKey, decision, now.plus(config.getCacheTtl()), config.getCacheMaxSize(), now);
        state.recordUsage(decision.getSelectedModelId());
        log.info("[Router] {} -> {} (intent: {}, confidence: {}, bucket: {}, chain: {})",
                truncate(request.query(), 60), decision.getSelectedModelId(), decision.getIntent(),
                String.format("%.2f", decision.getConfidence()), bucket, chain);
        return decision;
    }

    /**
     * Picks the next model after failures, without re-classifying: the first
     * model of the decision's chain that has not failed, or the hard default if
     * the chain is exhausted and the default has not failed either.
     */
    public Optional<RoutingDecision> reselect(RouterState state, RoutingDecision decision, Set<String> failedModels) {
        ModelTable table = modelProfileService.getTable();
        List<String> remaining = new ArrayList<>();
        for (String modelId : decision.getFallbackChainConsidered()) {
            if (!failedModels.contains(modelId)) {
                remaining.add(modelId);
            }
        }
        String fallbackId = table.fallback().getId();
        if (remaining.isEmpty() && !failedModels.contains(fallbackId)) {
            remaining.add(fallbackId);
        }
        if (remaining.isEmpty()) {
            log.warn("[Router] Fallback chain exhausted after {}", failedModels);
            return Optional.empty();
        }

        RoutingDecision next = decision.toBuilder()
                .selectedModelId(remaining.get(0))
                .fallbackChainConsidered(List.copyOf(remaining))
                .decidedAt(clock.instant())
                .cached(false)
                .build();
        state.recordUsage(next.getSelectedModelId());
        log.info("[Router] Reselected {} after failures of {}", next.getSelectedModelId(), failedModels);
        return Optional.of(next);
    }

    /**
     * Whether a model may run under the given resource snapshot.
     */
    public boolean isAdmissible(ModelProfile profile, ResourceSnapshot snapshot) {
        PulseProperties.RouterProperties config = properties.getRouter();
        boolean constrained = snapshot.getMemPercent() > config.getMemoryConstrainedPercent()
                || snapshot.getCpuPercent() > config.getCpuConstrainedPercent();
        if (constrained && profile.getResourceRequirement() != ResourceRequirement.LOW) {
            return false;
        }
        if (!snapshot.isConnectivity() && !profile.isOfflineCapable()) {
            return false;
        }
        return profile.getProviderKind() != ProviderKind.LOCAL_INFERENCE || snapshot.isLocalInferenceAvailable();
    }

    static String cacheKey(String query, ResourceBucket bucket, String intentHint) {
        String normalized = query == null ? "" : query.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        String hint = intentHint != null && !intentHint.isBlank() ? intentHint : "*";
        return sha256(normalized) + ":" + bucket + ":" + hint;
    }

    private Optional<RoutingDecision> routeExplicit(ModelTable table, ResourceSnapshot snapshot, ResourceBucket bucket,
            RoutingRequest request, Instant now) {
        String modelId = request.explicitModelId();
        if (modelId == null || modelId.isBlank()) {
            return Optional.empty();
        }
        Optional<ModelProfile> profile = table.find(modelId);
        if (profile.isEmpty()) {
            log.warn("[Router] Requested model '{}' is not in the model table, routing normally", modelId);
            return Optional.empty();
        }
        if (!isAdmissible(profile.get(), snapshot)) {
            log.info("[Router] Requested model '{}' is not usable in bucket {}, routing normally", modelId, bucket);
            return Optional.empty();
        }
        String hint = request.intentHint();
        return Optional.of(RoutingDecision.builder()
                .selectedModelId(modelId)
                .intent(hint != null && !hint.isBlank() ? hint : EXPLICIT_INTENT)
                .confidence(1.0)
                .fallbackChainConsidered(List.of(modelId))
                .decidedAt(now)
                .resourceBucket(bucket)
                .cached(false)
                .build());
    }

    private IntentClassification resolveIntent(RoutingRequest request) {
        if (request.intentHint() != null && !request.intentHint().isBlank()) {
            return new IntentClassification(request.intentHint(), 1.0);
        }
        double minConfidence = properties.getRouter().getMinConfidence();
        IntentClassification semantic;
        try {
            semantic = intentClassifier.classify(request.query());
        } catch (RuntimeException e) {
            log.warn("[Router] Intent classifier failed: {}", e.getMessage());
            semantic = IntentClassification.none();
        }
        if (!semantic.isEmpty() && semantic.confidence() >= minConfidence) {
            return semantic;
        }
        IntentClassification keyword = keywordClassifier.classify(request.query());
        if (!keyword.isEmpty()) {
            log.debug("[Router] Low semantic confidence ({}), keyword intent: {}",
                    String.format("%.2f", semantic.confidence()), keyword.intent());
            return keyword;
        }
        return new IntentClassification(properties.getRouter().getDefaultIntent(), 0.0);
    }

    private List<String> candidateChain(ModelTable table, ResourceSnapshot snapshot, String intent) {
        String fallbackId = table.fallback().getId();
        if (properties.getRouter().getCommandIntents().contains(intent)) {
            return List.of(fallbackId);
        }
        List<String> survivors = table.candidatesFor(intent).stream()
                .filter(profile -> isAdmissible(profile, snapshot))
                .map(ModelProfile::getId)
                .toList();
        if (survivors.isEmpty()) {
            log.info("[Router] No candidate for intent '{}' survives current resources, using default {}", intent,
                    fallbackId);
            return List.of(fallbackId);
        }
        return survivors;
    }

    private boolean isStillValid(RoutingDecision decision, ModelTable table, ResourceSnapshot snapshot) {
        String fallbackId = table.fallback().getId();
        for (String modelId : decision.getFallbackChainConsidered()) {
            if (modelId.equals(fallbackId)) {
                continue;
            }
            Optional<ModelProfile> profile = table.find(modelId);
            if (profile.isEmpty() || !isAdmissible(profile.get(), snapshot)) {
                return false;
            }
        }
        return true;
    }

    private static String sha256(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength) + "...";
    }
}
