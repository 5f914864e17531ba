package me.golemcore.pulse.domain.service;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.AssistantReply;
import me.golemcore.pulse.domain.model.CancellationToken;
import me.golemcore.pulse.domain.model.Entity;
import me.golemcore.pulse.domain.model.ErrorKind;
import me.golemcore.pulse.domain.model.InvocationResult;
import me.golemcore.pulse.domain.model.ReadResult;
import me.golemcore.pulse.domain.model.ResourceSnapshot;
import me.golemcore.pulse.domain.model.RoutingDecision;
import me.golemcore.pulse.domain.model.RoutingRequest;
import me.golemcore.pulse.domain.model.ScoredVectorRecord;
import me.golemcore.pulse.domain.model.SystemStatus;
import me.golemcore.pulse.domain.model.WriteAck;
import me.golemcore.pulse.execution.ErrorClassifier;
import me.golemcore.pulse.execution.InvocationExecutor;
import me.golemcore.pulse.persistence.PrimaryBackupRepository;
import me.golemcore.pulse.resilience.CircuitBreakerRegistry;
import me.golemcore.pulse.routing.AdaptiveRouter;
import me.golemcore.pulse.routing.RouterState;
import me.golemcore.pulse.vector.VectorStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Entry point of the orchestrator: routes queries, invokes models, persists
 * history and reports health.
 *
 * <p>
 * Owns the {@link RouterState} and one {@link CancellationToken} per session
 * with a query in flight. A new query for a session cancels the previous one;
 * shutdown cancels all of them. Asynchronous operations never complete
 * exceptionally: failures come back as {@link InvocationResult},
 * {@link ReadResult} or {@link WriteAck} envelopes.
 */
@Service
@Slf4j
public class OrchestratorService {

    private final AdaptiveRouter router;
    private final InvocationExecutor invocationExecutor;
    private final ChatHistoryService chatHistory;
    private final ContextAssemblyService contextAssembly;
    private final ResourceMonitor resourceMonitor;
    private final CircuitBreakerRegistry breakers;
    private final VectorStore vectorStore;
    private final PrimaryBackupRepository repository;
    private final ExecutorService executor;

    private final RouterState routerState = new RouterState();
    private final Map<String, CancellationToken> inFlight = new ConcurrentHashMap<>();

    public OrchestratorService(AdaptiveRouter router, InvocationExecutor invocationExecutor,
            ChatHistoryService chatHistory, ContextAssemblyService contextAssembly, ResourceMonitor resourceMonitor,
            CircuitBreakerRegistry breakers, VectorStore vectorStore, PrimaryBackupRepository repository,
            @Qualifier("invocationExecutor") ExecutorService executor) {
        this.router = router;
        this.invocationExecutor = invocationExecutor;
        this.chatHistory = chatHistory;
        this.contextAssembly = contextAssembly;
        this.resourceMonitor = resourceMonitor;
        this.breakers = breakers;
        this.vectorStore = vectorStore;
        this.repository = repository;
        this.executor = executor;
    }

    // ===== Routing and invocation =====

    public RoutingDecision route(String query, String explicitModelId, String intentHint) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        return router.route(routerState, new RoutingRequest(query, explicitModelId, intentHint));
    }

    /**
     * Executes a decision without session context.
     */
    public CompletableFuture<InvocationResult> invoke(RoutingDecision decision, String prompt) {
        return invocationExecutor.invoke(routerState, decision, prompt, "", CancellationToken.create());
    }

    /**
     * Answers a query in a session: assembles context, routes, invokes and
     * records the exchange. Supersedes any query still running for the session.
     */
    public CompletableFuture<AssistantReply> ask(String sessionId, String query, String explicitModelId) {
        if (sessionId == null || sessionId.isBlank() || query == null || query.isBlank()) {
            return CompletableFuture.completedFuture(failedReply(sessionId, null, ErrorKind.VALIDATION));
        }

        CancellationToken token = CancellationToken.create();
        CancellationToken previous = inFlight.put(sessionId, token);
        if (previous != null && previous.cancel("superseded by a newer query")) {
            log.info("[Orchestrator] Superseded in-flight query of session {}", sessionId);
        }

        return contextAssembly.assemble(sessionId, query, token)
                .thenComposeAsync(context -> {
                    RoutingDecision decision = router.route(routerState,
                            new RoutingRequest(query, explicitModelId, null));
                    return invocationExecutor.invoke(routerState, decision, query, context.text(), token)
                            .thenCompose(result -> complete(sessionId, query, decision, result));
                }, executor)
                .exceptionally(e -> {
                    ErrorKind kind = token.isCancelled() ? ErrorKind.CANCELLED : ErrorClassifier.classify(e);
                    log.warn("[Orchestrator] Query in session {} failed ({}): {}", sessionId, kind,
                            ErrorClassifier.unwrap(e).getMessage());
                    return failedReply(sessionId, null, kind);
                })
                .whenComplete((reply, error) -> inFlight.remove(sessionId, token));
    }

    /**
     * Cancels the query running for a session, if any.
     */
    public boolean cancel(String sessionId) {
        CancellationToken token = inFlight.remove(sessionId);
        return token != null && token.cancel("cancelled by caller");
    }

    // ===== History and memory =====

    public CompletableFuture<WriteAck> historyWrite(Entity entity) {
        return chatHistory.write(entity);
    }

    public CompletableFuture<ReadResult<Entity>> historyRead(String id) {
        return chatHistory.read(id);
    }

    public CompletableFuture<WriteAck> addMemory(String sessionId, String category, String content) {
        if (sessionId == null || sessionId.isBlank()) {
            return CompletableFuture.completedFuture(WriteAck.failed(null, ErrorKind.VALIDATION));
        }
        return chatHistory.addMemory(sessionId, category, content);
    }

    public CompletableFuture<ReadResult<List<ScoredVectorRecord>>> semanticSearch(String queryText, int k) {
        if (queryText == null || queryText.isBlank()) {
            return CompletableFuture.completedFuture(ReadResult.failed(ErrorKind.VALIDATION));
        }
        return chatHistory.search(queryText, k, Map.of())
                .thenApply(ReadResult::of)
                .exceptionally(e -> {
                    ErrorKind kind = ErrorClassifier.classify(e);
                    log.warn("[Orchestrator] Semantic search failed ({}): {}", kind,
                            ErrorClassifier.unwrap(e).getMessage());
                    return ReadResult.failed(kind);
                });
    }

    // ===== Status =====

    public CompletableFuture<SystemStatus> getStatus() {
        ResourceSnapshot snapshot = resourceMonitor.snapshot();
        return repository.countPendingPrimary()
                .exceptionally(e -> {
                    log.debug("[Orchestrator] Pending count unavailable: {}", ErrorClassifier.unwrap(e).getMessage());
                    return -1L;
                })
                .thenApply(pending -> SystemStatus.builder()
                        .snapshot(snapshot)
                        .breakers(breakers.states())
                        .usage(routerState.usageReport())
                        .vectorBackend(vectorStore.getActiveBackend())
                        .pendingPrimaryWrites(pending)
                        .build());
    }

    RouterState getRouterState() {
        return routerState;
    }

    @PreDestroy
    public void shutdown() {
        int cancelled = 0;
        for (CancellationToken token : inFlight.values()) {
            if (token.cancel("shutdown")) {
                cancelled++;
            }
        }
        inFlight.clear();
        if (cancelled > 0) {
            log.info("[Orchestrator] Cancelled {} in-flight queries on shutdown", cancelled);
        }
    }

    // ===== Internals =====

    private CompletableFuture<AssistantReply> complete(String sessionId, String query, RoutingDecision decision,
            InvocationResult result) {
        if (!result.isSuccess()) {
            return CompletableFuture.completedFuture(AssistantReply.builder()
                    .sessionId(sessionId)
                    .decision(decision)
                    .result(result)
                    .build());
        }
        return chatHistory.recordInteraction(sessionId, query, result.getText(), result.getModelId())
                .thenApply(ack -> AssistantReply.builder()
                        .sessionId(sessionId)
                        .decision(decision)
                        .result(result)
                        .persisted(ack)
                        .build());
    }

    private static AssistantReply failedReply(String sessionId, RoutingDecision decision, ErrorKind kind) {
        return AssistantReply.builder()
                .sessionId(sessionId)
                .decision(decision)
                .result(InvocationResult.failed(kind, List.of(), 0))
                .build();
    }
}
