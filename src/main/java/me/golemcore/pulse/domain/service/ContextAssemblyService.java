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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pulse.domain.model.AssembledContext;
import me.golemcore.pulse.domain.model.CancellationToken;
import me.golemcore.pulse.domain.model.Entity;
import me.golemcore.pulse.domain.model.EntityKind;
import me.golemcore.pulse.domain.model.ReadResult;
import me.golemcore.pulse.domain.model.ScoredVectorRecord;
import me.golemcore.pulse.execution.ErrorClassifier;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Builds the prompt context for a query from the session's recent turns and
 * its semantically related memories.
 *
 * <p>
 * The budget is {@code pulse.context.max-tokens} tokens, estimated at
 * {@code chars-per-token} characters each. Turns get {@code turn-share} of it,
 * newest first but rendered oldest first; memories get the rest, best match
 * first. Either source failing leaves its section out and marks the context
 * degraded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextAssemblyService {

    private static final String TURNS_HEADER = "Recent conversation:\n";
    private static final String MEMORIES_HEADER = "Related memories:\n";

    private final ChatHistoryService chatHistory;
    private final PulseProperties properties;

    public CompletableFuture<AssembledContext> assemble(String sessionId, String query, CancellationToken token) {
        if (token.isCancelled()) {
            return CompletableFuture.completedFuture(AssembledContext.empty());
        }
        PulseProperties.ContextProperties config = properties.getContext();

        CompletableFuture<ReadResult<List<Entity>>> turns = chatHistory.recentTurns(sessionId, config.getRecentTurns())
                .exceptionally(e -> {
                    log.warn("[Context] Recent turns unavailable for {}: {}", sessionId,
                            ErrorClassifier.unwrap(e).getMessage());
                    return null;
                });
        CompletableFuture<List<ScoredVectorRecord>> memories = chatHistory
                .search(query, config.getRelatedMemories(),
                        Map.of(ChatHistoryService.META_KIND, EntityKind.MEMORY.name(),
                                ChatHistoryService.META_SESSION, sessionId))
                .exceptionally(e -> {
                    log.debug("[Context] Related memories unavailable: {}", ErrorClassifier.unwrap(e).getMessage());
                    return null;
                });

        CompletableFuture<AssembledContext> assembled = turns.thenCombine(memories, this::render);
        CancellationToken.Registration registration = token.register(assembled);
        return assembled.whenComplete((result, error) -> registration.close());
    }

    private AssembledContext render(ReadResult<List<Entity>> turnsResult, List<ScoredVectorRecord> memories) {
        PulseProperties.ContextProperties config = properties.getContext();
        int budget = config.getMaxTokens() * config.getCharsPerToken();
        int turnBudget = (int) (budget * config.getTurnShare());
        int memoryBudget = budget - turnBudget;

        boolean degraded = turnsResult == null || !turnsResult.isSuccess() || turnsResult.isDegraded()
                || memories == null;

        List<String> turnLines = new ArrayList<>();
        if (turnsResult != null && turnsResult.isSuccess()) {
            List<Entity> turns = turnsResult.getValue();
            int used = 0;
            for (int i = turns.size() - 1; i >= 0; i--) {
                String line = formatTurn(turns.get(i));
                if (used + line.length() > turnBudget) {
                    break;
                }
                turnLines.add(line);
                used += line.length();
            }
            Collections.reverse(turnLines);
        }

        List<String> memoryLines = new ArrayList<>();
        if (memories != null) {
            int used = 0;
            for (ScoredVectorRecord memory : memories) {
                String line = formatMemory(memory);
                if (used + line.length() > memoryBudget) {
                    break;
                }
                memoryLines.add(line);
                used += line.length();
            }
        }

        StringBuilder text = new StringBuilder();
        if (!turnLines.isEmpty()) {
            text.append(TURNS_HEADER).append(String.join("", turnLines));
        }
        if (!memoryLines.isEmpty()) {
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(MEMORIES_HEADER).append(String.join("", memoryLines));
        }
        return new AssembledContext(text.toString().strip(), turnLines.size(), memoryLines.size(), degraded);
    }

    private static String formatTurn(Entity turn) {
        return "User: " + nullToEmpty(turn.payloadText(ChatHistoryService.PAYLOAD_USER))
                + "\nAssistant: " + nullToEmpty(turn.payloadText(ChatHistoryService.PAYLOAD_ASSISTANT)) + "\n";
    }

    private static String formatMemory(ScoredVectorRecord memory) {
        Map<String, String> metadata = memory.record().getMetadata();
        String category = metadata != null ? metadata.get(ChatHistoryService.META_CATEGORY) : null;
        String text = metadata != null ? metadata.get(ChatHistoryService.META_TEXT) : null;
        return "- " + (category != null ? "[" + category + "] " : "") + nullToEmpty(text) + "\n";
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
