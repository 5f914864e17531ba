package me.golemcore.pulse.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.pulse.domain.model.AssistantReply;
import me.golemcore.pulse.domain.model.InvocationResult;
import me.golemcore.pulse.domain.model.RoutingDecision;

import java.util.List;

/**
 * Answer to a chat request. {@code text} holds the model's reply, or a
 * user-facing error message when {@code success} is false.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskResponse {
    private String sessionId;
    private boolean success;
    private String text;
    private String modelId;
    private String intent;
    private Double confidence;
    private String errorKind;
    private List<String> attemptedModels;
    private boolean persisted;

    public static AskResponse from(AssistantReply reply) {
        InvocationResult result = reply.getResult();
        RoutingDecision decision = reply.getDecision();
        return AskResponse.builder()
                .sessionId(reply.getSessionId())
                .success(result.isSuccess())
                .text(reply.displayText())
                .modelId(result.getModelId())
                .intent(decision != null ? decision.getIntent() : null)
                .confidence(decision != null ? decision.getConfidence() : null)
                .errorKind(result.getErrorKind() != null ? result.getErrorKind().name() : null)
                .attemptedModels(result.getAttemptedModels())
                .persisted(reply.getPersisted() != null && reply.getPersisted().isSuccess())
                .build();
    }
}
