package io.github.drompincen.agentrelay.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Suspended state of a job whose agent asked a question and then exited. {@code sessionId} is the
 * agent's continuity token, used to resume the conversation once the answer arrives.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PendingQuestion(
        String toolUseId,
        List<Question> questions,
        String projectId,
        String sessionId,
        Instant createdAt
) {
    public PendingQuestion {
        questions = questions != null ? List.copyOf(questions) : List.of();
    }
}
