package io.github.drompincen.agentrelay.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Best-known accumulated output of an in-flight job.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PartialResponse(
        String task,
        String text,
        String thinking,
        List<ToolActivity> activity,
        List<OutputChunk> chunks,
        String sessionId,
        Instant startedAt,
        Instant updatedAt
) {
    public PartialResponse {
        text = text != null ? text : "";
        thinking = thinking != null ? thinking : "";
        activity = activity != null ? List.copyOf(activity) : List.of();
        chunks = chunks != null ? List.copyOf(chunks) : List.of();
    }

    public static PartialResponse empty(String task, Instant startedAt) {
        return new PartialResponse(task, "", "", List.of(), List.of(), null, startedAt, startedAt);
    }

    public boolean hasContent() {
        return !text.isEmpty() || !thinking.isEmpty() || !activity.isEmpty();
    }
}
