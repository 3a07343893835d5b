package io.github.drompincen.agentrelay.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationMessage(
        String role,
        String content,
        String task,
        List<OutputChunk> chunks,
        String thinking,
        List<ToolActivity> activity,
        Instant startedAt,
        Instant completedAt,
        Boolean interrupted,
        Instant timestamp
) {
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public static ConversationMessage user(String content) {
        return new ConversationMessage(ROLE_USER, content, null, null, null, null,
                null, null, null, Instant.now());
    }

    public static ConversationMessage assistant(PartialResponse partial, Instant completedAt) {
        return new ConversationMessage(ROLE_ASSISTANT, partial.text(), partial.task(),
                emptyToNull(partial.chunks()), emptyToNull(partial.thinking()), emptyToNull(partial.activity()),
                partial.startedAt(), completedAt, null, completedAt);
    }

    public static ConversationMessage interruptedAssistant(PartialResponse partial, String marker, Instant at) {
        return new ConversationMessage(ROLE_ASSISTANT, partial.text() + marker, partial.task(),
                emptyToNull(partial.chunks()), emptyToNull(partial.thinking()), emptyToNull(partial.activity()),
                partial.startedAt(), at, Boolean.TRUE, at);
    }

    public boolean wasInterrupted() {
        return Boolean.TRUE.equals(interrupted);
    }

    private static <T> List<T> emptyToNull(List<T> list) {
        return list == null || list.isEmpty() ? null : list;
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
