package io.github.drompincen.agentrelay.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of a response's tool timeline. {@code tool_use} entries carry {@code id} and
 * {@code input}; {@code tool_result} entries carry {@code output} or {@code error}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolActivity(
        Kind type,
        String tool,
        String id,
        JsonNode input,
        String output,
        String error,
        long timestamp
) {
    public enum Kind {
        @JsonProperty("tool_use") TOOL_USE,
        @JsonProperty("tool_result") TOOL_RESULT
    }

    public static ToolActivity use(ToolUse use, long timestamp) {
        return new ToolActivity(Kind.TOOL_USE, use.tool(), use.id(), use.input(), null, null, timestamp);
    }

    public static ToolActivity result(ToolResult result, long timestamp) {
        return new ToolActivity(Kind.TOOL_RESULT, result.tool(), null, null,
                result.output(), result.error(), timestamp);
    }
}
