package io.github.drompincen.agentrelay.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(
        String tool,
        String output,
        String error
) {
    public boolean failed() {
        return error != null && !error.isEmpty();
    }
}
