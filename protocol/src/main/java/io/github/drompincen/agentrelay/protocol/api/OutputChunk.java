package io.github.drompincen.agentrelay.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Display segment of a response's text. {@code afterTool} names the tool whose activity
 * immediately preceded the segment, if any.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutputChunk(
        String text,
        String afterTool,
        long timestamp
) {
    public OutputChunk append(String more) {
        return new OutputChunk(text + more, afterTool, timestamp);
    }
}
