package io.github.drompincen.agentrelay.protocol.event;

import io.github.drompincen.agentrelay.protocol.api.ToolResult;
import io.github.drompincen.agentrelay.protocol.api.ToolUse;

/**
 * Typed event emitted by an agent process. Every run ends with exactly one {@link AgentEventType#DONE};
 * {@link AgentEventType#SESSION} reports the continuity token the next run can resume from.
 */
public record AgentEvent(
        AgentEventType type,
        String text,
        ToolUse toolUse,
        ToolResult toolResult,
        String sessionId
) {
    public static AgentEvent session(String sessionId) {
        return new AgentEvent(AgentEventType.SESSION, null, null, null, sessionId);
    }

    public static AgentEvent thinking(String text) {
        return new AgentEvent(AgentEventType.THINKING, text, null, null, null);
    }

    public static AgentEvent text(String text) {
        return new AgentEvent(AgentEventType.TEXT, text, null, null, null);
    }

    public static AgentEvent toolUse(ToolUse toolUse) {
        return new AgentEvent(AgentEventType.TOOL_USE, null, toolUse, null, null);
    }

    public static AgentEvent toolResult(ToolResult toolResult) {
        return new AgentEvent(AgentEventType.TOOL_RESULT, null, null, toolResult, null);
    }

    public static AgentEvent error(String message) {
        return new AgentEvent(AgentEventType.ERROR, message, null, null, null);
    }

    public static AgentEvent done() {
        return new AgentEvent(AgentEventType.DONE, null, null, null, null);
    }
}
