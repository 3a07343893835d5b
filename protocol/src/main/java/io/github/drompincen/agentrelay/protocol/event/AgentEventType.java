package io.github.drompincen.agentrelay.protocol.event;

public enum AgentEventType {
    SESSION,
    THINKING,
    TEXT,
    TOOL_USE,
    TOOL_RESULT,
    ERROR,
    DONE
}
