package io.github.drompincen.agentrelay.protocol.api;

public record ToolAnswer(
        String header,
        String answer
) {}
