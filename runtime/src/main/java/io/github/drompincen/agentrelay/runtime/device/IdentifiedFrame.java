package io.github.drompincen.agentrelay.runtime.device;

public record IdentifiedFrame(IdentifiedDevice device, String plaintext) {}
