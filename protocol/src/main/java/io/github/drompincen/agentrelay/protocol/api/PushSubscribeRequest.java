package io.github.drompincen.agentrelay.protocol.api;

/** Body of {@code POST /api/push/subscribe}. */
public record PushSubscribeRequest(PushSubscription subscription, String deviceId) {
}
