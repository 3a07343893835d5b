package io.github.drompincen.agentrelay.runtime.push;

import io.github.drompincen.agentrelay.protocol.api.PushSubscription;

import java.io.IOException;

/**
 * Delivers an encrypted web push message to one subscription.
 */
public interface PushSender {

    /** Public VAPID key, base64url, that browsers pass as {@code applicationServerKey}. */
    String publicKey();

    /** @return the push service's HTTP status */
    int send(PushSubscription subscription, String payload) throws IOException;
}
