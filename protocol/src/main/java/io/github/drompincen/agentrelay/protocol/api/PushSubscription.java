package io.github.drompincen.agentrelay.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A browser push subscription as produced by {@code PushManager.subscribe()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PushSubscription(String endpoint, Long expirationTime, Keys keys) {

    public record Keys(String p256dh, String auth) {
    }

    @JsonIgnore
    public boolean isComplete() {
        return endpoint != null && !endpoint.isBlank()
                && keys != null && keys.p256dh() != null && keys.auth() != null;
    }
}
