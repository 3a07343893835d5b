package io.github.drompincen.agentrelay.runtime.auth;

/**
 * Outcome of a PIN check. {@code retryAfterMs} is set only when rate limited.
 */
public record AuthResult(Status status, Long retryAfterMs) {

    public enum Status { OK, INVALID_PIN, RATE_LIMITED }

    public static AuthResult ok() {
        return new AuthResult(Status.OK, null);
    }

    public static AuthResult invalidPin() {
        return new AuthResult(Status.INVALID_PIN, null);
    }

    public static AuthResult rateLimited(long retryAfterMs) {
        return new AuthResult(Status.RATE_LIMITED, retryAfterMs);
    }

    public boolean succeeded() {
        return status == Status.OK;
    }
}
