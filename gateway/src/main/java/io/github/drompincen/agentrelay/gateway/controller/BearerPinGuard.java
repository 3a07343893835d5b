package io.github.drompincen.agentrelay.gateway.controller;

import io.github.drompincen.agentrelay.runtime.auth.AuthResult;
import io.github.drompincen.agentrelay.runtime.auth.AuthService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Checks the {@code Authorization: Bearer <pin>} header of REST calls against the caller's address limit.
 */
@Component
public class BearerPinGuard {

    private static final String BEARER = "Bearer ";

    private final AuthService authService;

    public BearerPinGuard(AuthService authService) {
        this.authService = authService;
    }

    /**
     * Returns the error response for a request that may not proceed, or {@code null} when the PIN
     * is accepted. Rate-limited callers get 429 with {@code Retry-After} in seconds.
     */
    public ResponseEntity<?> reject(HttpServletRequest request, String authorization) {
        String pin = authorization != null && authorization.startsWith(BEARER)
                ? authorization.substring(BEARER.length()) : null;
        AuthResult result = authService.verifyPin(request.getRemoteAddr(), pin);
        return switch (result.status()) {
            case OK -> null;
            case INVALID_PIN -> ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "Invalid PIN"));
            case RATE_LIMITED -> ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .header(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, result.retryAfterMs() / 1000)))
                    .body(Map.of("error", "Too many attempts", "retryAfterMs", result.retryAfterMs()));
        };
    }
}
