package io.github.drompincen.agentrelay.runtime.auth;

import io.github.drompincen.agentrelay.runtime.config.RelayProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * PIN verification with a per-address attempt limit. The configured PIN is only kept as a BCrypt hash.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final PasswordEncoder encoder;
    private final String pinHash;
    private final RateLimiterRegistry rateLimiters;
    private final Duration window;

    public AuthService(RelayProperties properties) {
        this.encoder = new BCryptPasswordEncoder();
        this.pinHash = encoder.encode(properties.pin());
        this.window = properties.authRateLimit().window();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(properties.authRateLimit().attempts())
                .limitRefreshPeriod(window)
                .timeoutDuration(Duration.ZERO)
                .build();
        this.rateLimiters = RateLimiterRegistry.of(config);
    }

    /** PIN check of the WebSocket {@code auth} message; every attempt counts against the limit. */
    public AuthResult authenticate(String remoteAddress, String pin) {
        RateLimiter limiter = limiter(remoteAddress);
        if (!limiter.acquirePermission()) {
            log.warn("Auth rate limit exceeded for {}", remoteAddress);
            return AuthResult.rateLimited(window.toMillis());
        }
        if (!matches(pin)) {
            log.info("Rejected PIN from {}", remoteAddress);
            return AuthResult.invalidPin();
        }
        return AuthResult.ok();
    }

    /**
     * PIN check of a REST bearer token. It shares the address's limiter with {@link #authenticate},
     * but only wrong PINs use up attempts, so a client polling with the right PIN is never limited
     * while the address still has attempts left.
     */
    public AuthResult verifyPin(String remoteAddress, String pin) {
        RateLimiter limiter = limiter(remoteAddress);
        if (limiter.getMetrics().getAvailablePermissions() <= 0) {
            log.warn("Bearer PIN rate limit exceeded for {}", remoteAddress);
            return AuthResult.rateLimited(window.toMillis());
        }
        if (matches(pin)) {
            return AuthResult.ok();
        }
        if (!limiter.acquirePermission()) {
            return AuthResult.rateLimited(window.toMillis());
        }
        log.info("Rejected bearer PIN from {}", remoteAddress);
        return AuthResult.invalidPin();
    }

    private boolean matches(String pin) {
        return pin != null && !pin.isEmpty() && encoder.matches(pin, pinHash);
    }

    private RateLimiter limiter(String remoteAddress) {
        return rateLimiters.rateLimiter("auth:" + (remoteAddress != null ? remoteAddress : "unknown"));
    }
}
