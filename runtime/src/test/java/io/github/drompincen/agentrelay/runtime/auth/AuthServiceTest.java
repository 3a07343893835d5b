package io.github.drompincen.agentrelay.runtime.auth;

import io.github.drompincen.agentrelay.runtime.config.RelayProperties;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AuthServiceTest {

    private static AuthService service(int attempts) {
        Path dir = Path.of("target");
        return new AuthService(new RelayProperties("4321", dir, dir, null, null,
                new RelayProperties.AuthRateLimit(attempts, Duration.ofMinutes(1)), null, null, null, null));
    }

    @Test
    void correctPinAuthenticates() {
        assertThat(service(5).authenticate("10.0.0.1", "4321").succeeded()).isTrue();
    }

    @Test
    void wrongOrMissingPinIsRejected() {
        AuthService auth = service(5);

        assertThat(auth.authenticate("10.0.0.1", "0000").status()).isEqualTo(AuthResult.Status.INVALID_PIN);
        assertThat(auth.authenticate("10.0.0.1", null).status()).isEqualTo(AuthResult.Status.INVALID_PIN);
    }

    @Test
    void attemptsBeyondTheLimitAreRateLimitedPerAddress() {
        AuthService auth = service(2);

        auth.authenticate("10.0.0.1", "bad");
        auth.authenticate("10.0.0.1", "bad");
        AuthResult limited = auth.authenticate("10.0.0.1", "4321");

        assertThat(limited.status()).isEqualTo(AuthResult.Status.RATE_LIMITED);
        assertThat(limited.retryAfterMs()).isPositive();
        assertThat(auth.authenticate("10.0.0.2", "4321").succeeded()).isTrue();
    }

    @Test
    void wrongBearerPinsAreRateLimitedPerAddress() {
        AuthService auth = service(2);

        assertThat(auth.verifyPin("10.0.0.1", "nope").status()).isEqualTo(AuthResult.Status.INVALID_PIN);
        assertThat(auth.verifyPin("10.0.0.1", "nope").status()).isEqualTo(AuthResult.Status.INVALID_PIN);
        AuthResult limited = auth.verifyPin("10.0.0.1", "4321");

        assertThat(limited.status()).isEqualTo(AuthResult.Status.RATE_LIMITED);
        assertThat(limited.retryAfterMs()).isPositive();
        assertThat(auth.verifyPin("10.0.0.2", "4321").succeeded()).isTrue();
    }

    @Test
    void correctBearerPinDoesNotUseUpAttempts() {
        AuthService auth = service(1);

        for (int i = 0; i < 5; i++) {
            assertThat(auth.verifyPin("10.0.0.1", "4321").succeeded()).isTrue();
        }
        assertThat(auth.authenticate("10.0.0.1", "4321").succeeded()).isTrue();
    }

    @Test
    void bearerAndSocketAttemptsShareOneLimit() {
        AuthService auth = service(2);

        auth.authenticate("10.0.0.1", "bad");
        auth.verifyPin("10.0.0.1", "bad");

        assertThat(auth.verifyPin("10.0.0.1", "4321").status()).isEqualTo(AuthResult.Status.RATE_LIMITED);
        assertThat(auth.authenticate("10.0.0.1", "4321").status()).isEqualTo(AuthResult.Status.RATE_LIMITED);
    }
}
