package io.github.drompincen.agentrelay.runtime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings under {@code agentrelay.*}. Unset values fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "agentrelay")
public record RelayProperties(
        String pin,
        Path dataDir,
        Path projectsRoot,
        String agentCommand,
        Duration flushInterval,
        AuthRateLimit authRateLimit,
        Duration pendingQuestionTtl,
        Duration sendTimeLimit,
        DataSize sendBufferSize,
        Push push
) {
    private static final Duration MIN_FLUSH_INTERVAL = Duration.ofSeconds(1);

    public RelayProperties {
        if (pin == null || pin.isBlank()) {
            throw new IllegalArgumentException("agentrelay.pin must be set");
        }
        dataDir = dataDir != null ? dataDir : Path.of(System.getProperty("user.home"), ".agentrelay");
        projectsRoot = projectsRoot != null ? projectsRoot : Path.of(System.getProperty("user.home"), "projects");
        agentCommand = agentCommand != null && !agentCommand.isBlank() ? agentCommand : "claude";
        flushInterval = flushInterval == null || flushInterval.compareTo(MIN_FLUSH_INTERVAL) < 0
                ? MIN_FLUSH_INTERVAL : flushInterval;
        authRateLimit = authRateLimit != null ? authRateLimit : new AuthRateLimit(0, null);
        pendingQuestionTtl = pendingQuestionTtl != null ? pendingQuestionTtl : Duration.ofHours(24);
        sendTimeLimit = sendTimeLimit != null ? sendTimeLimit : Duration.ofSeconds(10);
        sendBufferSize = sendBufferSize != null ? sendBufferSize : DataSize.ofKilobytes(512);
        push = push != null ? push : new Push(null);
    }

    public static RelayProperties withDefaults(String pin, Path dataDir, Path projectsRoot) {
        return new RelayProperties(pin, dataDir, projectsRoot, null, null, null, null, null, null, null);
    }

    @Override
    public String toString() {
        return "RelayProperties[dataDir=" + dataDir + ", projectsRoot=" + projectsRoot
                + ", agentCommand=" + agentCommand + ", flushInterval=" + flushInterval + "]";
    }

    /** Web push settings. {@code subject} is the VAPID contact, a {@code mailto:} or https URL. */
    public record Push(String subject) {
        public Push {
            subject = subject != null && !subject.isBlank() ? subject : "https://localhost";
        }
    }

    /** Auth attempts allowed per remote address within {@code window}. */
    public record AuthRateLimit(int attempts, Duration window) {
        public AuthRateLimit {
            attempts = attempts > 0 ? attempts : 10;
            window = window != null ? window : Duration.ofMinutes(1);
        }
    }
}
