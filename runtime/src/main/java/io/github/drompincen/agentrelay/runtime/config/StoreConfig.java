package io.github.drompincen.agentrelay.runtime.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentrelay.persistence.file.OfflineEventFile;
import io.github.drompincen.agentrelay.persistence.file.PartialSnapshotFile;
import io.github.drompincen.agentrelay.persistence.file.PendingQuestionFile;
import io.github.drompincen.agentrelay.persistence.file.PushSubscriptionFile;
import io.github.drompincen.agentrelay.persistence.file.ReplayCursorFile;
import io.github.drompincen.agentrelay.persistence.file.VapidKeyFile;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * File-backed stores living under {@code agentrelay.data-dir}.
 */
@Configuration
@EnableConfigurationProperties(RelayProperties.class)
public class StoreConfig {

    @Bean
    public PartialSnapshotFile partialSnapshotFile(ObjectMapper objectMapper, RelayProperties properties) {
        return new PartialSnapshotFile(objectMapper, properties.dataDir());
    }

    @Bean
    public OfflineEventFile offlineEventFile(ObjectMapper objectMapper, RelayProperties properties) {
        return new OfflineEventFile(objectMapper, properties.dataDir());
    }

    @Bean
    public ReplayCursorFile replayCursorFile(ObjectMapper objectMapper, RelayProperties properties) {
        return new ReplayCursorFile(objectMapper, properties.dataDir());
    }

    @Bean
    public PendingQuestionFile pendingQuestionFile(ObjectMapper objectMapper, RelayProperties properties) {
        return new PendingQuestionFile(objectMapper, properties.dataDir());
    }

    @Bean
    public PushSubscriptionFile pushSubscriptionFile(ObjectMapper objectMapper, RelayProperties properties) {
        return new PushSubscriptionFile(objectMapper, properties.dataDir());
    }

    @Bean
    public VapidKeyFile vapidKeyFile(ObjectMapper objectMapper, RelayProperties properties) {
        return new VapidKeyFile(objectMapper, properties.dataDir());
    }
}
