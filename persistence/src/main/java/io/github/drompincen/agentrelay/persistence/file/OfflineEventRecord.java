package io.github.drompincen.agentrelay.persistence.file;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One line of the offline event log: a client-bound message that could not be delivered live.
 */
public record OfflineEventRecord(
        String deviceId,
        JsonNode event,
        long timestamp
) {}
