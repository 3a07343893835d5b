package io.github.drompincen.agentrelay.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * A project directory under the projects root, as listed to clients. {@code lastAccessed} is the
 * directory's modification time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProjectSummary(String id, String path, String name, Instant lastAccessed) {
}
