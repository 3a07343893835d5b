package io.github.drompincen.agentrelay.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * Identifies one logical agent task: at most one job per (device, project) runs at a time.
 * A {@code null} project denotes the legacy global job of a device.
 */
public record JobKey(String deviceId, String projectId) {

    public static final String GLOBAL_PROJECT = "__global__";
    private static final char SEPARATOR = '|';

    public JobKey {
        Objects.requireNonNull(deviceId, "deviceId");
        if (projectId != null && (projectId.isBlank() || GLOBAL_PROJECT.equals(projectId))) {
            projectId = null;
        }
    }

    public static JobKey of(String deviceId, String projectId) {
        return new JobKey(deviceId, projectId);
    }

    @JsonIgnore
    public boolean isGlobal() {
        return projectId == null;
    }

    /** Project id as reported in {@code auth_ok.activeProjectIds}. */
    public String projectIdOrGlobal() {
        return projectId != null ? projectId : GLOBAL_PROJECT;
    }

    /** Stable string form used as a key in the JSON stores. */
    public String asString() {
        return deviceId + SEPARATOR + projectIdOrGlobal();
    }

    public static JobKey parse(String value) {
        int idx = value.indexOf(SEPARATOR);
        if (idx <= 0) {
            throw new IllegalArgumentException("Not a job key: " + value);
        }
        return new JobKey(value.substring(0, idx), value.substring(idx + 1));
    }

    @Override
    public String toString() {
        return asString();
    }
}
