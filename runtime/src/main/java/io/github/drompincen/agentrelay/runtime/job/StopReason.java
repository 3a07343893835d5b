package io.github.drompincen.agentrelay.runtime.job;

/** Why a running job ended before its agent finished. */
public enum StopReason {
    CANCELLED,
    SUPERSEDED
}
