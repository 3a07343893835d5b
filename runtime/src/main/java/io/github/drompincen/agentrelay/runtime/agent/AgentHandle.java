package io.github.drompincen.agentrelay.runtime.agent;

/**
 * Cancellation handle of a spawned agent run. Cancelling is idempotent.
 */
@FunctionalInterface
public interface AgentHandle {

    void cancel();
}
