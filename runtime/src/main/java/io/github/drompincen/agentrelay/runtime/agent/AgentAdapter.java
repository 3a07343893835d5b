package io.github.drompincen.agentrelay.runtime.agent;

/**
 * Runs an external agent and reports its output as events. Events of one run are delivered
 * sequentially and end with exactly one {@code DONE}, optionally preceded by an {@code ERROR}.
 */
public interface AgentAdapter {

    AgentHandle spawn(AgentRequest request, AgentListener listener);
}
