package io.github.drompincen.agentrelay.runtime.agent;

import io.github.drompincen.agentrelay.protocol.event.AgentEvent;

@FunctionalInterface
public interface AgentListener {

    void onEvent(AgentEvent event);
}
