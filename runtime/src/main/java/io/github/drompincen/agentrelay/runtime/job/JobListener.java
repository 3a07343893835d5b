package io.github.drompincen.agentrelay.runtime.job;

import io.github.drompincen.agentrelay.protocol.event.AgentEvent;

/**
 * Receives the events of the current job of a key. Calls for one key never overlap and a job's
 * events stop before {@link #onStopped} is called for it.
 */
@FunctionalInterface
public interface JobListener {

    void onEvent(JobHandle job, AgentEvent event);

    /**
     * The job was cancelled or superseded. Runs before the key's partial response is reset, so the
     * listener can still read and keep the job's output.
     */
    default void onStopped(JobHandle job, StopReason reason) {
    }
}
