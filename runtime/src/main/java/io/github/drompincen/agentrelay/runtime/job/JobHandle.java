package io.github.drompincen.agentrelay.runtime.job;

import io.github.drompincen.agentrelay.protocol.api.JobKey;
import io.github.drompincen.agentrelay.runtime.agent.AgentHandle;

import java.time.Instant;
import java.util.UUID;

/**
 * One started job. A handle stays current until it completes, is cancelled, or is superseded by a
 * newer job for the same key; events of a handle that is no longer current are dropped.
 */
public final class JobHandle {

    private final String jobId = UUID.randomUUID().toString();
    private final JobKey key;
    private final Instant startedAt = Instant.now();
    private final JobListener listener;
    private volatile AgentHandle agent;
    private volatile boolean detached;

    JobHandle(JobKey key, JobListener listener) {
        this.key = key;
        this.listener = listener;
    }

    public String jobId() { return jobId; }
    public JobKey key() { return key; }
    public Instant startedAt() { return startedAt; }

    JobListener listener() {
        return listener;
    }

    public boolean isCurrent() {
        return !detached;
    }

    void attach(AgentHandle agentHandle) {
        this.agent = agentHandle;
        if (detached) {
            agentHandle.cancel();
        }
    }

    /** Stops routing events from this job and terminates its agent. */
    void detachAndCancel() {
        detached = true;
        AgentHandle a = agent;
        if (a != null) {
            a.cancel();
        }
    }

    @Override
    public String toString() {
        return "JobHandle{" + key + ", jobId=" + jobId + (detached ? ", detached" : "") + "}";
    }
}
