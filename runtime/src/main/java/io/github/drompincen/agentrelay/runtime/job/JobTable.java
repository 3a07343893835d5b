package io.github.drompincen.agentrelay.runtime.job;

import io.github.drompincen.agentrelay.protocol.api.JobKey;
import io.github.drompincen.agentrelay.protocol.event.AgentEvent;
import io.github.drompincen.agentrelay.runtime.agent.AgentAdapter;
import io.github.drompincen.agentrelay.runtime.agent.AgentHandle;
import io.github.drompincen.agentrelay.runtime.agent.AgentRequest;
import io.github.drompincen.agentrelay.runtime.partial.PartialResponseStore;
import io.github.drompincen.agentrelay.runtime.question.SuspendResumeController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * At most one running job per {@link JobKey}. Starting a job for a key that already has one
 * supersedes the old job; only the newest job's events reach the listener.
 *
 * <p>Everything that changes a key's job runs under that key's lock: starting, stopping, completing
 * and delivering an event. An event is checked against the current job and handed to the listener
 * without a gap, so a superseded job cannot write into its successor's partial response.
 */
@Service
public class JobTable {

    private static final Logger log = LoggerFactory.getLogger(JobTable.class);

    private final AgentAdapter agentAdapter;
    private final PartialResponseStore partials;
    private final SuspendResumeController questions;
    private final ConcurrentHashMap<JobKey, JobHandle> active = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<JobKey, Object> keyLocks = new ConcurrentHashMap<>();

    public JobTable(AgentAdapter agentAdapter, PartialResponseStore partials, SuspendResumeController questions) {
        this.agentAdapter = agentAdapter;
        this.partials = partials;
        this.questions = questions;
    }

    /**
     * Stops the key's running job, if any, resets its partial response and pending question, and
     * spawns the agent. The handle is registered before the agent starts, so even an immediate
     * {@code DONE} finds it.
     */
    public JobHandle start(JobKey key, AgentRequest request, JobListener listener) {
        JobHandle handle = new JobHandle(key, listener);
        synchronized (lock(key)) {
            stop(key, StopReason.SUPERSEDED);
            partials.begin(key, request.prompt(), request.sessionId());
            questions.clear(key);
            active.put(key, handle);

            AgentHandle agent;
            try {
                agent = agentAdapter.spawn(request, event -> deliver(handle, event));
            } catch (RuntimeException e) {
                if (active.remove(key, handle)) {
                    partials.complete(key);
                }
                throw e;
            }
            handle.attach(agent);
        }
        log.info("Started job {} for {}", handle.jobId(), key);
        return handle;
    }

    private void deliver(JobHandle handle, AgentEvent event) {
        synchronized (lock(handle.key())) {
            if (handle.isCurrent()) {
                handle.listener().onEvent(handle, event);
            } else {
                log.debug("Dropping {} event of detached job {}", event.type(), handle.jobId());
            }
        }
    }

    /** Cancels the key's job. Returns false, and does nothing, when no job is running. */
    public boolean cancel(JobKey key) {
        return stop(key, StopReason.CANCELLED);
    }

    /**
     * Stops the key's job and tells its listener why. Returns false when no job is running.
     */
    public boolean stop(JobKey key, StopReason reason) {
        synchronized (lock(key)) {
            JobHandle handle = active.remove(key);
            if (handle == null) {
                return false;
            }
            handle.detachAndCancel();
            log.info("{} job {} for {}", reason == StopReason.CANCELLED ? "Cancelled" : "Superseded",
                    handle.jobId(), key);
            handle.listener().onStopped(handle, reason);
            return true;
        }
    }

    /** Removes the job if {@code handle} is still the key's current job. */
    public boolean complete(JobKey key, JobHandle handle) {
        synchronized (lock(key)) {
            if (active.remove(key, handle)) {
                log.info("Job {} for {} finished", handle.jobId(), key);
                return true;
            }
            return false;
        }
    }

    public boolean isActive(JobKey key) {
        return active.containsKey(key);
    }

    public List<JobKey> activeKeys(String deviceId) {
        return active.keySet().stream().filter(k -> k.deviceId().equals(deviceId)).toList();
    }

    /** Keys of the project's running jobs on every device; {@code null} is the global chat. */
    public List<JobKey> projectKeys(String projectId) {
        return active.keySet().stream()
                .filter(k -> projectId == null ? k.isGlobal() : projectId.equals(k.projectId()))
                .toList();
    }

    public boolean isProjectActive(String projectId) {
        return !projectKeys(projectId).isEmpty();
    }

    /**
     * Terminates every running job without notifying listeners; used on shutdown, where partial
     * output stays on disk for recovery.
     */
    public int cancelAll() {
        int cancelled = 0;
        for (JobKey key : List.copyOf(active.keySet())) {
            synchronized (lock(key)) {
                JobHandle handle = active.remove(key);
                if (handle != null) {
                    handle.detachAndCancel();
                    cancelled++;
                }
            }
        }
        return cancelled;
    }

    private Object lock(JobKey key) {
        return keyLocks.computeIfAbsent(key, k -> new Object());
    }
}
