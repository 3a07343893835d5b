package io.github.drompincen.agentrelay.runtime.session;

import io.github.drompincen.agentrelay.protocol.api.ConversationMessage;
import io.github.drompincen.agentrelay.protocol.api.JobKey;
import io.github.drompincen.agentrelay.protocol.api.PartialResponse;
import io.github.drompincen.agentrelay.protocol.api.ToolAnswer;
import io.github.drompincen.agentrelay.protocol.event.AgentEvent;
import io.github.drompincen.agentrelay.protocol.ws.WsMessage;
import io.github.drompincen.agentrelay.runtime.agent.AgentRequest;
import io.github.drompincen.agentrelay.runtime.conversation.ConversationStore;
import io.github.drompincen.agentrelay.runtime.job.JobHandle;
import io.github.drompincen.agentrelay.runtime.job.JobListener;
import io.github.drompincen.agentrelay.runtime.job.JobTable;
import io.github.drompincen.agentrelay.runtime.job.StopReason;
import io.github.drompincen.agentrelay.runtime.partial.PartialResponseStore;
import io.github.drompincen.agentrelay.runtime.project.ProjectResolver;
import io.github.drompincen.agentrelay.runtime.push.PushNotifier;
import io.github.drompincen.agentrelay.runtime.question.ResumePlan;
import io.github.drompincen.agentrelay.runtime.question.SuspendResumeController;
import io.github.drompincen.agentrelay.runtime.sync.DeviceConnection;
import io.github.drompincen.agentrelay.runtime.sync.MultiDeviceSynchronizer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Owns the job lifecycle: turns authenticated device requests into jobs, routes agent events into
 * the partial store, the question tracker and the device fan-out, and persists the finished
 * response. Also runs crash recovery before the first connection is served.
 */
@Service
public class SessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);

    private final JobTable jobTable;
    private final PartialResponseStore partials;
    private final SuspendResumeController questions;
    private final MultiDeviceSynchronizer synchronizer;
    private final ConversationStore conversations;
    private final ProjectResolver projects;
    private final PushNotifier push;
    private final JobListener jobListener = new JobListener() {
        @Override
        public void onEvent(JobHandle job, AgentEvent event) {
            onAgentEvent(job, event);
        }

        @Override
        public void onStopped(JobHandle job, StopReason reason) {
            onJobStopped(job, reason);
        }
    };
    private volatile boolean running;

    public SessionOrchestrator(JobTable jobTable, PartialResponseStore partials, SuspendResumeController questions,
                               MultiDeviceSynchronizer synchronizer, ConversationStore conversations,
                               ProjectResolver projects, PushNotifier push) {
        this.jobTable = jobTable;
        this.partials = partials;
        this.questions = questions;
        this.synchronizer = synchronizer;
        this.conversations = conversations;
        this.projects = projects;
        this.push = push;
    }

    @PostConstruct
    public void start() {
        int recovered = partials.recover(conversations);
        partials.start();
        running = true;
        log.info("Session orchestrator started ({} interrupted response(s) recovered)", recovered);
    }

    /** Stops accepting work and cancels running jobs. Their partial output stays on disk for recovery. */
    @PreDestroy
    public void stop() {
        running = false;
        int cancelled = jobTable.cancelAll();
        partials.stop();
        log.info("Session orchestrator stopped, {} running job(s) cancelled", cancelled);
    }

    /** Registers an authenticated connection and sends it auth_ok, restores and its offline backlog. */
    public void attach(DeviceConnection connection) {
        String deviceId = connection.deviceId();
        synchronizer.attach(connection, () -> {
            List<JobKey> keys = jobTable.activeKeys(deviceId);
            List<WsMessage> greeting = new ArrayList<>();
            greeting.add(WsMessage.authOk(keys.stream().map(JobKey::projectIdOrGlobal).toList()));
            for (JobKey key : keys) {
                partials.get(key).ifPresent(p -> greeting.add(WsMessage.streamingRestore(key.projectId(), p)));
            }
            return greeting;
        });
    }

    public void detach(DeviceConnection connection) {
        synchronizer.detach(connection);
    }

    /**
     * Persists the user's message, mirrors it to the other devices and starts a job that continues
     * the project's agent session. A job still running for the same device and project is stopped
     * first and its output saved ahead of the new message.
     *
     * @throws io.github.drompincen.agentrelay.runtime.project.ProjectNotFoundException for an invalid project id
     */
    public JobHandle submitMessage(String deviceId, String projectId, String text) {
        requireRunning();
        JobKey key = JobKey.of(deviceId, projectId);
        Path cwd = projects.resolve(key.projectId());
        jobTable.stop(key, StopReason.SUPERSEDED);
        conversations.append(key.projectId(), ConversationMessage.user(text));
        synchronizer.notifyOthers(deviceId, WsMessage.syncUserMessage(key.projectId(), text));
        String sessionId = conversations.sessionId(key.projectId()).orElse(null);
        return startJob(key, new AgentRequest(text, sessionId, cwd));
    }

    /**
     * Cancels the device's job for the project. The partial output is kept as the assistant's
     * answer and every device is told the job is done.
     *
     * @return false when nothing was running for the key
     */
    public boolean cancel(String deviceId, String projectId) {
        return jobTable.cancel(JobKey.of(deviceId, projectId));
    }

    /**
     * Cancels the project's jobs on every device.
     *
     * @return the number of jobs that were running
     */
    public int cancelProject(String projectId) {
        int cancelled = 0;
        for (JobKey key : jobTable.projectKeys(projectId)) {
            if (jobTable.cancel(key)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    /**
     * Resumes a suspended job with the user's answers.
     *
     * @throws io.github.drompincen.agentrelay.runtime.question.NoPendingQuestionException when nothing is pending
     */
    public JobHandle answerQuestion(String deviceId, String projectId, List<ToolAnswer> answers) {
        requireRunning();
        JobKey key = JobKey.of(deviceId, projectId);
        Path cwd = projects.resolve(key.projectId());
        ResumePlan plan = questions.prepareResume(key, answers);
        jobTable.stop(key, StopReason.SUPERSEDED);
        conversations.append(key.projectId(), ConversationMessage.user(plan.prompt()));
        return startJob(key, new AgentRequest(plan.prompt(), plan.sessionId(), cwd));
    }

    public Optional<PartialResponse> partial(JobKey key) {
        return partials.get(key);
    }

    public boolean isProjectActive(String projectId) {
        return jobTable.isProjectActive(projectId);
    }

    private JobHandle startJob(JobKey key, AgentRequest request) {
        return jobTable.start(key, request, jobListener);
    }

    /**
     * A cancelled or superseded job keeps what it produced: the partial becomes the assistant's answer
     * and every device is told the job is done.
     */
    void onJobStopped(JobHandle job, StopReason reason) {
        JobKey key = job.key();
        questions.discardCandidate(key);
        if (reason == StopReason.CANCELLED) {
            synchronizer.notifyOthers(key.deviceId(), WsMessage.syncCancel(key.projectId()));
        }
        persistResponse(key);
        synchronizer.publishJobEvent(key.deviceId(), WsMessage.done(key.projectId()));
    }

    void onAgentEvent(JobHandle job, AgentEvent event) {
        JobKey key = job.key();
        String projectId = key.projectId();
        switch (event.type()) {
            case SESSION -> {
                partials.apply(key, event);
                conversations.saveSessionId(projectId, event.sessionId());
            }
            case THINKING -> synchronizer.publishJobEvent(key.deviceId(), WsMessage.thinking(projectId, event.text()),
                    () -> applyAndObserve(key, event));
            case TEXT -> synchronizer.publishJobEvent(key.deviceId(), WsMessage.text(projectId, event.text()),
                    () -> applyAndObserve(key, event));
            case TOOL_USE -> synchronizer.publishJobEvent(key.deviceId(), WsMessage.toolUse(projectId, event.toolUse()),
                    () -> applyAndObserve(key, event));
            case TOOL_RESULT -> synchronizer.publishJobEvent(key.deviceId(),
                    WsMessage.toolResult(projectId, event.toolResult()), () -> applyAndObserve(key, event));
            case ERROR -> synchronizer.publishJobEvent(key.deviceId(), WsMessage.error(projectId, event.text()));
            case DONE -> {
                if (jobTable.complete(key, job)) {
                    Optional<PartialResponse> finished = persistResponse(key);
                    questions.onJobExit(key, finished.map(PartialResponse::sessionId).orElse(null));
                    synchronizer.publishJobEvent(key.deviceId(), WsMessage.done(projectId));
                    push.notifyJobFinished(key);
                }
            }
        }
    }

    private void applyAndObserve(JobKey key, AgentEvent event) {
        partials.apply(key, event);
        questions.observe(key, event);
    }

    /** Moves the key's partial response into the conversation, if it has any content. */
    private Optional<PartialResponse> persistResponse(JobKey key) {
        Optional<PartialResponse> finished = Optional.empty();
        try {
            finished = partials.complete(key);
            finished.filter(PartialResponse::hasContent).ifPresent(p ->
                    conversations.append(key.projectId(), ConversationMessage.assistant(p, Instant.now())));
        } catch (RuntimeException e) {
            log.error("Failed to persist the response of {}", key, e);
        }
        return finished;
    }

    private void requireRunning() {
        if (!running) {
            throw new IllegalStateException("Server is shutting down");
        }
    }
}
