package io.github.drompincen.agentrelay.runtime.question;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentrelay.persistence.file.PendingQuestionFile;
import io.github.drompincen.agentrelay.protocol.api.JobKey;
import io.github.drompincen.agentrelay.protocol.api.PendingQuestion;
import io.github.drompincen.agentrelay.protocol.api.Question;
import io.github.drompincen.agentrelay.protocol.api.ToolAnswer;
import io.github.drompincen.agentrelay.protocol.api.ToolUse;
import io.github.drompincen.agentrelay.protocol.event.AgentEvent;
import io.github.drompincen.agentrelay.protocol.event.AgentEventType;
import io.github.drompincen.agentrelay.runtime.config.RelayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns "the agent asked a question and exited" into a suspended job, and an answer into the
 * prompt of a resumed one.
 *
 * <p>While a job runs, its latest {@code AskUserQuestion} tool call is the question candidate; a
 * call to any other tool withdraws it. If the run ends with a candidate outstanding, the question
 * is recorded as pending together with the agent session it belongs to.
 */
@Service
public class SuspendResumeController {

    private static final Logger log = LoggerFactory.getLogger(SuspendResumeController.class);

    public static final String QUESTION_TOOL = "AskUserQuestion";
    static final String ANSWER_PREAMBLE = "The user answered your questions:";

    private static final TypeReference<List<Question>> QUESTIONS_TYPE = new TypeReference<>() {};

    private final PendingQuestionFile pendingQuestions;
    private final ObjectMapper mapper;
    private final Duration ttl;
    private final ConcurrentHashMap<JobKey, ToolUse> candidates = new ConcurrentHashMap<>();

    public SuspendResumeController(PendingQuestionFile pendingQuestions, ObjectMapper mapper,
                                   RelayProperties properties) {
        this.pendingQuestions = pendingQuestions;
        this.mapper = mapper;
        this.ttl = properties.pendingQuestionTtl();
    }

    public void observe(JobKey key, AgentEvent event) {
        if (event.type() != AgentEventType.TOOL_USE || event.toolUse() == null) {
            return;
        }
        if (QUESTION_TOOL.equals(event.toolUse().tool())) {
            candidates.put(key, event.toolUse());
        } else {
            candidates.remove(key);
        }
    }

    /** Records the outstanding candidate, if any, as the key's pending question. */
    public Optional<PendingQuestion> onJobExit(JobKey key, String sessionId) {
        ToolUse candidate = candidates.remove(key);
        if (candidate == null) {
            return Optional.empty();
        }
        PendingQuestion pending = new PendingQuestion(candidate.id(), parseQuestions(candidate.input()),
                key.projectId(), sessionId, Instant.now());
        pendingQuestions.put(key.asString(), pending);
        log.info("Job {} suspended on question {} (session {})", key, candidate.id(), sessionId);
        return Optional.of(pending);
    }

    public void discardCandidate(JobKey key) {
        candidates.remove(key);
    }

    /** Forgets both the candidate and any recorded question for the key. */
    public void clear(JobKey key) {
        candidates.remove(key);
        pendingQuestions.remove(key.asString())
                .ifPresent(q -> log.info("Cleared pending question {} for {}", q.toolUseId(), key));
    }

    public Optional<PendingQuestion> pending(JobKey key) {
        return pendingQuestions.get(key.asString());
    }

    /**
     * Consumes the key's pending question and builds the prompt that resumes its session.
     *
     * @throws NoPendingQuestionException when nothing is pending for the key
     */
    public ResumePlan prepareResume(JobKey key, List<ToolAnswer> answers) {
        PendingQuestion pending = pendingQuestions.remove(key.asString())
                .orElseThrow(() -> new NoPendingQuestionException(key));
        candidates.remove(key);
        return new ResumePlan(formatAnswers(answers), pending.sessionId());
    }

    static String formatAnswers(List<ToolAnswer> answers) {
        StringBuilder sb = new StringBuilder(ANSWER_PREAMBLE);
        List<ToolAnswer> list = answers != null ? answers : List.of();
        for (int i = 0; i < list.size(); i++) {
            ToolAnswer a = list.get(i);
            String header = a.header() != null && !a.header().isBlank() ? a.header() : "Question " + (i + 1);
            sb.append('\n').append('[').append(header).append("]: ").append(a.answer() != null ? a.answer() : "");
        }
        return sb.toString();
    }

    @Scheduled(fixedDelay = 600000)
    public int expireStale() {
        Instant cutoff = Instant.now().minus(ttl);
        int expired = 0;
        for (Map.Entry<String, PendingQuestion> entry : pendingQuestions.all().entrySet()) {
            Instant created = entry.getValue().createdAt();
            if (created != null && created.isBefore(cutoff)) {
                pendingQuestions.remove(entry.getKey());
                expired++;
            }
        }
        if (expired > 0) {
            log.info("Expired {} pending question(s) older than {}", expired, ttl);
        }
        return expired;
    }

    private List<Question> parseQuestions(JsonNode input) {
        JsonNode questions = input != null ? input.get("questions") : null;
        if (questions == null || !questions.isArray()) {
            return List.of();
        }
        try {
            return mapper.convertValue(questions, QUESTIONS_TYPE);
        } catch (IllegalArgumentException e) {
            log.warn("Unreadable {} input, recording the question without details: {}", QUESTION_TOOL, e.getMessage());
            return List.of();
        }
    }
}
