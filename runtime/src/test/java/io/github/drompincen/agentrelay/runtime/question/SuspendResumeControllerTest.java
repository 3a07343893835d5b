package io.github.drompincen.agentrelay.runtime.question;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentrelay.persistence.file.PendingQuestionFile;
import io.github.drompincen.agentrelay.protocol.api.JobKey;
import io.github.drompincen.agentrelay.protocol.api.PendingQuestion;
import io.github.drompincen.agentrelay.protocol.api.ToolAnswer;
import io.github.drompincen.agentrelay.protocol.api.ToolUse;
import io.github.drompincen.agentrelay.protocol.event.AgentEvent;
import io.github.drompincen.agentrelay.runtime.config.RelayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SuspendResumeControllerTest {

    @TempDir
    Path dataDir;

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private final JobKey key = JobKey.of("dev", "proj");
    private PendingQuestionFile file;
    private SuspendResumeController controller;

    @BeforeEach
    void setUp() throws Exception {
        file = new PendingQuestionFile(mapper, dataDir);
        controller = new SuspendResumeController(file, mapper, RelayProperties.withDefaults("1234", dataDir, dataDir));
    }

    private AgentEvent ask(String id) throws Exception {
        JsonNode input = mapper.readTree("""
                {"questions":[{"question":"Which database?","header":"DB",
                  "options":[{"label":"Mongo"},{"label":"Postgres","description":"relational"}],
                  "multiSelect":false}]}""");
        return AgentEvent.toolUse(new ToolUse(SuspendResumeController.QUESTION_TOOL, id, input));
    }

    @Test
    void questionOutstandingAtExitBecomesPending() throws Exception {
        controller.observe(key, ask("tu-1"));

        PendingQuestion pending = controller.onJobExit(key, "sess-S").orElseThrow();

        assertThat(pending.toolUseId()).isEqualTo("tu-1");
        assertThat(pending.sessionId()).isEqualTo("sess-S");
        assertThat(pending.projectId()).isEqualTo("proj");
        assertThat(pending.questions()).hasSize(1);
        assertThat(pending.questions().get(0).options()).hasSize(2);
        assertThat(new PendingQuestionFile(mapper, dataDir).get(key.asString())).isPresent();
    }

    @Test
    void laterToolCallWithdrawsTheCandidate() throws Exception {
        controller.observe(key, ask("tu-1"));
        controller.observe(key, AgentEvent.toolUse(new ToolUse("Bash", "tu-2", null)));

        assertThat(controller.onJobExit(key, "s")).isEmpty();
        assertThat(controller.pending(key)).isEmpty();
    }

    @Test
    void resumeFormatsAnswersAndConsumesThePendingQuestion() throws Exception {
        controller.observe(key, ask("tu-1"));
        controller.onJobExit(key, "sess-S");

        ResumePlan plan = controller.prepareResume(key,
                List.of(new ToolAnswer("DB", "Mongo"), new ToolAnswer(null, "yes")));

        assertThat(plan.sessionId()).isEqualTo("sess-S");
        assertThat(plan.prompt()).isEqualTo(SuspendResumeController.ANSWER_PREAMBLE
                + "\n[DB]: Mongo\n[Question 2]: yes");
        assertThat(controller.pending(key)).isEmpty();
        assertThatThrownBy(() -> controller.prepareResume(key, List.of()))
                .isInstanceOf(NoPendingQuestionException.class);
    }

    @Test
    void answerWithoutPendingQuestionFails() {
        assertThatThrownBy(() -> controller.prepareResume(key, List.of(new ToolAnswer("h", "a"))))
                .isInstanceOf(NoPendingQuestionException.class);
    }

    @Test
    void clearDropsCandidateAndPendingQuestion() throws Exception {
        controller.observe(key, ask("tu-1"));
        controller.onJobExit(key, "s");
        controller.observe(key, ask("tu-2"));

        controller.clear(key);

        assertThat(controller.pending(key)).isEmpty();
        assertThat(controller.onJobExit(key, "s")).isEmpty();
    }

    @Test
    void staleQuestionsExpire() {
        file.put("dev|old", new PendingQuestion("tu-old", List.of(), "old", "s",
                Instant.now().minus(Duration.ofHours(25))));
        file.put("dev|new", new PendingQuestion("tu-new", List.of(), "new", "s", Instant.now()));

        assertThat(controller.expireStale()).isEqualTo(1);
        assertThat(file.all()).containsOnlyKeys("dev|new");
    }
}
