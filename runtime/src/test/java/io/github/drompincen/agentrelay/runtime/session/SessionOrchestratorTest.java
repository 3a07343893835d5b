package io.github.drompincen.agentrelay.runtime.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentrelay.persistence.file.OfflineEventFile;
import io.github.drompincen.agentrelay.persistence.file.PartialSnapshotFile;
import io.github.drompincen.agentrelay.persistence.file.PendingQuestionFile;
import io.github.drompincen.agentrelay.persistence.file.PushSubscriptionFile;
import io.github.drompincen.agentrelay.persistence.file.ReplayCursorFile;
import io.github.drompincen.agentrelay.protocol.api.ConversationMessage;
import io.github.drompincen.agentrelay.protocol.api.JobKey;
import io.github.drompincen.agentrelay.protocol.api.PartialResponse;
import io.github.drompincen.agentrelay.protocol.api.PushSubscription;
import io.github.drompincen.agentrelay.protocol.api.ToolAnswer;
import io.github.drompincen.agentrelay.protocol.api.ToolUse;
import io.github.drompincen.agentrelay.protocol.event.AgentEvent;
import io.github.drompincen.agentrelay.protocol.ws.WsMessage;
import io.github.drompincen.agentrelay.protocol.ws.WsMessageType;
import io.github.drompincen.agentrelay.runtime.config.RelayProperties;
import io.github.drompincen.agentrelay.runtime.job.JobTable;
import io.github.drompincen.agentrelay.runtime.offline.OfflineEventLog;
import io.github.drompincen.agentrelay.runtime.partial.PartialResponseStore;
import io.github.drompincen.agentrelay.runtime.project.ProjectNotFoundException;
import io.github.drompincen.agentrelay.runtime.project.ProjectResolver;
import io.github.drompincen.agentrelay.runtime.question.NoPendingQuestionException;
import io.github.drompincen.agentrelay.runtime.push.PushNotifier;
import io.github.drompincen.agentrelay.runtime.question.SuspendResumeController;
import io.github.drompincen.agentrelay.runtime.support.FakeAgentAdapter;
import io.github.drompincen.agentrelay.runtime.support.InMemoryConversationStore;
import io.github.drompincen.agentrelay.runtime.support.RecordingPushSender;
import io.github.drompincen.agentrelay.runtime.support.RecordingConnection;
import io.github.drompincen.agentrelay.runtime.sync.MultiDeviceSynchronizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionOrchestratorTest {

    private static final String P = "proj";

    @TempDir
    Path tmp;

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private RelayProperties props;
    private FakeAgentAdapter agent;
    private InMemoryConversationStore conversations;
    private PartialSnapshotFile snapshotFile;
    private final RecordingPushSender pushSender = new RecordingPushSender();
    private PushNotifier push;
    private SessionOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws Exception {
        Path projects = Files.createDirectories(tmp.resolve("projects"));
        Files.createDirectories(projects.resolve(P));
        props = RelayProperties.withDefaults("1234", tmp.resolve("data"), projects);
        agent = new FakeAgentAdapter();
        conversations = new InMemoryConversationStore();
        snapshotFile = new PartialSnapshotFile(mapper, props.dataDir());
        orchestrator = newOrchestrator();
        orchestrator.start();
    }

    @AfterEach
    void tearDown() {
        orchestrator.stop();
    }

    private SessionOrchestrator newOrchestrator() {
        PartialResponseStore partials = new PartialResponseStore(snapshotFile, props);
        SuspendResumeController questions = new SuspendResumeController(
                new PendingQuestionFile(mapper, props.dataDir()), mapper, props);
        OfflineEventLog offline = new OfflineEventLog(new OfflineEventFile(mapper, props.dataDir()),
                new ReplayCursorFile(mapper, props.dataDir()));
        MultiDeviceSynchronizer synchronizer = new MultiDeviceSynchronizer(offline, mapper, Runnable::run);
        push = new PushNotifier(new PushSubscriptionFile(mapper, props.dataDir()), pushSender, synchronizer,
                mapper, Runnable::run);
        return new SessionOrchestrator(new JobTable(agent, partials, questions), partials, questions,
                synchronizer, conversations, new ProjectResolver(props), push);
    }

    private RecordingConnection connect(String deviceId) {
        RecordingConnection c = new RecordingConnection(deviceId);
        orchestrator.attach(c);
        return c;
    }

    @Test
    void secondDeviceSeesTheUserMessageAndTheSameStream() {
        RecordingConnection a = connect("A");
        RecordingConnection b = connect("B");
        a.clear();
        b.clear();

        orchestrator.submitMessage("A", P, "hi");
        agent.lastRun().emit(AgentEvent.text("Looking."),
                AgentEvent.toolUse(new ToolUse("Bash", "t1", null))).finish();

        assertThat(b.sent().get(0)).isEqualTo(WsMessage.syncUserMessage(P, "hi"));
        assertThat(b.sent().subList(1, b.sent().size())).isEqualTo(a.sent());
        assertThat(a.sentTypes()).containsExactly(WsMessageType.TEXT, WsMessageType.TOOL_USE, WsMessageType.DONE);

        List<ConversationMessage> history = conversations.load(P);
        assertThat(history).extracting(ConversationMessage::role)
                .containsExactly(ConversationMessage.ROLE_USER, ConversationMessage.ROLE_ASSISTANT);
        assertThat(history.get(1).content()).isEqualTo("Looking.");
        assertThat(history.get(1).activity()).hasSize(1);
        assertThat(orchestrator.isProjectActive(P)).isFalse();
    }

    @Test
    void reconnectingDeviceGetsRestoreThenExactlyTheMissedEvents() {
        RecordingConnection a = connect("A");
        orchestrator.submitMessage("A", P, "long job");
        FakeAgentAdapter.Run run = agent.lastRun();
        run.emit(AgentEvent.text("first"));

        orchestrator.detach(a);
        a.drop();
        run.emit(AgentEvent.text(" second"), AgentEvent.toolUse(new ToolUse("Read", "t1", null)),
                AgentEvent.text("Now third"));

        RecordingConnection back = connect("A");
        run.emit(AgentEvent.text(" live"));

        assertThat(back.sentTypes()).containsExactly(WsMessageType.AUTH_OK, WsMessageType.STREAMING_RESTORE,
                WsMessageType.TEXT, WsMessageType.TOOL_USE, WsMessageType.TEXT, WsMessageType.TEXT);
        assertThat(back.sent().get(0).activeProjectIds()).containsExactly(P);
        WsMessage restore = back.sent().get(1);
        assertThat(restore.projectId()).isEqualTo(P);
        assertThat(restore.text()).isEqualTo("first secondNow third");
        assertThat(restore.activity()).hasSize(1);
        assertThat(back.sent().get(5).text()).isEqualTo(" live");

        RecordingConnection again = connect("A");
        assertThat(again.sentTypes()).containsExactly(WsMessageType.AUTH_OK, WsMessageType.STREAMING_RESTORE);
    }

    @Test
    void globalJobIsReportedAsGlobalProject() {
        orchestrator.submitMessage("A", null, "hello");

        RecordingConnection a = connect("A");

        assertThat(a.sent().get(0).activeProjectIds()).containsExactly(JobKey.GLOBAL_PROJECT);
    }

    @Test
    void answeredQuestionResumesTheSuspendedSession() {
        connect("A");
        orchestrator.submitMessage("A", P, "set up the db");
        agent.lastRun().emit(
                AgentEvent.session("S"),
                AgentEvent.toolUse(new ToolUse("AskUserQuestion", "tu-1",
                        mapper.createObjectNode().set("questions", mapper.createArrayNode()))))
                .finish();

        orchestrator.answerQuestion("A", P, List.of(new ToolAnswer("DB", "Mongo")));

        assertThat(agent.runs()).hasSize(2);
        assertThat(agent.lastRun().request().sessionId()).isEqualTo("S");
        assertThat(agent.lastRun().request().prompt()).endsWith("[DB]: Mongo");
        assertThat(agent.lastRun().request().cwd()).isEqualTo(props.projectsRoot().resolve(P).toAbsolutePath().normalize());
        assertThat(conversations.load(P)).last()
                .satisfies(m -> assertThat(m.content()).endsWith("[DB]: Mongo"));
        assertThatThrownBy(() -> orchestrator.answerQuestion("A", P, List.of()))
                .isInstanceOf(NoPendingQuestionException.class);
    }

    @Test
    void newMessageDropsAnOutstandingQuestion() {
        orchestrator.submitMessage("A", P, "q");
        agent.lastRun().emit(AgentEvent.toolUse(new ToolUse("AskUserQuestion", "tu-1", null))).finish();

        orchestrator.submitMessage("A", P, "never mind");

        assertThatThrownBy(() -> orchestrator.answerQuestion("A", P, List.of()))
                .isInstanceOf(NoPendingQuestionException.class);
    }

    @Test
    void reportedSessionIsReusedByTheNextMessage() {
        orchestrator.submitMessage("A", P, "one");
        agent.lastRun().emit(AgentEvent.session("sess-1")).finish();

        orchestrator.submitMessage("A", P, "two");

        assertThat(agent.lastRun().request().sessionId()).isEqualTo("sess-1");
    }

    @Test
    void cancelKeepsPartialOutputAndTellsEveryone() {
        RecordingConnection a = connect("A");
        RecordingConnection b = connect("B");
        orchestrator.submitMessage("A", P, "work");
        agent.lastRun().emit(AgentEvent.text("partial"));
        a.clear();
        b.clear();

        assertThat(orchestrator.cancel("A", P)).isTrue();
        agent.lastRun().emit(AgentEvent.error("killed")).finish();

        assertThat(agent.lastRun().cancelled()).isTrue();
        assertThat(a.sentTypes()).containsExactly(WsMessageType.DONE);
        assertThat(b.sentTypes()).containsExactly(WsMessageType.SYNC_CANCEL, WsMessageType.DONE);
        assertThat(conversations.load(P)).last().satisfies(m -> assertThat(m.content()).isEqualTo("partial"));
        assertThat(orchestrator.cancel("A", P)).isFalse();
    }

    @Test
    void supersedingMessageKeepsTheEarlierOutput() {
        RecordingConnection a = connect("A");
        RecordingConnection b = connect("B");
        orchestrator.submitMessage("A", P, "first");
        agent.lastRun().emit(AgentEvent.text("IMPORTANT OUTPUT"));
        a.clear();
        b.clear();

        orchestrator.submitMessage("A", P, "second");

        assertThat(agent.runs().get(0).cancelled()).isTrue();
        assertThat(conversations.load(P)).extracting(ConversationMessage::content)
                .containsExactly("first", "IMPORTANT OUTPUT", "second");
        assertThat(a.sentTypes()).containsExactly(WsMessageType.DONE);
        assertThat(b.sentTypes()).containsExactly(WsMessageType.DONE, WsMessageType.SYNC_USER_MESSAGE);
        assertThat(orchestrator.partial(JobKey.of("A", P)))
                .hasValueSatisfying(p -> assertThat(p.task()).isEqualTo("second"));
    }

    @Test
    void finishedJobPushesOnlyToDevicesThatAreAway() {
        connect("A");
        push.subscribe("A", new PushSubscription("https://push.example/a", null, new PushSubscription.Keys("k", "s")));
        push.subscribe("B", new PushSubscription("https://push.example/b", null, new PushSubscription.Keys("k", "s")));

        orchestrator.submitMessage("A", P, "build it");
        agent.lastRun().emit(AgentEvent.text("done")).finish();

        assertThat(pushSender.endpoints()).containsExactly("https://push.example/b");
        assertThat(pushSender.payloads().get(0)).contains("\"title\"").contains(P);
    }

    @Test
    void cancelledJobDoesNotPush() {
        push.subscribe("B", new PushSubscription("https://push.example/b", null, new PushSubscription.Keys("k", "s")));
        orchestrator.submitMessage("A", P, "work");

        orchestrator.cancel("A", P);

        assertThat(pushSender.endpoints()).isEmpty();
    }

    @Test
    void projectCancelStopsTheJobOnEveryDevice() {
        orchestrator.submitMessage("A", P, "one");
        orchestrator.submitMessage("B", P, "two");
        orchestrator.submitMessage("A", null, "elsewhere");

        assertThat(orchestrator.cancelProject(P)).isEqualTo(2);
        assertThat(orchestrator.isProjectActive(P)).isFalse();
        assertThat(orchestrator.isProjectActive(null)).isTrue();
        assertThat(orchestrator.cancelProject(P)).isZero();
    }

    @Test
    void unknownProjectIsRejectedBeforeAnythingHappens() {
        assertThatThrownBy(() -> orchestrator.submitMessage("A", "../etc", "x"))
                .isInstanceOf(ProjectNotFoundException.class);
        assertThat(agent.runs()).isEmpty();
        assertThat(conversations.load("../etc")).isEmpty();
    }

    @Test
    void restartRecoversInterruptedResponse() {
        Instant t = Instant.parse("2026-05-01T12:00:00Z");
        snapshotFile.merge(Map.of(JobKey.of("A", P).asString(),
                new PartialResponse("task", "half done", "", List.of(), List.of(), "S", t, t)), List.of());

        SessionOrchestrator restarted = newOrchestrator();
        restarted.start();
        try {
            assertThat(conversations.load(P)).singleElement()
                    .satisfies(m -> {
                        assertThat(m.wasInterrupted()).isTrue();
                        assertThat(m.content()).startsWith("half done").endsWith("finished]");
                    });
            assertThat(snapshotFile.readAll()).isEmpty();
        } finally {
            restarted.stop();
        }
    }

    @Test
    void stoppedOrchestratorRefusesNewWork() {
        orchestrator.stop();

        assertThatThrownBy(() -> orchestrator.submitMessage("A", P, "late"))
                .isInstanceOf(IllegalStateException.class);
    }
}
