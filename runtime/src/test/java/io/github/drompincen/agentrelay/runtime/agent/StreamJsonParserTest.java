package io.github.drompincen.agentrelay.runtime.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentrelay.protocol.event.AgentEvent;
import io.github.drompincen.agentrelay.protocol.event.AgentEventType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StreamJsonParserTest {

    private final StreamJsonParser parser = new StreamJsonParser(new ObjectMapper());

    @Test
    void systemInitReportsTheSession() {
        List<AgentEvent> events = parser.parseLine(
                "{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"sess-42\",\"tools\":[]}");

        assertThat(events).containsExactly(AgentEvent.session("sess-42"));
    }

    @Test
    void assistantContentBlocksBecomeEventsInOrder() {
        List<AgentEvent> events = parser.parseLine("""
                {"type":"assistant","message":{"content":[
                  {"type":"thinking","thinking":"pondering"},
                  {"type":"text","text":"Let me look."},
                  {"type":"tool_use","id":"tu_1","name":"Bash","input":{"command":"ls"}}
                ]}}""".replace("\n", ""));

        assertThat(events).extracting(AgentEvent::type)
                .containsExactly(AgentEventType.THINKING, AgentEventType.TEXT, AgentEventType.TOOL_USE);
        assertThat(events.get(2).toolUse().tool()).isEqualTo("Bash");
        assertThat(events.get(2).toolUse().id()).isEqualTo("tu_1");
        assertThat(events.get(2).toolUse().input().get("command").asText()).isEqualTo("ls");
    }

    @Test
    void toolResultsAreLabelledWithTheirToolName() {
        parser.parseLine("{\"type\":\"assistant\",\"message\":{\"content\":[{\"type\":\"tool_use\",\"id\":\"tu_9\",\"name\":\"Read\",\"input\":{}}]}}");

        List<AgentEvent> ok = parser.parseLine("{\"type\":\"user\",\"message\":{\"content\":["
                + "{\"type\":\"tool_result\",\"tool_use_id\":\"tu_9\",\"content\":[{\"type\":\"text\",\"text\":\"file body\"}]}]}}");
        List<AgentEvent> failed = parser.parseLine("{\"type\":\"user\",\"message\":{\"content\":["
                + "{\"type\":\"tool_result\",\"tool_use_id\":\"tu_9\",\"content\":\"no such file\",\"is_error\":true}]}}");

        assertThat(ok.get(0).toolResult().tool()).isEqualTo("Read");
        assertThat(ok.get(0).toolResult().output()).isEqualTo("file body");
        assertThat(failed.get(0).toolResult().failed()).isTrue();
        assertThat(failed.get(0).toolResult().error()).isEqualTo("no such file");
    }

    @Test
    void resultLineReportsErrorsButNeverDone() {
        List<AgentEvent> events = parser.parseLine(
                "{\"type\":\"result\",\"subtype\":\"error\",\"is_error\":true,\"result\":\"boom\",\"session_id\":\"s\"}");

        assertThat(events).extracting(AgentEvent::type).containsExactly(AgentEventType.ERROR, AgentEventType.SESSION);
    }

    @Test
    void garbageAndBlankLinesAreIgnored() {
        assertThat(parser.parseLine("not json at all")).isEmpty();
        assertThat(parser.parseLine("   ")).isEmpty();
        assertThat(parser.parseLine("{\"type\":\"rate_limit\"}")).isEmpty();
    }
}
