package io.github.drompincen.agentrelay.runtime.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentrelay.protocol.api.ToolResult;
import io.github.drompincen.agentrelay.protocol.api.ToolUse;
import io.github.drompincen.agentrelay.protocol.event.AgentEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates the Claude CLI {@code --output-format stream-json} lines into agent events. One parser
 * per run: it remembers which tool each {@code tool_use} id belongs to so results can be labelled.
 * {@code DONE} is not produced here; the adapter emits it when the process exits.
 */
public class StreamJsonParser {

    private static final Logger log = LoggerFactory.getLogger(StreamJsonParser.class);

    private final ObjectMapper mapper;
    private final Map<String, String> toolNamesById = new HashMap<>();

    public StreamJsonParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<AgentEvent> parseLine(String line) {
        if (line == null || line.isBlank()) {
            return List.of();
        }
        JsonNode data;
        try {
            data = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring non-JSON agent output: {}", abbreviate(line));
            return List.of();
        }

        List<AgentEvent> events = new ArrayList<>();
        switch (data.path("type").asText()) {
            case "system" -> {
                String sessionId = data.path("session_id").asText("");
                if ("init".equals(data.path("subtype").asText()) && !sessionId.isEmpty()) {
                    events.add(AgentEvent.session(sessionId));
                }
            }
            case "assistant" -> assistantBlocks(data.path("message").path("content"), events);
            case "user" -> toolResults(data.path("message").path("content"), events);
            case "result" -> {
                if (data.path("is_error").asBoolean(false)) {
                    events.add(AgentEvent.error(data.path("result").asText("Agent reported an error")));
                }
                String sessionId = data.path("session_id").asText("");
                if (!sessionId.isEmpty()) {
                    events.add(AgentEvent.session(sessionId));
                }
            }
            default -> log.trace("Ignoring agent output of type {}", data.path("type").asText());
        }
        return events;
    }

    private void assistantBlocks(JsonNode content, List<AgentEvent> events) {
        if (!content.isArray()) return;
        for (JsonNode block : content) {
            switch (block.path("type").asText()) {
                case "thinking" -> {
                    String thinking = block.path("thinking").asText("");
                    if (!thinking.isEmpty()) events.add(AgentEvent.thinking(thinking));
                }
                case "text" -> {
                    String text = block.path("text").asText("");
                    if (!text.isEmpty()) events.add(AgentEvent.text(text));
                }
                case "tool_use" -> {
                    String id = block.path("id").asText(null);
                    String name = block.path("name").asText("unknown");
                    if (id != null) toolNamesById.put(id, name);
                    JsonNode input = block.get("input");
                    events.add(AgentEvent.toolUse(new ToolUse(name, id, input)));
                }
                default -> { }
            }
        }
    }

    private void toolResults(JsonNode content, List<AgentEvent> events) {
        if (!content.isArray()) return;
        for (JsonNode block : content) {
            if (!"tool_result".equals(block.path("type").asText())) continue;
            String tool = toolNamesById.getOrDefault(block.path("tool_use_id").asText(""), "unknown");
            String body = resultText(block.get("content"));
            if (block.path("is_error").asBoolean(false)) {
                events.add(AgentEvent.toolResult(new ToolResult(tool, null, body)));
            } else {
                events.add(AgentEvent.toolResult(new ToolResult(tool, body, null)));
            }
        }
    }

    private static String resultText(JsonNode content) {
        if (content == null || content.isNull()) return "";
        if (content.isTextual()) return content.asText();
        if (content.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode part : content) {
                if (part.has("text")) {
                    if (sb.length() > 0) sb.append('\n');
                    sb.append(part.get("text").asText());
                }
            }
            return sb.toString();
        }
        return content.toString();
    }

    private static String abbreviate(String line) {
        return line.length() > 120 ? line.substring(0, 120) + "..." : line;
    }
}
