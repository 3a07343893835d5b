package io.github.drompincen.agentrelay.runtime.partial;

import io.github.drompincen.agentrelay.protocol.api.PartialResponse;
import io.github.drompincen.agentrelay.protocol.api.ToolActivity;
import io.github.drompincen.agentrelay.protocol.event.AgentEvent;
import io.github.drompincen.agentrelay.protocol.event.AgentEventType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable, monitor-guarded buffer behind one {@link PartialResponse}.
 */
final class PartialAccumulator {

    private final String task;
    private final Instant startedAt;
    private final StringBuilder text = new StringBuilder();
    private final StringBuilder thinking = new StringBuilder();
    private final List<ToolActivity> activity = new ArrayList<>();
    private final ChunkSegmenter segmenter;
    private String sessionId;
    private Instant updatedAt;

    PartialAccumulator(String task, String sessionId, Instant startedAt) {
        this.task = task;
        this.sessionId = sessionId;
        this.startedAt = startedAt;
        this.updatedAt = startedAt;
        this.segmenter = new ChunkSegmenter();
    }

    /** Returns false for events that do not change the partial response. */
    synchronized boolean apply(AgentEvent event, Instant now) {
        long ts = now.toEpochMilli();
        if ((event.type() == AgentEventType.TEXT || event.type() == AgentEventType.THINKING) && event.text() == null) {
            return false;
        }
        switch (event.type()) {
            case THINKING -> thinking.append(event.text());
            case TEXT -> {
                text.append(event.text());
                segmenter.onText(event.text(), ts);
            }
            case TOOL_USE -> {
                activity.add(ToolActivity.use(event.toolUse(), ts));
                segmenter.onTool(event.toolUse().tool());
            }
            case TOOL_RESULT -> {
                activity.add(ToolActivity.result(event.toolResult(), ts));
                segmenter.onTool(event.toolResult().tool());
            }
            case SESSION -> sessionId = event.sessionId();
            default -> {
                return false;
            }
        }
        updatedAt = now;
        return true;
    }

    synchronized PartialResponse snapshot() {
        return new PartialResponse(task, text.toString(), thinking.toString(), activity, segmenter.chunks(),
                sessionId, startedAt, updatedAt);
    }
}
