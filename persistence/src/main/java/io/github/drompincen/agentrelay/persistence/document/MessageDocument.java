package io.github.drompincen.agentrelay.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Document(collection = "messages")
@CompoundIndex(name = "conversation_seq", def = "{'conversationId': 1, 'seq': 1}", unique = true)
public class MessageDocument {

    @Id
    private String messageId;
    private String conversationId;
    private long seq;
    private String role;
    private String content;
    private String task;
    private List<Chunk> chunks;
    private String thinking;
    private List<Activity> activity;
    private Instant startedAt;
    private Instant completedAt;
    private boolean interrupted;
    private Instant timestamp;

    public MessageDocument() {}

    public static class Chunk {
        private String text;
        private String afterTool;
        private long timestamp;

        public Chunk() {}

        public String getText() { return text; }
        public void setText(String text) { this.text = text; }

        public String getAfterTool() { return afterTool; }
        public void setAfterTool(String afterTool) { this.afterTool = afterTool; }

        public long getTimestamp() { return timestamp; }
        public void setTimestamp(long timestamp) { this.timestamp = timestamp; }
    }

    public static class Activity {
        private String type;      // "tool_use" or "tool_result"
        private String tool;
        private String toolUseId; // for type="tool_use"
        private Map<String, Object> input;
        private String output;
        private String error;
        private long timestamp;

        public Activity() {}

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getTool() { return tool; }
        public void setTool(String tool) { this.tool = tool; }

        public String getToolUseId() { return toolUseId; }
        public void setToolUseId(String toolUseId) { this.toolUseId = toolUseId; }

        public Map<String, Object> getInput() { return input; }
        public void setInput(Map<String, Object> input) { this.input = input; }

        public String getOutput() { return output; }
        public void setOutput(String output) { this.output = output; }

        public String getError() { return error; }
        public void setError(String error) { this.error = error; }

        public long getTimestamp() { return timestamp; }
        public void setTimestamp(long timestamp) { this.timestamp = timestamp; }
    }

    public String getMessageId() { return messageId; }
    public void setMessageId(String messageId) { this.messageId = messageId; }

    public String getConversationId() { return conversationId; }
    public void setConversationId(String conversationId) { this.conversationId = conversationId; }

    public long getSeq() { return seq; }
    public void setSeq(long seq) { this.seq = seq; }

    public String getRole() { return role; }
    public void setRole(String role) { this.role = role; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public String getTask() { return task; }
    public void setTask(String task) { this.task = task; }

    public List<Chunk> getChunks() { return chunks; }
    public void setChunks(List<Chunk> chunks) { this.chunks = chunks; }

    public String getThinking() { return thinking; }
    public void setThinking(String thinking) { this.thinking = thinking; }

    public List<Activity> getActivity() { return activity; }
    public void setActivity(List<Activity> activity) { this.activity = activity; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public boolean isInterrupted() { return interrupted; }
    public void setInterrupted(boolean interrupted) { this.interrupted = interrupted; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
}
