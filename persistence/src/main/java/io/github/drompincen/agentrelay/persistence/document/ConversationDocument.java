package io.github.drompincen.agentrelay.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Per-project conversation header. Holds the agent's continuity token so that the next job for
 * the project resumes the same agent conversation.
 */
@Document(collection = "conversations")
public class ConversationDocument {

    @Id
    private String conversationId;

    private String agentSessionId;
    private Instant updatedAt;

    public ConversationDocument() {}

    public String getConversationId() { return conversationId; }
    public void setConversationId(String conversationId) { this.conversationId = conversationId; }

    public String getAgentSessionId() { return agentSessionId; }
    public void setAgentSessionId(String agentSessionId) { this.agentSessionId = agentSessionId; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
