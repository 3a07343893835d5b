package io.github.drompincen.agentrelay.runtime.conversation;

import io.github.drompincen.agentrelay.protocol.api.ConversationMessage;

import java.util.List;
import java.util.Optional;

/**
 * Per-project message history. A {@code null} project id addresses the global conversation.
 */
public interface ConversationStore {

    void append(String projectId, ConversationMessage message);

    List<ConversationMessage> load(String projectId);

    void clear(String projectId);

    /** The agent continuity token the next run for this project should resume from. */
    Optional<String> sessionId(String projectId);

    void saveSessionId(String projectId, String sessionId);
}
