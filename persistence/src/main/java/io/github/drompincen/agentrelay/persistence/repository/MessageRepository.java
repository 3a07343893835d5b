package io.github.drompincen.agentrelay.persistence.repository;

import io.github.drompincen.agentrelay.persistence.document.MessageDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface MessageRepository extends MongoRepository<MessageDocument, String> {
    List<MessageDocument> findByConversationIdOrderBySeqAsc(String conversationId);
    Optional<MessageDocument> findTopByConversationIdOrderBySeqDesc(String conversationId);
    void deleteByConversationId(String conversationId);
}
