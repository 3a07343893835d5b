package io.github.drompincen.agentrelay.persistence.repository;

import io.github.drompincen.agentrelay.persistence.document.ConversationDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ConversationRepository extends MongoRepository<ConversationDocument, String> {
}
