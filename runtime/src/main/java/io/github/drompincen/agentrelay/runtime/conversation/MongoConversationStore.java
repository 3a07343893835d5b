package io.github.drompincen.agentrelay.runtime.conversation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentrelay.persistence.document.ConversationDocument;
import io.github.drompincen.agentrelay.persistence.document.MessageDocument;
import io.github.drompincen.agentrelay.persistence.repository.ConversationRepository;
import io.github.drompincen.agentrelay.persistence.repository.MessageRepository;
import io.github.drompincen.agentrelay.protocol.api.ConversationMessage;
import io.github.drompincen.agentrelay.protocol.api.JobKey;
import io.github.drompincen.agentrelay.protocol.api.OutputChunk;
import io.github.drompincen.agentrelay.protocol.api.ToolActivity;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class MongoConversationStore implements ConversationStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final MessageRepository messageRepository;
    private final ConversationRepository conversationRepository;
    private final ObjectMapper mapper;
    private final ConcurrentHashMap<String, AtomicLong> seqCounters = new ConcurrentHashMap<>();

    public MongoConversationStore(MessageRepository messageRepository,
                                  ConversationRepository conversationRepository,
                                  ObjectMapper mapper) {
        this.messageRepository = messageRepository;
        this.conversationRepository = conversationRepository;
        this.mapper = mapper;
    }

    static String conversationId(String projectId) {
        return projectId != null && !projectId.isBlank() ? projectId : JobKey.GLOBAL_PROJECT;
    }

    @Override
    public void append(String projectId, ConversationMessage message) {
        String conversationId = conversationId(projectId);
        long seq = seqCounters
                .computeIfAbsent(conversationId, k -> {
                    long last = messageRepository.findTopByConversationIdOrderBySeqDesc(conversationId)
                            .map(MessageDocument::getSeq).orElse(0L);
                    return new AtomicLong(last);
                }).incrementAndGet();

        MessageDocument doc = toDocument(message);
        doc.setMessageId(UUID.randomUUID().toString());
        doc.setConversationId(conversationId);
        doc.setSeq(seq);
        messageRepository.save(doc);
    }

    @Override
    public List<ConversationMessage> load(String projectId) {
        return messageRepository.findByConversationIdOrderBySeqAsc(conversationId(projectId)).stream()
                .map(this::toMessage)
                .toList();
    }

    @Override
    public void clear(String projectId) {
        String conversationId = conversationId(projectId);
        messageRepository.deleteByConversationId(conversationId);
        conversationRepository.deleteById(conversationId);
        seqCounters.remove(conversationId);
    }

    @Override
    public Optional<String> sessionId(String projectId) {
        return conversationRepository.findById(conversationId(projectId))
                .map(ConversationDocument::getAgentSessionId);
    }

    @Override
    public void saveSessionId(String projectId, String sessionId) {
        String conversationId = conversationId(projectId);
        ConversationDocument doc = conversationRepository.findById(conversationId).orElseGet(() -> {
            ConversationDocument created = new ConversationDocument();
            created.setConversationId(conversationId);
            return created;
        });
        if (sessionId.equals(doc.getAgentSessionId())) {
            return;
        }
        doc.setAgentSessionId(sessionId);
        doc.setUpdatedAt(Instant.now());
        conversationRepository.save(doc);
    }

    private MessageDocument toDocument(ConversationMessage message) {
        MessageDocument doc = new MessageDocument();
        doc.setRole(message.role());
        doc.setContent(message.content());
        doc.setTask(message.task());
        doc.setThinking(message.thinking());
        doc.setStartedAt(message.startedAt());
        doc.setCompletedAt(message.completedAt());
        doc.setInterrupted(message.wasInterrupted());
        doc.setTimestamp(message.timestamp() != null ? message.timestamp() : Instant.now());
        if (message.chunks() != null) {
            doc.setChunks(message.chunks().stream().map(c -> {
                MessageDocument.Chunk chunk = new MessageDocument.Chunk();
                chunk.setText(c.text());
                chunk.setAfterTool(c.afterTool());
                chunk.setTimestamp(c.timestamp());
                return chunk;
            }).toList());
        }
        if (message.activity() != null) {
            doc.setActivity(message.activity().stream().map(this::toDocument).toList());
        }
        return doc;
    }

    private MessageDocument.Activity toDocument(ToolActivity activity) {
        MessageDocument.Activity doc = new MessageDocument.Activity();
        doc.setType(activity.type() == ToolActivity.Kind.TOOL_USE ? "tool_use" : "tool_result");
        doc.setTool(activity.tool());
        doc.setToolUseId(activity.id());
        doc.setOutput(activity.output());
        doc.setError(activity.error());
        doc.setTimestamp(activity.timestamp());
        JsonNode input = activity.input();
        if (input != null && input.isObject()) {
            doc.setInput(mapper.convertValue(input, MAP_TYPE));
        } else if (input != null && !input.isNull()) {
            doc.setInput(Map.of("value", mapper.convertValue(input, Object.class)));
        }
        return doc;
    }

    private ConversationMessage toMessage(MessageDocument doc) {
        List<OutputChunk> chunks = doc.getChunks() == null ? null : doc.getChunks().stream()
                .map(c -> new OutputChunk(c.getText(), c.getAfterTool(), c.getTimestamp()))
                .toList();
        List<ToolActivity> activity = doc.getActivity() == null ? null : doc.getActivity().stream()
                .map(a -> new ToolActivity(
                        "tool_use".equals(a.getType()) ? ToolActivity.Kind.TOOL_USE : ToolActivity.Kind.TOOL_RESULT,
                        a.getTool(), a.getToolUseId(),
                        a.getInput() != null ? mapper.valueToTree(a.getInput()) : null,
                        a.getOutput(), a.getError(), a.getTimestamp()))
                .toList();
        return new ConversationMessage(doc.getRole(), doc.getContent(), doc.getTask(), chunks, doc.getThinking(),
                activity, doc.getStartedAt(), doc.getCompletedAt(), doc.isInterrupted() ? Boolean.TRUE : null,
                doc.getTimestamp());
    }
}
