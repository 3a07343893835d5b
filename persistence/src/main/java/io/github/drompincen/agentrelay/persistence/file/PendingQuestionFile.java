package io.github.drompincen.agentrelay.persistence.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentrelay.protocol.api.PendingQuestion;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Write-through store of questions awaiting a human answer, keyed by {@code JobKey.asString()}.
 */
public class PendingQuestionFile {

    public static final String FILE_NAME = "pending-questions.json";

    private static final TypeReference<LinkedHashMap<String, PendingQuestion>> TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final Path file;
    private LinkedHashMap<String, PendingQuestion> questions;

    public PendingQuestionFile(ObjectMapper mapper, Path dataDir) {
        this.mapper = mapper;
        this.file = dataDir.resolve(FILE_NAME);
    }

    public synchronized Optional<PendingQuestion> get(String key) {
        return Optional.ofNullable(loaded().get(key));
    }

    public synchronized void put(String key, PendingQuestion question) {
        loaded().put(key, question);
        JsonFileSupport.writeAtomically(mapper, file, questions);
    }

    public synchronized Optional<PendingQuestion> remove(String key) {
        PendingQuestion removed = loaded().remove(key);
        if (removed != null) {
            JsonFileSupport.writeAtomically(mapper, file, questions);
        }
        return Optional.ofNullable(removed);
    }

    public synchronized Map<String, PendingQuestion> all() {
        return Map.copyOf(loaded());
    }

    private LinkedHashMap<String, PendingQuestion> loaded() {
        if (questions == null) {
            questions = JsonFileSupport.read(mapper, file, TYPE, LinkedHashMap::new);
        }
        return questions;
    }
}
