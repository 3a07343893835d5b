package io.github.drompincen.agentrelay.persistence.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentrelay.protocol.api.PartialResponse;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * On-disk snapshot of in-flight partial responses, keyed by {@code JobKey.asString()}.
 */
public class PartialSnapshotFile {

    public static final String FILE_NAME = "partial-responses.json";

    private static final TypeReference<LinkedHashMap<String, PartialResponse>> TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final Path file;

    public PartialSnapshotFile(ObjectMapper mapper, Path dataDir) {
        this.mapper = mapper;
        this.file = dataDir.resolve(FILE_NAME);
    }

    public synchronized Map<String, PartialResponse> readAll() {
        return JsonFileSupport.read(mapper, file, TYPE, LinkedHashMap::new);
    }

    /**
     * Read-merge-write in one pass: upserts replace their keys, deletions are dropped, every
     * other persisted key is preserved.
     */
    public synchronized void merge(Map<String, PartialResponse> upserts, Collection<String> deletions) {
        if (upserts.isEmpty() && deletions.isEmpty()) {
            return;
        }
        LinkedHashMap<String, PartialResponse> current = JsonFileSupport.read(mapper, file, TYPE, LinkedHashMap::new);
        deletions.forEach(current::remove);
        current.putAll(upserts);
        JsonFileSupport.writeAtomically(mapper, file, current);
    }

    public synchronized void clear() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear " + file, e);
        }
    }

    public Path path() {
        return file;
    }
}
