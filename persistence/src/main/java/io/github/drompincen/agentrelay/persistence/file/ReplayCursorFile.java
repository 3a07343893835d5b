package io.github.drompincen.agentrelay.persistence.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.LinkedHashMap;

/**
 * Per-device replay cursor ({@code lastFlushedTs}) for the offline event log.
 */
public class ReplayCursorFile {

    public static final String FILE_NAME = "offline-cursors.json";

    private static final TypeReference<LinkedHashMap<String, Long>> TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final Path file;
    private LinkedHashMap<String, Long> cursors;

    public ReplayCursorFile(ObjectMapper mapper, Path dataDir) {
        this.mapper = mapper;
        this.file = dataDir.resolve(FILE_NAME);
    }

    public synchronized long get(String deviceId) {
        return loaded().getOrDefault(deviceId, 0L);
    }

    /** Moves the cursor forward; a value at or below the current cursor is ignored. */
    public synchronized boolean advance(String deviceId, long timestamp) {
        LinkedHashMap<String, Long> map = loaded();
        if (timestamp <= map.getOrDefault(deviceId, 0L)) {
            return false;
        }
        map.put(deviceId, timestamp);
        JsonFileSupport.writeAtomically(mapper, file, map);
        return true;
    }

    private LinkedHashMap<String, Long> loaded() {
        if (cursors == null) {
            cursors = JsonFileSupport.read(mapper, file, TYPE, LinkedHashMap::new);
        }
        return cursors;
    }
}
