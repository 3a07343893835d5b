package io.github.drompincen.agentrelay.persistence.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.Optional;

/**
 * The server's VAPID key pair, base64url encoded. Generated once and kept so existing browser
 * subscriptions stay valid across restarts.
 */
public class VapidKeyFile {

    public static final String FILE_NAME = "vapid.json";

    public record VapidKeys(String publicKey, String privateKey) {
    }

    private static final TypeReference<VapidKeys> TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final Path file;

    public VapidKeyFile(ObjectMapper mapper, Path dataDir) {
        this.mapper = mapper;
        this.file = dataDir.resolve(FILE_NAME);
    }

    public synchronized Optional<VapidKeys> read() {
        return Optional.ofNullable(JsonFileSupport.read(mapper, file, TYPE, () -> null))
                .filter(k -> k.publicKey() != null && k.privateKey() != null);
    }

    public synchronized void write(VapidKeys keys) {
        JsonFileSupport.writeAtomically(mapper, file, keys);
    }
}
