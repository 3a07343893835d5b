package io.github.drompincen.agentrelay.persistence.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentrelay.protocol.api.PushSubscription;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Web push subscriptions, one per device id. Subscribing again replaces the device's entry.
 */
public class PushSubscriptionFile {

    public static final String FILE_NAME = "push-subscriptions.json";

    public record Entry(PushSubscription subscription, Instant createdAt) {
    }

    private static final TypeReference<LinkedHashMap<String, Entry>> TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final Path file;
    private LinkedHashMap<String, Entry> subscriptions;

    public PushSubscriptionFile(ObjectMapper mapper, Path dataDir) {
        this.mapper = mapper;
        this.file = dataDir.resolve(FILE_NAME);
    }

    public synchronized void put(String deviceId, PushSubscription subscription) {
        loaded().put(deviceId, new Entry(subscription, Instant.now()));
        JsonFileSupport.writeAtomically(mapper, file, subscriptions);
    }

    public synchronized boolean remove(String deviceId) {
        if (loaded().remove(deviceId) == null) {
            return false;
        }
        JsonFileSupport.writeAtomically(mapper, file, subscriptions);
        return true;
    }

    /** Removes the device's entry only if it still holds {@code endpoint}. */
    public synchronized boolean removeIfEndpoint(String deviceId, String endpoint) {
        Entry current = loaded().get(deviceId);
        if (current == null || !endpoint.equals(current.subscription().endpoint())) {
            return false;
        }
        return remove(deviceId);
    }

    public synchronized Map<String, PushSubscription> all() {
        Map<String, PushSubscription> copy = new LinkedHashMap<>();
        loaded().forEach((deviceId, entry) -> copy.put(deviceId, entry.subscription()));
        return copy;
    }

    private LinkedHashMap<String, Entry> loaded() {
        if (subscriptions == null) {
            subscriptions = JsonFileSupport.read(mapper, file, TYPE, LinkedHashMap::new);
        }
        return subscriptions;
    }
}
