package io.github.drompincen.agentrelay.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A paired device. Written by the pairing tooling; immutable afterwards except for deletion.
 */
@Document(collection = "devices")
public class DeviceDocument {

    @Id
    private String deviceId;

    private String publicKey;
    private String sharedSecret;

    @Indexed
    private Instant createdAt;

    public DeviceDocument() {}

    public DeviceDocument(String deviceId, String publicKey, String sharedSecret, Instant createdAt) {
        this.deviceId = deviceId;
        this.publicKey = publicKey;
        this.sharedSecret = sharedSecret;
        this.createdAt = createdAt;
    }

    public String getDeviceId() { return deviceId; }
    public void setDeviceId(String deviceId) { this.deviceId = deviceId; }

    public String getPublicKey() { return publicKey; }
    public void setPublicKey(String publicKey) { this.publicKey = publicKey; }

    public String getSharedSecret() { return sharedSecret; }
    public void setSharedSecret(String sharedSecret) { this.sharedSecret = sharedSecret; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    @Override
    public String toString() {
        return "DeviceDocument{deviceId='" + deviceId + "', createdAt=" + createdAt + "}";
    }
}
