package io.github.drompincen.agentrelay.runtime.device;

/**
 * A device whose shared key opened an envelope on this connection. Later frames are decrypted with
 * {@code key} only.
 */
public record IdentifiedDevice(String deviceId, byte[] key) {

    @Override
    public String toString() {
        return "IdentifiedDevice[" + deviceId + "]";
    }
}
