package io.github.drompincen.agentrelay.protocol.ws;

/**
 * AES-GCM frame as it travels over the socket. All three parts are base64.
 */
public record EncryptedEnvelope(
        String iv,
        String ct,
        String tag
) {
    public boolean hasAllParts() {
        return iv != null && !iv.isBlank()
                && ct != null
                && tag != null && !tag.isBlank();
    }
}
