package io.github.drompincen.agentrelay.runtime.crypto;

import io.github.drompincen.agentrelay.protocol.ws.EncryptedEnvelope;

/**
 * Authenticated symmetric encryption of socket frames with a device's shared key.
 */
public interface SecureChannel {

    EncryptedEnvelope encrypt(String plaintext, byte[] key);

    /**
     * @throws DecryptionException when the envelope is malformed or its tag does not verify under {@code key}
     */
    String decrypt(EncryptedEnvelope envelope, byte[] key) throws DecryptionException;
}
