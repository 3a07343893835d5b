package io.github.drompincen.agentrelay.runtime.crypto;

import io.github.drompincen.agentrelay.protocol.ws.EncryptedEnvelope;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-GCM with a random 12-byte IV per frame. The JCE output {@code ct || tag} is split so the
 * tag travels in its own envelope field.
 */
@Component
public class AesGcmSecureChannel implements SecureChannel {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_TAG_BYTES = GCM_TAG_BITS / 8;
    private static final int GCM_IV_BYTES = 12;
    private static final int KEY_BYTES = 32;

    private final SecureRandom secureRandom = new SecureRandom();

    @Override
    public EncryptedEnvelope encrypt(String plaintext, byte[] key) {
        checkKey(key);
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            int split = sealed.length - GCM_TAG_BYTES;
            Base64.Encoder b64 = Base64.getEncoder();
            return new EncryptedEnvelope(
                    b64.encodeToString(iv),
                    b64.encodeToString(Arrays.copyOfRange(sealed, 0, split)),
                    b64.encodeToString(Arrays.copyOfRange(sealed, split, sealed.length)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt frame", e);
        }
    }

    @Override
    public String decrypt(EncryptedEnvelope envelope, byte[] key) throws DecryptionException {
        if (envelope == null || !envelope.hasAllParts()) {
            throw new DecryptionException("Envelope is missing iv, ct or tag");
        }
        if (key == null || key.length != KEY_BYTES) {
            throw new DecryptionException("Key must be " + KEY_BYTES + " bytes");
        }
        byte[] iv;
        byte[] ct;
        byte[] tag;
        try {
            Base64.Decoder b64 = Base64.getDecoder();
            iv = b64.decode(envelope.iv());
            ct = b64.decode(envelope.ct());
            tag = b64.decode(envelope.tag());
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Envelope is not valid base64", e);
        }
        if (iv.length != GCM_IV_BYTES || tag.length != GCM_TAG_BYTES) {
            throw new DecryptionException("Unexpected iv or tag length");
        }
        byte[] sealed = new byte[ct.length + tag.length];
        System.arraycopy(ct, 0, sealed, 0, ct.length);
        System.arraycopy(tag, 0, sealed, ct.length, tag.length);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(GCM_TAG_BITS, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Failed to decrypt frame", e);
        }
    }

    private static void checkKey(byte[] key) {
        if (key == null || key.length != KEY_BYTES) {
            throw new IllegalArgumentException("Key must be " + KEY_BYTES + " bytes");
        }
    }
}
