package io.github.drompincen.agentrelay.runtime.crypto;

public class DecryptionException extends Exception {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
