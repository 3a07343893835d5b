package io.github.drompincen.agentrelay.runtime.device;

/**
 * No registered device can open the envelope. The connection must be closed and the client must re-pair.
 */
public class UnknownDeviceException extends Exception {

    public UnknownDeviceException(String message) {
        super(message);
    }
}
