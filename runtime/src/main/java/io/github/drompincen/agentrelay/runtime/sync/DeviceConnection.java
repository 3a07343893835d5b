package io.github.drompincen.agentrelay.runtime.sync;

import io.github.drompincen.agentrelay.protocol.ws.WsMessage;

import java.io.IOException;

/**
 * An authenticated socket of one device. {@link #send} encrypts with the device's own key.
 */
public interface DeviceConnection {

    String deviceId();

    boolean isOpen();

    void send(WsMessage message) throws IOException;

    void close(int code, String reason);
}
