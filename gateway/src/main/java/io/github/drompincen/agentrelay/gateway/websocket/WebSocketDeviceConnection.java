package io.github.drompincen.agentrelay.gateway.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentrelay.protocol.ws.EncryptedEnvelope;
import io.github.drompincen.agentrelay.protocol.ws.WsMessage;
import io.github.drompincen.agentrelay.runtime.crypto.SecureChannel;
import io.github.drompincen.agentrelay.runtime.device.IdentifiedDevice;
import io.github.drompincen.agentrelay.runtime.sync.DeviceConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * A socket bound to one identified device. Outgoing messages are encrypted with that device's key
 * and go through the session's concurrent decorator, so slow clients hit the send limits instead
 * of blocking the agent reader threads indefinitely.
 */
public class WebSocketDeviceConnection implements DeviceConnection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketDeviceConnection.class);

    private final WebSocketSession session;
    private final IdentifiedDevice device;
    private final SecureChannel secureChannel;
    private final ObjectMapper objectMapper;

    public WebSocketDeviceConnection(WebSocketSession session, IdentifiedDevice device,
                                     SecureChannel secureChannel, ObjectMapper objectMapper) {
        this.session = session;
        this.device = device;
        this.secureChannel = secureChannel;
        this.objectMapper = objectMapper;
    }

    @Override
    public String deviceId() {
        return device.deviceId();
    }

    IdentifiedDevice device() {
        return device;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(WsMessage message) throws IOException {
        EncryptedEnvelope envelope = secureChannel.encrypt(objectMapper.writeValueAsString(message), device.key());
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(envelope)));
        } catch (SessionLimitExceededException e) {
            throw new IOException("Send limit exceeded for device " + deviceId(), e);
        }
    }

    @Override
    public void close(int code, String reason) {
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            log.warn("Failed to close socket {} of device {}: {}", session.getId(), deviceId(), e.getMessage());
        }
    }
}
