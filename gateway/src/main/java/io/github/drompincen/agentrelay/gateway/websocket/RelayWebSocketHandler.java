package io.github.drompincen.agentrelay.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentrelay.protocol.ws.EncryptedEnvelope;
import io.github.drompincen.agentrelay.protocol.ws.WsMessage;
import io.github.drompincen.agentrelay.runtime.auth.AuthResult;
import io.github.drompincen.agentrelay.runtime.auth.AuthService;
import io.github.drompincen.agentrelay.runtime.config.RelayProperties;
import io.github.drompincen.agentrelay.runtime.crypto.SecureChannel;
import io.github.drompincen.agentrelay.runtime.device.DeviceIdentifier;
import io.github.drompincen.agentrelay.runtime.device.IdentifiedFrame;
import io.github.drompincen.agentrelay.runtime.device.UnknownDeviceException;
import io.github.drompincen.agentrelay.runtime.project.ProjectNotFoundException;
import io.github.drompincen.agentrelay.runtime.question.NoPendingQuestionException;
import io.github.drompincen.agentrelay.runtime.session.SessionOrchestrator;
import io.github.drompincen.agentrelay.runtime.sync.MultiDeviceSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Encrypted device socket at {@code /ws}. Every frame is identified and decrypted first; the
 * plaintext is then dispatched to the orchestrator. Failures of client actions come back as soft
 * {@code error} messages, only an unknown device (4001) or garbage (4002) closes the socket.
 */
@Component
public class RelayWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RelayWebSocketHandler.class);

    public static final CloseStatus REPAIR_REQUIRED = new CloseStatus(4001, "Re-pair required");
    public static final CloseStatus MALFORMED_FRAME = new CloseStatus(4002, "Malformed message");

    private final ObjectMapper objectMapper;
    private final DeviceIdentifier deviceIdentifier;
    private final SecureChannel secureChannel;
    private final AuthService authService;
    private final SessionOrchestrator orchestrator;
    private final MultiDeviceSynchronizer synchronizer;
    private final RelayProperties properties;
    private final Map<String, SocketState> sockets = new ConcurrentHashMap<>();

    public RelayWebSocketHandler(ObjectMapper objectMapper, DeviceIdentifier deviceIdentifier,
                                 SecureChannel secureChannel, AuthService authService,
                                 SessionOrchestrator orchestrator, MultiDeviceSynchronizer synchronizer,
                                 RelayProperties properties) {
        this.objectMapper = objectMapper;
        this.deviceIdentifier = deviceIdentifier;
        this.secureChannel = secureChannel;
        this.authService = authService;
        this.orchestrator = orchestrator;
        this.synchronizer = synchronizer;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        var decorated = new ConcurrentWebSocketSessionDecorator(session,
                (int) properties.sendTimeLimit().toMillis(),
                (int) properties.sendBufferSize().toBytes());
        sockets.put(session.getId(), new SocketState(decorated, remoteAddress(session)));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        SocketState state = sockets.remove(session.getId());
        if (state != null && state.connection != null) {
            orchestrator.detach(state.connection);
            log.info("Device {} disconnected ({})", state.connection.deviceId(), status.getCode());
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        SocketState state = sockets.get(session.getId());
        if (state == null) {
            return;
        }

        EncryptedEnvelope envelope;
        try {
            envelope = objectMapper.readValue(message.getPayload(), EncryptedEnvelope.class);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable envelope on socket {}: {}", session.getId(), e.getOriginalMessage());
            session.close(MALFORMED_FRAME);
            return;
        }
        if (envelope == null || !envelope.hasAllParts()) {
            session.close(MALFORMED_FRAME);
            return;
        }

        IdentifiedFrame frame;
        try {
            frame = deviceIdentifier.identify(envelope,
                    state.connection != null ? state.connection.device() : null);
        } catch (UnknownDeviceException e) {
            log.warn("Closing socket {} from {}: {}", session.getId(), state.remoteAddress, e.getMessage());
            session.close(REPAIR_REQUIRED);
            return;
        }
        if (state.connection == null) {
            state.connection = new WebSocketDeviceConnection(state.session, frame.device(), secureChannel, objectMapper);
        }

        WsMessage request;
        try {
            request = objectMapper.readValue(frame.plaintext(), WsMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("Malformed plaintext from device {}: {}", frame.device().deviceId(), e.getOriginalMessage());
            session.close(MALFORMED_FRAME);
            return;
        }
        if (request == null || request.type() == null) {
            log.warn("Plaintext without a message type from device {}", frame.device().deviceId());
            session.close(MALFORMED_FRAME);
            return;
        }

        dispatch(state, request);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on socket {}: {}", session.getId(), exception.getMessage());
    }

    private void dispatch(SocketState state, WsMessage request) {
        WebSocketDeviceConnection connection = state.connection;
        if (request.type().requiresAuth() && !state.authenticated) {
            reply(connection, WsMessage.error(request.projectId(), "Not authenticated"));
            return;
        }
        try {
            switch (request.type()) {
                case AUTH -> authenticate(state, request);
                case MESSAGE -> {
                    if (request.text() == null || request.text().isBlank()) {
                        reply(connection, WsMessage.error(request.projectId(), "Empty message"));
                    } else {
                        orchestrator.submitMessage(connection.deviceId(), request.projectId(), request.text());
                    }
                }
                case CANCEL -> {
                    if (!orchestrator.cancel(connection.deviceId(), request.projectId())) {
                        reply(connection, WsMessage.error(request.projectId(), "No active job"));
                    }
                }
                case TOOL_ANSWER -> orchestrator.answerQuestion(connection.deviceId(), request.projectId(),
                        request.answers() != null ? request.answers() : List.of());
                default -> reply(connection, WsMessage.error(request.projectId(),
                        "Unsupported message type: " + request.type()));
            }
        } catch (ProjectNotFoundException | NoPendingQuestionException e) {
            reply(connection, WsMessage.error(request.projectId(), e.getMessage()));
        } catch (IllegalStateException e) {
            log.warn("Rejected {} from device {}: {}", request.type(), connection.deviceId(), e.getMessage());
            reply(connection, WsMessage.error(request.projectId(), e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Failed to handle {} from device {}", request.type(), connection.deviceId(), e);
            reply(connection, WsMessage.error(request.projectId(), "Internal error handling " + request.type()));
        }
    }

    private void authenticate(SocketState state, WsMessage request) {
        WebSocketDeviceConnection connection = state.connection;
        AuthResult result = authService.authenticate(state.remoteAddress, request.pin());
        switch (result.status()) {
            case OK -> {
                state.authenticated = true;
                log.info("Device {} authenticated from {}", connection.deviceId(), state.remoteAddress);
                orchestrator.attach(connection);
            }
            case INVALID_PIN -> reply(connection,
                    WsMessage.authError(WsMessage.CODE_INVALID_PIN, "Invalid PIN", null));
            case RATE_LIMITED -> reply(connection,
                    WsMessage.authError(WsMessage.CODE_RATE_LIMITED, "Too many attempts", result.retryAfterMs()));
        }
    }

    private void reply(WebSocketDeviceConnection connection, WsMessage message) {
        synchronizer.reply(connection, message);
    }

    private static String remoteAddress(WebSocketSession session) {
        InetSocketAddress address = session.getRemoteAddress();
        return address != null ? address.getHostString() : "unknown";
    }

    int openSockets() {
        return sockets.size();
    }

    private static final class SocketState {
        private final WebSocketSession session;
        private final String remoteAddress;
        private volatile WebSocketDeviceConnection connection;
        private volatile boolean authenticated;

        private SocketState(WebSocketSession session, String remoteAddress) {
            this.session = session;
            this.remoteAddress = remoteAddress;
        }
    }
}
