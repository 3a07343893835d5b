package io.github.drompincen.agentrelay.runtime.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentrelay.persistence.file.OfflineEventRecord;
import io.github.drompincen.agentrelay.protocol.ws.WsMessage;
import io.github.drompincen.agentrelay.runtime.offline.OfflineEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Keeps every device's view of a job consistent.
 *
 * <p>Job events go to the originating device and to every connected device; a recipient that is
 * not connected, or whose socket fails, gets the event in the offline log instead. Each connection
 * has its own {@link DeviceOutbox}, so publishing only enqueues and a slow socket never holds up the
 * publisher or the other devices.
 *
 * <p>Publishing holds the read side of {@code catchUpLock} while it applies the state update and
 * enqueues; {@link #attach} holds the write side while it queues the greeting and the backlog. Neither
 * side writes to a socket.
 */
@Service
public class MultiDeviceSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(MultiDeviceSynchronizer.class);

    static final int REPLACED_CLOSE_CODE = 1000;
    static final String REPLACED_CLOSE_REASON = "Replaced by a newer connection";

    private final OfflineEventLog offlineLog;
    private final ObjectMapper mapper;
    private final Executor sendExecutor;
    private final ConcurrentHashMap<String, DeviceOutbox> outboxes = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock catchUpLock = new ReentrantReadWriteLock();

    public MultiDeviceSynchronizer(OfflineEventLog offlineLog, ObjectMapper mapper,
                                   @Qualifier("deviceSendExecutor") Executor sendExecutor) {
        this.offlineLog = offlineLog;
        this.mapper = mapper;
        this.sendExecutor = sendExecutor;
    }

    /**
     * Registers an authenticated connection and queues its catch-up: the greeting messages
     * ({@code auth_ok}, then one {@code streaming_restore} per active job) followed by the device's
     * offline backlog. Live events published meanwhile are queued after the backlog. A previous
     * connection of the same device is closed.
     */
    public void attach(DeviceConnection connection, Supplier<List<WsMessage>> greeting) {
        String deviceId = connection.deviceId();
        DeviceConnection replaced = null;
        catchUpLock.writeLock().lock();
        try {
            List<WsMessage> carried = List.of();
            DeviceOutbox previous = outboxes.get(deviceId);
            if (previous != null) {
                carried = previous.retire();
                offlineLog.release(deviceId);
                if (previous.connection() != connection) {
                    replaced = previous.connection();
                }
            }
            DeviceOutbox outbox = new DeviceOutbox(connection, sendExecutor, offlineLog, mapper);
            outboxes.put(deviceId, outbox);
            for (WsMessage message : greeting.get()) {
                outbox.offerTransient(message);
            }
            queueBacklog(outbox);
            for (WsMessage message : carried) {
                deliverOrQueue(deviceId, message);
            }
        } finally {
            catchUpLock.writeLock().unlock();
        }
        if (replaced != null) {
            log.info("Device {} reconnected, closing its previous connection", deviceId);
            replaced.close(REPLACED_CLOSE_CODE, REPLACED_CLOSE_REASON);
        }
    }

    private void queueBacklog(DeviceOutbox outbox) {
        for (OfflineEventRecord record : offlineLog.replay(outbox.connection().deviceId())) {
            WsMessage message;
            try {
                message = mapper.treeToValue(record.event(), WsMessage.class);
            } catch (IOException e) {
                log.error("Dropping unreadable offline event for device {} at {}",
                        record.deviceId(), record.timestamp(), e);
                continue;
            }
            outbox.offerBacklog(message, record.timestamp());
        }
    }

    /** Unregisters the connection if it is still the device's current one; queued events are stored. */
    public void detach(DeviceConnection connection) {
        String deviceId = connection.deviceId();
        catchUpLock.writeLock().lock();
        try {
            DeviceOutbox outbox = outboxes.get(deviceId);
            if (outbox == null || outbox.connection() != connection) {
                return;
            }
            outboxes.remove(deviceId);
            for (WsMessage message : outbox.retire()) {
                offlineLog.append(deviceId, mapper.valueToTree(message));
            }
            offlineLog.release(deviceId);
        } finally {
            catchUpLock.writeLock().unlock();
        }
        log.info("Device {} disconnected", deviceId);
    }

    public boolean isConnected(String deviceId) {
        DeviceOutbox outbox = outboxes.get(deviceId);
        return outbox != null && !outbox.isClosed() && outbox.connection().isOpen();
    }

    /**
     * Applies {@code stateUpdate} and queues the event for its recipients, both under the read side
     * of the catch-up lock.
     */
    public void publishJobEvent(String originDeviceId, WsMessage message, Runnable stateUpdate) {
        catchUpLock.readLock().lock();
        try {
            stateUpdate.run();
            Set<String> recipients = new LinkedHashSet<>();
            recipients.add(originDeviceId);
            recipients.addAll(outboxes.keySet());
            for (String deviceId : recipients) {
                deliverOrQueue(deviceId, message);
            }
        } finally {
            catchUpLock.readLock().unlock();
        }
    }

    public void publishJobEvent(String originDeviceId, WsMessage message) {
        publishJobEvent(originDeviceId, message, () -> { });
    }

    /** Mirrors a user action to every other connected device. */
    public void notifyOthers(String originDeviceId, WsMessage message) {
        catchUpLock.readLock().lock();
        try {
            for (String deviceId : outboxes.keySet()) {
                if (!deviceId.equals(originDeviceId)) {
                    deliverOrQueue(deviceId, message);
                }
            }
        } finally {
            catchUpLock.readLock().unlock();
        }
    }

    /**
     * Direct reply on one connection; nothing is stored if it fails. Replies to a registered
     * connection keep their place in its outbox.
     */
    public void reply(DeviceConnection connection, WsMessage message) {
        DeviceOutbox outbox = outboxes.get(connection.deviceId());
        if (outbox != null && outbox.connection() == connection) {
            outbox.offerTransient(message);
            return;
        }
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.send(message);
        } catch (IOException | RuntimeException e) {
            log.warn("Reply {} to device {} failed: {}", message.type(), connection.deviceId(), e.getMessage());
        }
    }

    private void deliverOrQueue(String deviceId, WsMessage message) {
        DeviceOutbox outbox = outboxes.get(deviceId);
        if (outbox == null || !outbox.offerEvent(message)) {
            offlineLog.append(deviceId, mapper.valueToTree(message));
        }
    }
}
