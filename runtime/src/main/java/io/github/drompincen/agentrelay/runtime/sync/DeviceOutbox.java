package io.github.drompincen.agentrelay.runtime.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentrelay.protocol.ws.WsMessage;
import io.github.drompincen.agentrelay.runtime.offline.OfflineEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Ordered send queue of one connection.
 *
 * <p>At most one drain task runs per outbox, so messages leave in the order they were offered.
 * Socket writes happen on the send executor and never under the outbox monitor; a slow socket only
 * delays its own queue. Once a send fails the outbox is closed: the message that failed and everything
 * still queued behind it move to the offline log, and later offers are refused.
 */
final class DeviceOutbox {

    private static final Logger log = LoggerFactory.getLogger(DeviceOutbox.class);

    /**
     * A queued message. {@code backlogTimestamp} is set for records replayed from the offline log,
     * {@code durable} marks live events that must survive a failed send.
     */
    private record Entry(WsMessage message, Long backlogTimestamp, boolean durable) {
    }

    private final DeviceConnection connection;
    private final Executor executor;
    private final OfflineEventLog offlineLog;
    private final ObjectMapper mapper;
    private final Deque<Entry> queue = new ArrayDeque<>();
    private boolean draining;
    private boolean closed;

    DeviceOutbox(DeviceConnection connection, Executor executor, OfflineEventLog offlineLog, ObjectMapper mapper) {
        this.connection = connection;
        this.executor = executor;
        this.offlineLog = offlineLog;
        this.mapper = mapper;
    }

    DeviceConnection connection() {
        return connection;
    }

    synchronized boolean isClosed() {
        return closed;
    }

    /** Queues a job event. Returns false when the outbox is closed and the caller must store it. */
    boolean offerEvent(WsMessage message) {
        return offer(new Entry(message, null, true));
    }

    /** Queues a message that is dropped, not stored, if the socket fails. */
    boolean offerTransient(WsMessage message) {
        return offer(new Entry(message, null, false));
    }

    /** Queues a replayed offline record; it is acknowledged in the log once written. */
    boolean offerBacklog(WsMessage message, long timestamp) {
        return offer(new Entry(message, timestamp, false));
    }

    /**
     * Closes the outbox without touching the socket and returns the queued live events, in order.
     * Queued backlog records are left unacknowledged in the log.
     */
    synchronized List<WsMessage> retire() {
        closed = true;
        List<WsMessage> pending = new ArrayList<>();
        for (Entry entry : queue) {
            if (entry.durable()) {
                pending.add(entry.message());
            }
        }
        queue.clear();
        return pending;
    }

    private boolean offer(Entry entry) {
        synchronized (this) {
            if (closed) {
                return false;
            }
            queue.add(entry);
            if (draining) {
                return true;
            }
            draining = true;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            log.warn("Send executor rejected work for device {}, storing its queue", connection.deviceId());
            fail(null);
        }
        return true;
    }

    private void drain() {
        while (true) {
            Entry next;
            synchronized (this) {
                next = closed ? null : queue.poll();
                if (next == null) {
                    draining = false;
                    return;
                }
            }
            if (!send(next.message())) {
                fail(next);
                return;
            }
            if (next.backlogTimestamp() != null) {
                offlineLog.acknowledge(connection.deviceId(), next.backlogTimestamp());
            }
        }
    }

    private boolean send(WsMessage message) {
        if (!connection.isOpen()) {
            return false;
        }
        try {
            connection.send(message);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Send of {} to device {} failed: {}", message.type(), connection.deviceId(), e.getMessage());
            return false;
        }
    }

    private synchronized void fail(Entry inFlight) {
        boolean wasClosed = closed;
        closed = true;
        draining = false;
        List<Entry> undelivered = new ArrayList<>();
        if (inFlight != null) {
            undelivered.add(inFlight);
        }
        undelivered.addAll(queue);
        queue.clear();
        int stored = 0;
        for (Entry entry : undelivered) {
            if (entry.durable()) {
                offlineLog.append(connection.deviceId(), mapper.valueToTree(entry.message()));
                stored++;
            }
        }
        if (!wasClosed) {
            offlineLog.release(connection.deviceId());
        }
        if (stored > 0) {
            log.info("Stored {} undelivered event(s) for device {} in the offline log", stored, connection.deviceId());
        }
    }
}
