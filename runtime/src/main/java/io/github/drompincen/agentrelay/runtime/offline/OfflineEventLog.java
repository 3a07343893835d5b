package io.github.drompincen.agentrelay.runtime.offline;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.agentrelay.persistence.file.OfflineEventFile;
import io.github.drompincen.agentrelay.persistence.file.OfflineEventRecord;
import io.github.drompincen.agentrelay.persistence.file.ReplayCursorFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable queue of events for devices that were not reachable when the event happened.
 *
 * <p>Timestamps come from a strictly increasing millisecond clock, so the per-device cursor
 * ({@code timestamp > cursor}) never skips a record appended in the same millisecond.
 *
 * <p>Each device has two cursors. The claimed cursor lives in memory and moves when records are
 * handed out by {@link #replay}; the persisted cursor only moves through {@link #acknowledge} once a
 * record has actually been written to the device's socket. After a restart, anything claimed but not
 * acknowledged is replayed again.
 */
@Service
public class OfflineEventLog {

    private static final Logger log = LoggerFactory.getLogger(OfflineEventLog.class);

    private final OfflineEventFile eventFile;
    private final ReplayCursorFile cursors;
    private final ConcurrentHashMap<String, Long> claimed = new ConcurrentHashMap<>();
    private long lastTimestamp;

    public OfflineEventLog(OfflineEventFile eventFile, ReplayCursorFile cursors) {
        this.eventFile = eventFile;
        this.cursors = cursors;
        this.lastTimestamp = eventFile.lastTimestamp();
    }

    public synchronized OfflineEventRecord append(String deviceId, JsonNode event) {
        OfflineEventRecord record = new OfflineEventRecord(deviceId, event, nextTimestamp());
        eventFile.append(record);
        return record;
    }

    /**
     * Returns the device's records newer than both of its cursors, in log order, and claims them.
     * A second call without new appends returns nothing.
     */
    public synchronized List<OfflineEventRecord> replay(String deviceId) {
        long from = Math.max(cursors.get(deviceId), claimed.getOrDefault(deviceId, 0L));
        List<OfflineEventRecord> pending = eventFile.readAfter(deviceId, from);
        if (!pending.isEmpty()) {
            long max = pending.stream().mapToLong(OfflineEventRecord::timestamp).max().getAsLong();
            claimed.put(deviceId, max);
            log.info("Replaying {} offline event(s) to device {}", pending.size(), deviceId);
        }
        return pending;
    }

    /** Records that the device received everything up to and including {@code timestamp}. */
    public synchronized void acknowledge(String deviceId, long timestamp) {
        cursors.advance(deviceId, timestamp);
    }

    /**
     * Drops the device's unacknowledged claims, so the next {@link #replay} hands those records
     * out again.
     */
    public synchronized void release(String deviceId) {
        Long dropped = claimed.remove(deviceId);
        if (dropped != null && dropped > cursors.get(deviceId)) {
            log.warn("Device {} left offline events unacknowledged, they will be replayed", deviceId);
        }
    }

    private long nextTimestamp() {
        lastTimestamp = Math.max(System.currentTimeMillis(), lastTimestamp + 1);
        return lastTimestamp;
    }
}
