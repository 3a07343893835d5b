package io.github.drompincen.agentrelay.runtime.partial;

import io.github.drompincen.agentrelay.persistence.file.PartialSnapshotFile;
import io.github.drompincen.agentrelay.protocol.api.ConversationMessage;
import io.github.drompincen.agentrelay.protocol.api.JobKey;
import io.github.drompincen.agentrelay.protocol.api.PartialResponse;
import io.github.drompincen.agentrelay.protocol.event.AgentEvent;
import io.github.drompincen.agentrelay.runtime.config.RelayProperties;
import io.github.drompincen.agentrelay.runtime.conversation.ConversationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Accumulates the output of every running job and keeps a crash-safe copy on disk.
 *
 * <p>Updates land in memory and mark the key dirty; a single background task drains the dirty set
 * at a fixed delay and merges the drained keys into the snapshot file in one pass. Completing a job
 * removes its entry from memory and from disk at once. On startup {@link #recover} turns whatever
 * the previous process left behind into interrupted assistant messages.
 */
@Service
public class PartialResponseStore {

    private static final Logger log = LoggerFactory.getLogger(PartialResponseStore.class);

    public static final String INTERRUPTED_MARKER =
            "\n\n[Interrupted: the server restarted before this response finished]";

    private final PartialSnapshotFile snapshotFile;
    private final Duration flushInterval;
    private final ConcurrentHashMap<JobKey, PartialAccumulator> live = new ConcurrentHashMap<>();
    private final Set<JobKey> dirty = ConcurrentHashMap.newKeySet();
    private final Object flushLock = new Object();
    private ScheduledExecutorService flusher;

    public PartialResponseStore(PartialSnapshotFile snapshotFile, RelayProperties properties) {
        this.snapshotFile = snapshotFile;
        this.flushInterval = properties.flushInterval();
    }

    public synchronized void start() {
        if (flusher != null) return;
        flusher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "partial-flush");
            t.setDaemon(true);
            return t;
        });
        long millis = flushInterval.toMillis();
        flusher.scheduleWithFixedDelay(this::flushQuietly, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Partial-response flush scheduled every {}", flushInterval);
    }

    /** Stops the background task and writes out anything still dirty. */
    public synchronized void stop() {
        if (flusher == null) return;
        flusher.shutdown();
        try {
            if (!flusher.awaitTermination(5, TimeUnit.SECONDS)) {
                flusher.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            flusher.shutdownNow();
        }
        flusher = null;
        flush();
    }

    /** Starts an empty partial response for a job, replacing any previous one for the key. */
    public void begin(JobKey key, String task, String sessionId) {
        live.put(key, new PartialAccumulator(task, sessionId, Instant.now()));
        dirty.add(key);
    }

    /**
     * Applies an agent event to the key's partial response. Events for keys without a begun
     * response are dropped.
     */
    public boolean apply(JobKey key, AgentEvent event) {
        PartialAccumulator acc = live.get(key);
        if (acc == null || !acc.apply(event, Instant.now())) {
            return false;
        }
        dirty.add(key);
        return true;
    }

    public Optional<PartialResponse> get(JobKey key) {
        PartialAccumulator acc = live.get(key);
        return acc != null ? Optional.of(acc.snapshot()) : Optional.empty();
    }

    /** Removes the key from memory and disk and returns its final state. */
    public Optional<PartialResponse> complete(JobKey key) {
        PartialAccumulator acc = live.remove(key);
        dirty.remove(key);
        synchronized (flushLock) {
            snapshotFile.merge(Map.of(), List.of(key.asString()));
        }
        return acc != null ? Optional.of(acc.snapshot()) : Optional.empty();
    }

    /** Writes every dirty key to the snapshot file. Returns the number of keys written. */
    public int flush() {
        synchronized (flushLock) {
            Map<String, PartialResponse> upserts = new LinkedHashMap<>();
            for (JobKey key : new ArrayList<>(dirty)) {
                dirty.remove(key);
                PartialAccumulator acc = live.get(key);
                if (acc != null) {
                    upserts.put(key.asString(), acc.snapshot());
                }
            }
            if (upserts.isEmpty()) {
                return 0;
            }
            try {
                snapshotFile.merge(upserts, List.of());
            } catch (RuntimeException e) {
                upserts.keySet().forEach(k -> dirty.add(JobKey.parse(k)));
                throw e;
            }
            return upserts.size();
        }
    }

    private void flushQuietly() {
        try {
            int written = flush();
            if (written > 0) {
                log.debug("Flushed {} partial response(s)", written);
            }
        } catch (RuntimeException e) {
            log.error("Partial-response flush failed, retrying on the next tick", e);
        }
    }

    /**
     * Converts partial responses persisted by a previous process into interrupted assistant
     * messages, one per key with content, then clears the snapshot. Each key is removed from the
     * file right after its message is appended.
     */
    public int recover(ConversationStore conversations) {
        Map<String, PartialResponse> persisted;
        synchronized (flushLock) {
            persisted = snapshotFile.readAll();
        }
        int recovered = 0;
        Instant now = Instant.now();
        for (Map.Entry<String, PartialResponse> entry : persisted.entrySet()) {
            JobKey key;
            try {
                key = JobKey.parse(entry.getKey());
            } catch (IllegalArgumentException e) {
                log.warn("Dropping partial response with unreadable key {}", entry.getKey());
                continue;
            }
            PartialResponse partial = entry.getValue();
            if (partial != null && partial.hasContent()) {
                conversations.append(key.projectId(),
                        ConversationMessage.interruptedAssistant(partial, INTERRUPTED_MARKER, now));
                recovered++;
            }
            synchronized (flushLock) {
                snapshotFile.merge(Map.of(), List.of(entry.getKey()));
            }
        }
        synchronized (flushLock) {
            snapshotFile.clear();
        }
        if (!persisted.isEmpty()) {
            log.info("Recovered {} interrupted response(s) from {} persisted partial(s)", recovered, persisted.size());
        }
        return recovered;
    }

    boolean isDirty(JobKey key) {
        return dirty.contains(key);
    }
}
