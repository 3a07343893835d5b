package io.github.drompincen.agentrelay.runtime.push;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentrelay.persistence.file.PushSubscriptionFile;
import io.github.drompincen.agentrelay.protocol.api.JobKey;
import io.github.drompincen.agentrelay.protocol.api.PushSubscription;
import io.github.drompincen.agentrelay.runtime.sync.MultiDeviceSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Per-device web push subscriptions, and the "response ready" notification for devices that are not
 * connected when a job finishes. Subscriptions the push service reports as gone (404, 410) are removed.
 */
@Service
public class PushNotifier {

    private static final Logger log = LoggerFactory.getLogger(PushNotifier.class);

    private final PushSubscriptionFile subscriptions;
    private final PushSender sender;
    private final MultiDeviceSynchronizer synchronizer;
    private final ObjectMapper mapper;
    private final Executor executor;

    public PushNotifier(PushSubscriptionFile subscriptions, PushSender sender, MultiDeviceSynchronizer synchronizer,
                        ObjectMapper mapper, @Qualifier("deviceSendExecutor") Executor executor) {
        this.subscriptions = subscriptions;
        this.sender = sender;
        this.synchronizer = synchronizer;
        this.mapper = mapper;
        this.executor = executor;
    }

    public String vapidPublicKey() {
        return sender.publicKey();
    }

    /**
     * Stores the device's subscription, replacing any earlier one.
     *
     * @throws IllegalArgumentException when the device id or a subscription field is missing
     */
    public void subscribe(String deviceId, PushSubscription subscription) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("deviceId is required");
        }
        if (subscription == null || !subscription.isComplete()) {
            throw new IllegalArgumentException("subscription needs an endpoint and p256dh/auth keys");
        }
        subscriptions.put(deviceId, subscription);
        log.info("Push subscription saved for device {}", deviceId);
    }

    public boolean unsubscribe(String deviceId) {
        boolean removed = subscriptions.remove(deviceId);
        if (removed) {
            log.info("Push subscription removed for device {}", deviceId);
        }
        return removed;
    }

    /** Sends the notification in the background; the caller never waits on a push service. */
    public void notifyJobFinished(JobKey key) {
        String where = key.isGlobal() ? "the global chat" : key.projectId();
        executor.execute(() -> {
            try {
                notifyDisconnected("Response ready", "The agent finished in " + where, "/");
            } catch (RuntimeException e) {
                log.error("Push notification for {} failed", key, e);
            }
        });
    }

    /** @return how many devices the push service accepted the message for */
    int notifyDisconnected(String title, String body, String url) {
        String payload;
        try {
            payload = mapper.writeValueAsString(Map.of("title", title, "body", body, "url", url));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode push payload", e);
        }
        int delivered = 0;
        for (Map.Entry<String, PushSubscription> entry : subscriptions.all().entrySet()) {
            String deviceId = entry.getKey();
            if (synchronizer.isConnected(deviceId)) {
                continue;
            }
            PushSubscription subscription = entry.getValue();
            try {
                int status = sender.send(subscription, payload);
                if (status == 404 || status == 410) {
                    subscriptions.removeIfEndpoint(deviceId, subscription.endpoint());
                    log.info("Push subscription of device {} expired ({}), removed", deviceId, status);
                } else if (status >= 200 && status < 300) {
                    delivered++;
                    log.debug("Push sent to device {}", deviceId);
                } else {
                    log.warn("Push service answered {} for device {}", status, deviceId);
                }
            } catch (IOException e) {
                log.warn("Push to device {} failed: {}", deviceId, e.getMessage());
            }
        }
        return delivered;
    }
}
