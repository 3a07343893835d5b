package io.github.drompincen.agentrelay.runtime.support;

import io.github.drompincen.agentrelay.protocol.api.PushSubscription;
import io.github.drompincen.agentrelay.runtime.push.PushSender;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingPushSender implements PushSender {

    private final List<String> endpoints = new CopyOnWriteArrayList<>();
    private final List<String> payloads = new CopyOnWriteArrayList<>();

    @Override
    public String publicKey() {
        return "test-public-key";
    }

    @Override
    public int send(PushSubscription subscription, String payload) {
        endpoints.add(subscription.endpoint());
        payloads.add(payload);
        return 201;
    }

    public List<String> endpoints() {
        return endpoints;
    }

    public List<String> payloads() {
        return payloads;
    }
}
