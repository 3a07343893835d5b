package io.github.drompincen.agentrelay.gateway.controller;

import io.github.drompincen.agentrelay.protocol.api.PushSubscribeRequest;
import io.github.drompincen.agentrelay.runtime.push.PushNotifier;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * VAPID key lookup and per-device push subscriptions for the service worker.
 */
@RestController
@RequestMapping("/api/push")
public class PushController {

    private final PushNotifier pushNotifier;
    private final BearerPinGuard guard;

    public PushController(PushNotifier pushNotifier, BearerPinGuard guard) {
        this.pushNotifier = pushNotifier;
        this.guard = guard;
    }

    @GetMapping("/vapid")
    public ResponseEntity<?> vapid(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                   HttpServletRequest request) {
        ResponseEntity<?> denied = guard.reject(request, authorization);
        if (denied != null) return denied;
        return ResponseEntity.ok(Map.of("publicKey", pushNotifier.vapidPublicKey()));
    }

    @PostMapping("/subscribe")
    public ResponseEntity<?> subscribe(@RequestBody PushSubscribeRequest body,
                                       @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                       HttpServletRequest request) {
        ResponseEntity<?> denied = guard.reject(request, authorization);
        if (denied != null) return denied;
        try {
            pushNotifier.subscribe(body.deviceId(), body.subscription());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        return ResponseEntity.ok(Map.of("ok", true));
    }

    @DeleteMapping("/subscribe")
    public ResponseEntity<?> unsubscribe(@RequestParam String deviceId,
                                         @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                         HttpServletRequest request) {
        ResponseEntity<?> denied = guard.reject(request, authorization);
        if (denied != null) return denied;
        pushNotifier.unsubscribe(deviceId);
        return ResponseEntity.noContent().build();
    }
}
