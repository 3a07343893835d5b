package io.github.drompincen.agentrelay.runtime.push;

import io.github.drompincen.agentrelay.persistence.file.VapidKeyFile;
import io.github.drompincen.agentrelay.persistence.file.VapidKeyFile.VapidKeys;
import io.github.drompincen.agentrelay.protocol.api.PushSubscription;
import io.github.drompincen.agentrelay.runtime.config.RelayProperties;
import jakarta.annotation.PostConstruct;
import nl.martijndwars.webpush.Notification;
import nl.martijndwars.webpush.PushService;
import nl.martijndwars.webpush.Subscription;
import nl.martijndwars.webpush.Utils;
import org.bouncycastle.jce.ECNamedCurveTable;
import org.bouncycastle.jce.interfaces.ECPrivateKey;
import org.bouncycastle.jce.interfaces.ECPublicKey;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.security.Security;
import java.util.Base64;
import java.util.Optional;

/**
 * Web push over VAPID. The key pair is loaded from {@code vapid.json} in the data directory, or
 * generated on first start and saved there.
 */
@Component
public class VapidPushSender implements PushSender {

    private static final Logger log = LoggerFactory.getLogger(VapidPushSender.class);
    private static final String CURVE = "prime256v1";

    private final VapidKeyFile keyFile;
    private final String subject;
    private volatile PushService pushService;
    private volatile String publicKey;

    public VapidPushSender(VapidKeyFile keyFile, RelayProperties properties) {
        this.keyFile = keyFile;
        this.subject = properties.push().subject();
    }

    @PostConstruct
    public void init() throws GeneralSecurityException {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
        Optional<VapidKeys> stored = keyFile.read();
        VapidKeys keys;
        if (stored.isPresent()) {
            keys = stored.get();
            log.info("VAPID keys loaded");
        } else {
            keys = generateKeys();
            keyFile.write(keys);
            log.info("VAPID keys generated and saved");
        }
        pushService = new PushService(keys.publicKey(), keys.privateKey(), subject);
        publicKey = keys.publicKey();
    }

    static VapidKeys generateKeys() throws GeneralSecurityException {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("ECDH", BouncyCastleProvider.PROVIDER_NAME);
        generator.initialize(ECNamedCurveTable.getParameterSpec(CURVE), new SecureRandom());
        KeyPair pair = generator.generateKeyPair();
        Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
        return new VapidKeys(
                encoder.encodeToString(Utils.encode((ECPublicKey) pair.getPublic())),
                encoder.encodeToString(Utils.encode((ECPrivateKey) pair.getPrivate())));
    }

    @Override
    public String publicKey() {
        return publicKey;
    }

    @Override
    public int send(PushSubscription subscription, String payload) throws IOException {
        PushService service = pushService;
        if (service == null) {
            throw new IllegalStateException("VAPID keys are not initialised");
        }
        try {
            Notification notification = new Notification(new Subscription(subscription.endpoint(),
                    new Subscription.Keys(subscription.keys().p256dh(), subscription.keys().auth())), payload);
            var response = service.send(notification);
            return response.getStatusLine().getStatusCode();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while sending push to " + subscription.endpoint(), e);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Push to " + subscription.endpoint() + " failed: " + e.getMessage(), e);
        }
    }
}
