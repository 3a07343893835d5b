package io.github.drompincen.agentrelay.runtime.device;

import io.github.drompincen.agentrelay.persistence.document.DeviceDocument;
import io.github.drompincen.agentrelay.persistence.repository.DeviceRepository;
import io.github.drompincen.agentrelay.protocol.ws.EncryptedEnvelope;
import io.github.drompincen.agentrelay.runtime.crypto.DecryptionException;
import io.github.drompincen.agentrelay.runtime.crypto.SecureChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Base64;

/**
 * Finds the device that sent an envelope by trial decryption against every registered shared key,
 * oldest device first. The first device whose key authenticates the envelope wins.
 */
@Service
public class DeviceIdentifier {

    private static final Logger log = LoggerFactory.getLogger(DeviceIdentifier.class);

    private final DeviceRepository deviceRepository;
    private final SecureChannel secureChannel;

    public DeviceIdentifier(DeviceRepository deviceRepository, SecureChannel secureChannel) {
        this.deviceRepository = deviceRepository;
        this.secureChannel = secureChannel;
    }

    /**
     * Opens an envelope for a connection. With a {@code cached} device only that device's key is
     * tried; a failure there is as fatal as an envelope no device can open.
     */
    public IdentifiedFrame identify(EncryptedEnvelope envelope, IdentifiedDevice cached) throws UnknownDeviceException {
        if (cached != null) {
            try {
                return new IdentifiedFrame(cached, secureChannel.decrypt(envelope, cached.key()));
            } catch (DecryptionException e) {
                log.warn("Envelope no longer decrypts with the key of device {}: {}", cached.deviceId(), e.getMessage());
                throw new UnknownDeviceException("Envelope does not decrypt with device " + cached.deviceId());
            }
        }

        int tried = 0;
        for (DeviceDocument device : deviceRepository.findAllByOrderByCreatedAtAscDeviceIdAsc()) {
            byte[] key;
            try {
                key = sharedKey(device);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping device {} with an unreadable shared secret", device.getDeviceId());
                continue;
            }
            tried++;
            try {
                String plaintext = secureChannel.decrypt(envelope, key);
                log.debug("Envelope identified as device {} after {} attempt(s)", device.getDeviceId(), tried);
                return new IdentifiedFrame(new IdentifiedDevice(device.getDeviceId(), key), plaintext);
            } catch (DecryptionException e) {
                log.trace("Envelope does not decrypt with device {}", device.getDeviceId());
            }
        }
        log.warn("Envelope matched none of {} registered device(s)", tried);
        throw new UnknownDeviceException("No registered device decrypts the envelope");
    }

    public static byte[] sharedKey(DeviceDocument device) {
        if (device.getSharedSecret() == null) {
            throw new IllegalArgumentException("Device " + device.getDeviceId() + " has no shared secret");
        }
        return Base64.getDecoder().decode(device.getSharedSecret());
    }
}
