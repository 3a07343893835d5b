package io.github.drompincen.agentrelay.runtime.device;

import io.github.drompincen.agentrelay.persistence.document.DeviceDocument;
import io.github.drompincen.agentrelay.persistence.repository.DeviceRepository;
import io.github.drompincen.agentrelay.protocol.ws.EncryptedEnvelope;
import io.github.drompincen.agentrelay.runtime.crypto.AesGcmSecureChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeviceIdentifierTest {

    @Mock
    private DeviceRepository deviceRepository;

    private final AesGcmSecureChannel channel = new AesGcmSecureChannel();
    private DeviceIdentifier identifier;
    private List<DeviceDocument> devices;

    @BeforeEach
    void setUp() {
        identifier = new DeviceIdentifier(deviceRepository, channel);
        devices = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            byte[] key = new byte[32];
            key[0] = (byte) (i + 1);
            devices.add(new DeviceDocument("dev-" + i, "pub-" + i, Base64.getEncoder().encodeToString(key),
                    Instant.parse("2026-01-01T00:00:00Z").plusSeconds(i)));
        }
    }

    @Test
    void identifiesEveryRegisteredDevice() throws Exception {
        when(deviceRepository.findAllByOrderByCreatedAtAscDeviceIdAsc()).thenReturn(devices);

        for (DeviceDocument device : devices) {
            EncryptedEnvelope env = channel.encrypt("hello " + device.getDeviceId(), DeviceIdentifier.sharedKey(device));

            IdentifiedFrame frame = identifier.identify(env, null);

            assertThat(frame.device().deviceId()).isEqualTo(device.getDeviceId());
            assertThat(frame.plaintext()).isEqualTo("hello " + device.getDeviceId());
        }
    }

    @Test
    void firstDeviceInRegistryOrderWinsWhenKeysCollide() throws Exception {
        DeviceDocument twin = new DeviceDocument("dev-twin", "pub", devices.get(3).getSharedSecret(),
                Instant.parse("2025-12-31T00:00:00Z"));
        List<DeviceDocument> ordered = new ArrayList<>();
        ordered.add(twin);
        ordered.addAll(devices);
        when(deviceRepository.findAllByOrderByCreatedAtAscDeviceIdAsc()).thenReturn(ordered);

        EncryptedEnvelope env = channel.encrypt("x", DeviceIdentifier.sharedKey(devices.get(3)));

        assertThat(identifier.identify(env, null).device().deviceId()).isEqualTo("dev-twin");
    }

    @Test
    void unknownKeyIsRejected() {
        when(deviceRepository.findAllByOrderByCreatedAtAscDeviceIdAsc()).thenReturn(devices);
        byte[] stranger = new byte[32];
        stranger[31] = 9;

        assertThatThrownBy(() -> identifier.identify(channel.encrypt("x", stranger), null))
                .isInstanceOf(UnknownDeviceException.class);
    }

    @Test
    void deviceWithUnreadableSecretIsSkipped() throws Exception {
        DeviceDocument broken = new DeviceDocument("broken", "pub", "not base64 ###", Instant.EPOCH);
        List<DeviceDocument> ordered = new ArrayList<>();
        ordered.add(broken);
        ordered.addAll(devices);
        when(deviceRepository.findAllByOrderByCreatedAtAscDeviceIdAsc()).thenReturn(ordered);

        EncryptedEnvelope env = channel.encrypt("x", DeviceIdentifier.sharedKey(devices.get(0)));

        assertThat(identifier.identify(env, null).device().deviceId()).isEqualTo("dev-0");
    }

    @Test
    void cachedDeviceSkipsTheRegistry() throws Exception {
        byte[] key = DeviceIdentifier.sharedKey(devices.get(2));
        IdentifiedDevice cached = new IdentifiedDevice("dev-2", key);

        IdentifiedFrame frame = identifier.identify(channel.encrypt("again", key), cached);

        assertThat(frame.device()).isSameAs(cached);
        assertThat(frame.plaintext()).isEqualTo("again");
        verify(deviceRepository, never()).findAllByOrderByCreatedAtAscDeviceIdAsc();
    }

    @Test
    void cachedDeviceFailureIsFatal() {
        IdentifiedDevice cached = new IdentifiedDevice("dev-2", DeviceIdentifier.sharedKey(devices.get(2)));
        EncryptedEnvelope other = channel.encrypt("x", DeviceIdentifier.sharedKey(devices.get(1)));

        assertThatThrownBy(() -> identifier.identify(other, cached)).isInstanceOf(UnknownDeviceException.class);
        verify(deviceRepository, never()).findAllByOrderByCreatedAtAscDeviceIdAsc();
    }
}
