package io.github.drompincen.agentrelay.runtime.push;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.agentrelay.persistence.file.VapidKeyFile;
import io.github.drompincen.agentrelay.runtime.config.RelayProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

class VapidPushSenderTest {

    @TempDir
    Path dataDir;

    @Test
    void keyPairIsGeneratedOnceAndReusedAfterRestart() throws Exception {
        VapidKeyFile keyFile = new VapidKeyFile(new ObjectMapper(), dataDir);
        RelayProperties props = RelayProperties.withDefaults("1234", dataDir, dataDir);

        VapidPushSender first = new VapidPushSender(keyFile, props);
        first.init();
        VapidPushSender restarted = new VapidPushSender(new VapidKeyFile(new ObjectMapper(), dataDir), props);
        restarted.init();

        assertThat(restarted.publicKey()).isEqualTo(first.publicKey());
        byte[] point = Base64.getUrlDecoder().decode(first.publicKey());
        assertThat(point).hasSize(65);
        assertThat(point[0]).isEqualTo((byte) 0x04);
    }
}
