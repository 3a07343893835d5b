package io.github.drompincen.agentrelay.persistence.file;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Append-only JSON-lines log. Lines are never rewritten or removed.
 */
public class OfflineEventFile {

    private static final Logger log = LoggerFactory.getLogger(OfflineEventFile.class);

    public static final String FILE_NAME = "offline-events.jsonl";

    private final ObjectWriter writer;
    private final ObjectReader reader;
    private final Path file;

    public OfflineEventFile(ObjectMapper mapper, Path dataDir) {
        this.writer = mapper.writer().without(SerializationFeature.INDENT_OUTPUT);
        this.reader = mapper.readerFor(OfflineEventRecord.class);
        this.file = dataDir.resolve(FILE_NAME);
    }

    public synchronized void append(OfflineEventRecord record) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String line = writer.writeValueAsString(record) + "\n";
            if (endsWithTornLine()) {
                line = "\n" + line;
            }
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to " + file, e);
        }
    }

    private boolean endsWithTornLine() throws IOException {
        if (!Files.exists(file)) {
            return false;
        }
        try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size == 0) {
                return false;
            }
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.position(size - 1).read(last);
            return last.get(0) != '\n';
        }
    }

    /** Records of {@code deviceId} with {@code timestamp > afterTimestamp}, in log order. */
    public synchronized List<OfflineEventRecord> readAfter(String deviceId, long afterTimestamp) {
        List<OfflineEventRecord> out = new ArrayList<>();
        forEachRecord(record -> {
            if (deviceId.equals(record.deviceId()) && record.timestamp() > afterTimestamp) {
                out.add(record);
            }
        });
        return out;
    }

    public synchronized long lastTimestamp() {
        long[] last = {0L};
        forEachRecord(record -> last[0] = Math.max(last[0], record.timestamp()));
        return last[0];
    }

    private void forEachRecord(Consumer<OfflineEventRecord> consumer) {
        if (!Files.exists(file)) {
            return;
        }
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            long lineNo = 0;
            while ((line = in.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                try {
                    consumer.accept(reader.readValue(line));
                } catch (JsonProcessingException e) {
                    // a torn final line is expected after a crash mid-append
                    log.warn("Skipping unreadable line {} of {}: {}", lineNo, file, e.getOriginalMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }
}
