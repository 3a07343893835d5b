package io.github.drompincen.agentrelay.persistence.file;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.Supplier;

/**
 * Whole-file JSON reads and atomic replacements shared by the file-backed stores.
 */
public final class JsonFileSupport {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSupport.class);

    private JsonFileSupport() {}

    public static <T> T read(ObjectMapper mapper, Path file, TypeReference<T> type, Supplier<T> ifMissing) {
        if (!Files.exists(file)) {
            return ifMissing.get();
        }
        try {
            T value = mapper.readValue(file.toFile(), type);
            return value != null ? value : ifMissing.get();
        } catch (JsonProcessingException e) {
            Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
            log.error("Unreadable store file {}, moving it to {}", file, aside, e);
            try {
                Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException moveFailure) {
                throw new UncheckedIOException("Failed to move aside corrupt file " + file, moveFailure);
            }
            return ifMissing.get();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    /** Writes to a sibling temp file and renames it over the target. */
    public static void writeAtomically(ObjectMapper mapper, Path file, Object value) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), value);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }
}
