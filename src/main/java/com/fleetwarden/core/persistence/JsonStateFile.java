package com.fleetwarden.core.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Best-effort JSON file holding one state value.
 * <p>
 * Reads return empty on a missing, unreadable or malformed file. Writes go to a sibling temp
 * file that is then moved over the target, so readers never see a half-written document.
 *
 * @param <T> the state type
 */
public class JsonStateFile<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonStateFile.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path path;
    private final Class<T> type;

    public JsonStateFile(Path path, Class<T> type) {
        this.path = path;
        this.type = type;
    }

    public Path path() {
        return path;
    }

    public Optional<T> read() {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(path.toFile(), type));
        } catch (IOException e) {
            log.warn("Ignoring unreadable state file {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes the value, returning false when the file could not be written.
     */
    public boolean write(T value) {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(tmp.toFile(), value);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            return true;
        } catch (IOException e) {
            log.warn("Failed to write state file {}: {}", path, e.getMessage());
            return false;
        }
    }

    public boolean delete() {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete state file {}: {}", path, e.getMessage());
            return false;
        }
    }
}
