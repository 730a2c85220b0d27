package com.starkiller.core.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.starkiller.core.session.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Saves and loads session snapshots as JSON files.
 * <p>
 * Writes go to a temporary sibling file that then replaces the target, so an
 * interrupted save leaves the previous snapshot intact.
 */
@Component
public class SessionSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SessionSnapshotStore.class);

    private final ObjectMapper objectMapper;

    public SessionSnapshotStore() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void save(SessionSnapshot snapshot, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), snapshot);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            log.info("Saved session {} (day {}) to {}", snapshot.sessionId(), snapshot.day(), file);
        } catch (IOException e) {
            throw new SnapshotStoreException("Failed to save session snapshot to " + file + ": " + e.getMessage(), e);
        }
    }

    public SessionSnapshot load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new SnapshotStoreException("No session snapshot at " + file);
        }
        try {
            SessionSnapshot snapshot = objectMapper.readValue(file.toFile(), SessionSnapshot.class);
            log.info("Loaded session {} (day {}) from {}", snapshot.sessionId(), snapshot.day(), file);
            return snapshot;
        } catch (IOException e) {
            throw new SnapshotStoreException("Failed to read session snapshot " + file + ": " + e.getMessage(), e);
        }
    }
}
