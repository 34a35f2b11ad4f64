package com.fleetwarden.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * One JSON file per task under {@code sessions/}, so executor sessions can be resumed after a restart.
 */
@Service
public class SessionSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SessionSnapshotStore.class);

    static final String DIR_NAME = "sessions";

    private final Path dir;

    @Autowired
    public SessionSnapshotStore(StateProperties properties) {
        this(properties.resolve(DIR_NAME));
    }

    SessionSnapshotStore(Path dir) {
        this.dir = dir;
    }

    public void save(SessionSnapshot snapshot) {
        fileFor(snapshot.taskId()).write(snapshot);
    }

    public Optional<SessionSnapshot> load(String taskId) {
        return fileFor(taskId).read();
    }

    public boolean remove(String taskId) {
        return fileFor(taskId).delete();
    }

    /** Every readable snapshot, most recently active first. */
    public List<SessionSnapshot> loadAll() {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<SessionSnapshot> snapshots = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> p.getFileName().toString().endsWith(".json"))
                    .forEach(p -> new JsonStateFile<>(p, SessionSnapshot.class).read().ifPresent(snapshots::add));
        } catch (IOException e) {
            log.warn("Cannot list session snapshots in {}: {}", dir, e.getMessage());
            return List.of();
        }
        snapshots.sort(Comparator.comparingLong(SessionSnapshot::lastActiveAt).reversed());
        return snapshots;
    }

    /**
     * Deletes snapshots last active before {@code cutoffEpochMs}.
     *
     * @return number of snapshots removed
     */
    public int purgeOlderThan(long cutoffEpochMs) {
        int removed = 0;
        for (SessionSnapshot snapshot : loadAll()) {
            if (snapshot.lastActiveAt() < cutoffEpochMs && remove(snapshot.taskId())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Purged {} stale session snapshots", removed);
        }
        return removed;
    }

    private JsonStateFile<SessionSnapshot> fileFor(String taskId) {
        String safe = taskId.replaceAll("[^A-Za-z0-9._-]", "_");
        return new JsonStateFile<>(dir.resolve(safe + ".json"), SessionSnapshot.class);
    }
}
