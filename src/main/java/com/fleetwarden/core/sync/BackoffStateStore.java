package com.fleetwarden.core.sync;

import com.fleetwarden.core.persistence.JsonStateFile;
import com.fleetwarden.core.persistence.StateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.function.UnaryOperator;

/**
 * Process-shared board backoff state backed by {@code gh-backoff.json}.
 * <p>
 * Reads and updates always start from the file, so a deadline or reset written by a sibling
 * process takes effect here on the next call. The last readable state is kept for when the file
 * is missing or unreadable. Updates are read-modify-write and last-writer-wins.
 */
@Service
public class BackoffStateStore {

    private static final Logger log = LoggerFactory.getLogger(BackoffStateStore.class);

    static final String FILE_NAME = "gh-backoff.json";

    private final JsonStateFile<BackoffState> file;
    private BackoffState current;

    @Autowired
    public BackoffStateStore(StateProperties properties) {
        this(properties.resolve(FILE_NAME));
    }

    BackoffStateStore(Path path) {
        this.file = new JsonStateFile<>(path, BackoffState.class);
        this.current = file.read().orElseGet(BackoffState::empty);
    }

    /** The latest persisted state, including changes written by other processes. */
    public synchronized BackoffState current() {
        current = file.read().orElse(current);
        return current;
    }

    /**
     * Applies a change on top of the latest persisted state and writes the result.
     */
    public synchronized BackoffState update(UnaryOperator<BackoffState> change) {
        BackoffState next = change.apply(current());
        current = next;
        file.write(next);
        return next;
    }

    /**
     * Forgets every backoff, the operator escape hatch after fixing board configuration.
     */
    public synchronized void reset() {
        current = BackoffState.empty();
        file.write(current);
        log.info("Board backoff state reset ({})", file.path());
    }

    public Path path() {
        return file.path();
    }
}
