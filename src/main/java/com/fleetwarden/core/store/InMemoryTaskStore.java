package com.fleetwarden.core.store;

import com.fleetwarden.core.events.TaskStatusSink;
import com.fleetwarden.core.model.FleetTask;
import com.fleetwarden.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Local task records shared by the event bus and the reconciliation engine.
 * <p>
 * Records are immutable {@link FleetTask} values; every change replaces the stored value atomically.
 */
@Service
public class InMemoryTaskStore implements TaskStatusSink {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskStore.class);

    private final ConcurrentHashMap<String, FleetTask> tasks = new ConcurrentHashMap<>();

    @Override
    public void setTaskStatus(String taskId, TaskStatus status, String source) {
        FleetTask updated = tasks.computeIfPresent(taskId, (id, task) -> task.withStatus(status));
        if (updated == null) {
            log.debug("Status {} for unknown task {} from {} ignored", status.wireName(), taskId, source);
            return;
        }
        log.info("Task {} -> {} (source: {})", taskId, status.wireName(), source);
    }

    @Override
    public Optional<FleetTask> findTask(String taskId) {
        return taskId == null ? Optional.empty() : Optional.ofNullable(tasks.get(taskId));
    }

    public FleetTask upsert(FleetTask task) {
        tasks.put(task.id(), task);
        return task;
    }

    /**
     * Applies {@code change} to the current record, so a concurrent status change is not
     * overwritten by an older snapshot.
     *
     * @return the updated record, empty when the task is unknown
     */
    public Optional<FleetTask> update(String taskId, UnaryOperator<FleetTask> change) {
        return Optional.ofNullable(tasks.computeIfPresent(taskId, (id, task) -> change.apply(task)));
    }

    public boolean remove(String taskId) {
        return tasks.remove(taskId) != null;
    }

    /** All tasks ordered by id, numeric ids first in numeric order. */
    public List<FleetTask> listTasks() {
        return tasks.values().stream()
                .sorted(Comparator.comparing(FleetTask::id, InMemoryTaskStore::compareIds))
                .toList();
    }

    public int size() {
        return tasks.size();
    }

    private static int compareIds(String a, String b) {
        boolean numA = a.chars().allMatch(Character::isDigit) && !a.isEmpty();
        boolean numB = b.chars().allMatch(Character::isDigit) && !b.isEmpty();
        if (numA && numB) {
            String x = a.replaceFirst("^0+(?=.)", "");
            String y = b.replaceFirst("^0+(?=.)", "");
            return x.length() != y.length() ? Integer.compare(x.length(), y.length()) : x.compareTo(y);
        }
        if (numA != numB) {
            return numA ? -1 : 1;
        }
        return a.compareTo(b);
    }
}
