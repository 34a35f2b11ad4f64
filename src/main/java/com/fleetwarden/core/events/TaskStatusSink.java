package com.fleetwarden.core.events;

import com.fleetwarden.core.model.FleetTask;
import com.fleetwarden.core.model.TaskStatus;

import java.util.Optional;

/**
 * Task store operations the event bus depends on.
 */
public interface TaskStatusSink {

    /**
     * Moves a task to a new status.
     *
     * @param taskId the task
     * @param status the new status
     * @param source who requested the change, for audit
     */
    void setTaskStatus(String taskId, TaskStatus status, String source);

    /** Looks a task up for notification text. */
    default Optional<FleetTask> findTask(String taskId) {
        return Optional.empty();
    }
}
