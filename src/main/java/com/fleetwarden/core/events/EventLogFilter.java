package com.fleetwarden.core.events;

import java.time.Instant;

/**
 * Query over the event log. Every field is optional.
 *
 * @param taskId      only events for this task
 * @param type        only events of this type
 * @param since       only events recorded at or after this instant
 * @param limit       keep the most recent {@code limit} matches; zero or negative means no limit
 * @param newestFirst reverse the stored order
 */
public record EventLogFilter(
    String taskId,
    AgentEventType type,
    Instant since,
    int limit,
    boolean newestFirst
) {

    public static EventLogFilter all() {
        return new EventLogFilter(null, null, null, 0, false);
    }

    public static EventLogFilter forTask(String taskId) {
        return new EventLogFilter(taskId, null, null, 0, false);
    }

    public EventLogFilter withType(AgentEventType newType) {
        return new EventLogFilter(taskId, newType, since, limit, newestFirst);
    }

    public EventLogFilter withLimit(int newLimit) {
        return new EventLogFilter(taskId, type, since, newLimit, newestFirst);
    }

    public EventLogFilter reversed() {
        return new EventLogFilter(taskId, type, since, limit, true);
    }

    boolean matches(AgentEvent event) {
        if (taskId != null && !taskId.equals(event.taskId())) {
            return false;
        }
        if (type != null && type != event.type()) {
            return false;
        }
        return since == null || !event.timestamp().isBefore(since);
    }
}
