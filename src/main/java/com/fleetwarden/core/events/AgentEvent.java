package com.fleetwarden.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An agent lifecycle signal as recorded in the bus's event log.
 *
 * @param type      event kind
 * @param taskId    task the event belongs to, {@code "system"} for executor-wide events
 * @param payload   event specific data; copied on construction, never mutated afterwards
 * @param timestamp when the bus recorded the event
 */
public record AgentEvent(
    AgentEventType type,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public AgentEvent {
        // LinkedHashMap keeps insertion order and tolerates null values from callers
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /** The payload merged with {@code taskId} and {@code ts}, as pushed to UI clients. */
    public Map<String, Object> broadcastPayload() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("taskId", taskId);
        data.putAll(payload);
        data.put("ts", timestamp.toEpochMilli());
        return data;
    }
}
