package com.fleetwarden.core.events;

import java.util.List;
import java.util.Map;

/**
 * Pushes recorded events to connected UI clients.
 */
@FunctionalInterface
public interface UiBroadcaster {

    /** Channels every agent event is broadcast on. */
    List<String> AGENT_CHANNELS = List.of("agents", "tasks", "overview");

    void broadcast(List<String> channels, String type, Map<String, Object> payload);
}
