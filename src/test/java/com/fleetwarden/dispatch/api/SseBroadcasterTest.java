package com.fleetwarden.dispatch.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SseBroadcasterTest {

    private final SseBroadcaster broadcaster = new SseBroadcaster(60_000L);

    @Test
    @DisplayName("subscribers are counted")
    void subscribe() {
        broadcaster.subscribe(null);
        broadcaster.subscribe("task-1");

        assertEquals(2, broadcaster.clientCount());
    }

    @Test
    @DisplayName("clients that can no longer receive are dropped on broadcast")
    void dropsClosedClients() {
        SseEmitter closed = broadcaster.subscribe(null);
        broadcaster.subscribe(null);
        closed.complete();

        broadcaster.broadcast(List.of("task-1"), "agent:heartbeat", Map.of("taskId", "1"));

        assertEquals(1, broadcaster.clientCount());
    }

    @Test
    @DisplayName("clients on other channels are not sent to")
    void channelFilter() {
        SseEmitter other = broadcaster.subscribe("task-2");
        other.complete();

        broadcaster.broadcast(List.of("task-1"), "agent:heartbeat", Map.of("taskId", "1"));
        assertEquals(1, broadcaster.clientCount());

        broadcaster.broadcast(List.of("task-2"), "agent:heartbeat", Map.of("taskId", "2"));
        assertEquals(0, broadcaster.clientCount());
    }

    @Test
    @DisplayName("shutdown completes and forgets every client")
    void shutdown() {
        broadcaster.startHeartbeat();
        broadcaster.subscribe(null);

        broadcaster.stopHeartbeat();

        assertEquals(0, broadcaster.clientCount());
    }
}
