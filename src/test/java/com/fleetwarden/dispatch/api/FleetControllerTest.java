package com.fleetwarden.dispatch.api;

import com.fleetwarden.core.classifier.ErrorPattern;
import com.fleetwarden.core.classifier.RecoveryAction;
import com.fleetwarden.core.events.AgentEvent;
import com.fleetwarden.core.events.AgentEventBus;
import com.fleetwarden.core.events.AgentEventType;
import com.fleetwarden.core.events.BusStatus;
import com.fleetwarden.core.events.ErrorHistoryEntry;
import com.fleetwarden.core.events.EventLogFilter;
import com.fleetwarden.core.events.LivenessRecord;
import com.fleetwarden.core.events.PatternSummary;
import com.fleetwarden.core.sync.ReconcileSummary;
import com.fleetwarden.core.sync.ReconciliationEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(FleetController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class FleetControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AgentEventBus eventBus;

    @MockitoBean
    private SseBroadcaster broadcaster;

    @MockitoBean
    private ReconciliationEngine reconciliationEngine;

    // -- GET /status -------------------------------------------------------------

    @Test
    @DisplayName("GET /status reports the bus, SSE clients and the last sync")
    void statusEndpoint() throws Exception {
        when(eventBus.getStatus()).thenReturn(new BusStatus(true, 12, 2, 1, 0, 3, List.of(), Map.of()));
        when(broadcaster.clientCount()).thenReturn(4);
        when(reconciliationEngine.getLastSummary())
                .thenReturn(Optional.of(new ReconcileSummary("ok", 5, 0, 1, 0, 0, 2, 0, 1, 0, 120)));

        mockMvc.perform(get("/api/v1/fleet/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bus.started").value(true))
                .andExpect(jsonPath("$.bus.eventLogSize").value(12))
                .andExpect(jsonPath("$.sseClients").value(4))
                .andExpect(jsonPath("$.lastSync.status").value("ok"))
                .andExpect(jsonPath("$.lastSync.conflicts").value(1));
    }

    // -- GET /events -------------------------------------------------------------

    @Test
    @DisplayName("GET /events filters newest first")
    void events() throws Exception {
        var event = new AgentEvent(AgentEventType.AUTO_RETRY, "42", Map.of("attempt", 1),
                Instant.parse("2026-03-01T10:00:00Z"));
        when(eventBus.getEventLog(any())).thenReturn(List.of(event));

        mockMvc.perform(get("/api/v1/fleet/events")
                        .param("taskId", "42")
                        .param("type", "auto:retry")
                        .param("since", "2026-03-01T09:00:00Z")
                        .param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].type").value("auto:retry"))
                .andExpect(jsonPath("$[0].taskId").value("42"))
                .andExpect(jsonPath("$[0].payload.attempt").value(1));

        ArgumentCaptor<EventLogFilter> filter = ArgumentCaptor.forClass(EventLogFilter.class);
        verify(eventBus).getEventLog(filter.capture());
        assertEquals("42", filter.getValue().taskId());
        assertEquals(AgentEventType.AUTO_RETRY, filter.getValue().type());
        assertEquals(Instant.parse("2026-03-01T09:00:00Z"), filter.getValue().since());
        assertEquals(10, filter.getValue().limit());
        assertTrue(filter.getValue().newestFirst());
    }

    @Test
    @DisplayName("GET /events rejects an unknown type")
    void eventsUnknownType() throws Exception {
        mockMvc.perform(get("/api/v1/fleet/events").param("type", "agent:exploded"))
                .andExpect(status().isBadRequest());
        verify(eventBus, never()).getEventLog(any());
    }

    @Test
    @DisplayName("GET /events rejects a malformed since")
    void eventsBadSince() throws Exception {
        mockMvc.perform(get("/api/v1/fleet/events").param("since", "yesterday"))
                .andExpect(status().isBadRequest());
    }

    // -- Liveness and errors -------------------------------------------------------

    @Test
    @DisplayName("GET /liveness lists every tracked agent")
    void liveness() throws Exception {
        when(eventBus.getAgentLiveness()).thenReturn(List.of(
                new LivenessRecord("42", 1_000L, true, null),
                new LivenessRecord("43", 500L, false, 700_000L)));

        mockMvc.perform(get("/api/v1/fleet/liveness"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].alive").value(false))
                .andExpect(jsonPath("$[1].staleSinceMs").value(700_000));
    }

    @Test
    @DisplayName("GET /errors/patterns keys summaries by wire name")
    void errorPatterns() throws Exception {
        when(eventBus.getErrorPatternSummary())
                .thenReturn(Map.of(ErrorPattern.BUILD_FAILURE, new PatternSummary(2, 5_000L, List.of("42"))));

        mockMvc.perform(get("/api/v1/fleet/errors/patterns"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.build_failure.count").value(2))
                .andExpect(jsonPath("$.build_failure.tasks[0]").value("42"));
    }

    @Test
    @DisplayName("GET /errors/{taskId} returns the task's history")
    void errorHistory() throws Exception {
        when(eventBus.getErrorHistory("42")).thenReturn(List.of(
                new ErrorHistoryEntry(ErrorPattern.PUSH_FAILURE, 1_000L, RecoveryAction.RETRY_WITH_PROMPT, 0.85,
                        "git push rejected", "rejected main")));

        mockMvc.perform(get("/api/v1/fleet/errors/42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].pattern").value("push_failure"))
                .andExpect(jsonPath("$[0].action").value(RecoveryAction.RETRY_WITH_PROMPT.wireName()));
    }

    // -- Heartbeat and stream ------------------------------------------------------

    @Test
    @DisplayName("POST /agents/{taskId}/heartbeat records the heartbeat")
    void heartbeat() throws Exception {
        mockMvc.perform(post("/api/v1/fleet/agents/42/heartbeat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"compiling\"}"))
                .andExpect(status().isAccepted());

        verify(eventBus).onAgentHeartbeat("42", "compiling");
    }

    @Test
    @DisplayName("POST /agents/{taskId}/heartbeat accepts an empty body")
    void heartbeatWithoutBody() throws Exception {
        mockMvc.perform(post("/api/v1/fleet/agents/42/heartbeat"))
                .andExpect(status().isAccepted());

        verify(eventBus).onAgentHeartbeat(eq("42"), isNull());
    }

    @Test
    @DisplayName("GET /stream subscribes to the requested channel")
    void stream() throws Exception {
        when(broadcaster.subscribe("task-42")).thenReturn(new SseEmitter(1_000L));

        mockMvc.perform(get("/api/v1/fleet/stream").param("channel", "task-42"))
                .andExpect(status().isOk())
                .andExpect(request().asyncStarted());

        verify(broadcaster).subscribe("task-42");
    }
}
