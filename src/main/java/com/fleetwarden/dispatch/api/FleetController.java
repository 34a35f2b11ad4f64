package com.fleetwarden.dispatch.api;

import com.fleetwarden.core.classifier.ErrorPattern;
import com.fleetwarden.core.events.AgentEvent;
import com.fleetwarden.core.events.AgentEventBus;
import com.fleetwarden.core.events.AgentEventType;
import com.fleetwarden.core.events.BusStatus;
import com.fleetwarden.core.events.ErrorHistoryEntry;
import com.fleetwarden.core.events.EventLogFilter;
import com.fleetwarden.core.events.LivenessRecord;
import com.fleetwarden.core.events.PatternSummary;
import com.fleetwarden.core.sync.ReconciliationEngine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read access to the supervisor's event log, liveness and error history, plus agent heartbeats.
 */
@RestController
@RequestMapping("/api/v1/fleet")
public class FleetController {

    private final AgentEventBus eventBus;
    private final SseBroadcaster broadcaster;
    private final ReconciliationEngine reconciliationEngine;

    public FleetController(AgentEventBus eventBus, SseBroadcaster broadcaster,
                           @Autowired(required = false) ReconciliationEngine reconciliationEngine) {
        this.eventBus = eventBus;
        this.broadcaster = broadcaster;
        this.reconciliationEngine = reconciliationEngine;
    }

    /**
     * GET /api/v1/fleet/status: bus state plus the outcome of the latest board sync.
     */
    @GetMapping("/status")
    public Map<String, Object> status() {
        BusStatus bus = eventBus.getStatus();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("bus", bus);
        result.put("sseClients", broadcaster.clientCount());
        if (reconciliationEngine != null) {
            reconciliationEngine.getLastSummary().ifPresent(summary -> result.put("lastSync", summary));
        }
        return result;
    }

    /**
     * GET /api/v1/fleet/events?taskId=&amp;type=&amp;since=&amp;limit=
     * <p>
     * {@code type} accepts the wire name ({@code auto:retry}) or the constant name; {@code since}
     * is an ISO-8601 instant. Newest events come first.
     */
    @GetMapping("/events")
    public ResponseEntity<List<AgentEvent>> events(@RequestParam(required = false) String taskId,
                                                   @RequestParam(required = false) String type,
                                                   @RequestParam(required = false) String since,
                                                   @RequestParam(defaultValue = "100") int limit) {
        AgentEventType eventType = null;
        if (type != null && !type.isBlank()) {
            eventType = AgentEventType.fromWireName(type);
            if (eventType == null) {
                return ResponseEntity.badRequest().build();
            }
        }
        Instant sinceInstant;
        try {
            sinceInstant = since == null || since.isBlank() ? null : Instant.parse(since);
        } catch (java.time.format.DateTimeParseException e) {
            return ResponseEntity.badRequest().build();
        }
        var filter = new EventLogFilter(taskId, eventType, sinceInstant, limit, true);
        return ResponseEntity.ok(eventBus.getEventLog(filter));
    }

    @GetMapping("/liveness")
    public List<LivenessRecord> liveness() {
        return eventBus.getAgentLiveness();
    }

    /** Pattern summaries keyed by wire name, e.g. {@code build_failure}. */
    @GetMapping("/errors/patterns")
    public Map<String, PatternSummary> errorPatterns() {
        Map<String, PatternSummary> result = new LinkedHashMap<>();
        for (Map.Entry<ErrorPattern, PatternSummary> entry : eventBus.getErrorPatternSummary().entrySet()) {
            result.put(entry.getKey().wireName(), entry.getValue());
        }
        return result;
    }

    @GetMapping("/errors/{taskId}")
    public List<ErrorHistoryEntry> errorHistory(@PathVariable String taskId) {
        return eventBus.getErrorHistory(taskId);
    }

    /**
     * POST /api/v1/fleet/agents/{taskId}/heartbeat: records an agent heartbeat.
     */
    @PostMapping("/agents/{taskId}/heartbeat")
    public ResponseEntity<Void> heartbeat(@PathVariable String taskId,
                                          @RequestBody(required = false) HeartbeatRequest request) {
        eventBus.onAgentHeartbeat(taskId, request != null ? request.message() : null);
        return ResponseEntity.accepted().build();
    }

    /**
     * GET /api/v1/fleet/stream?channel=: SSE stream of bus broadcasts.
     */
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(required = false) String channel) {
        return broadcaster.subscribe(channel);
    }
}
