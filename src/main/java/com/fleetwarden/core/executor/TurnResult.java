package com.fleetwarden.core.executor;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one agent turn.
 *
 * @param finalResponse the agent's last message, or a status line when the turn did not run
 * @param items         executor-specific turn items (tool calls, messages)
 * @param usage         token usage as reported by the executor, empty when unknown
 * @param sessionId     session the turn ran in, {@code null} when the executor has none
 */
public record TurnResult(String finalResponse, List<Map<String, Object>> items, Map<String, Object> usage,
                         String sessionId) {

    public TurnResult {
        items = items == null ? List.of() : List.copyOf(items);
        usage = usage == null ? Map.of() : Map.copyOf(usage);
    }

    /** A turn that produced only a status line. */
    public static TurnResult message(String finalResponse) {
        return new TurnResult(finalResponse, List.of(), Map.of(), null);
    }
}
