package com.fleetwarden.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Canonical status of a task, shared by the local store and the external board.
 */
public enum TaskStatus {
    DRAFT("draft"),
    TODO("todo"),
    INPROGRESS("inprogress"),
    INREVIEW("inreview"),
    DONE("done"),
    CANCELLED("cancelled"),
    BLOCKED("blocked");

    /** Backend spellings (kanban tools, GitHub issue state, Jira-style names) to canonical status. */
    private static final Map<String, TaskStatus> ALIASES = Map.ofEntries(
            Map.entry("todo", TODO),
            Map.entry("draft", DRAFT),
            Map.entry("inprogress", INPROGRESS),
            Map.entry("started", INPROGRESS),
            Map.entry("in-progress", INPROGRESS),
            Map.entry("in_progress", INPROGRESS),
            Map.entry("in progress", INPROGRESS),
            Map.entry("inreview", INREVIEW),
            Map.entry("in-review", INREVIEW),
            Map.entry("in_review", INREVIEW),
            Map.entry("in review", INREVIEW),
            Map.entry("review", INREVIEW),
            Map.entry("blocked", BLOCKED),
            Map.entry("done", DONE),
            Map.entry("resolved", DONE),
            Map.entry("closed", DONE),
            Map.entry("cancelled", CANCELLED),
            Map.entry("canceled", CANCELLED),
            Map.entry("backlog", TODO),
            Map.entry("open", TODO),
            Map.entry("to do", TODO)
    );

    /** Labels that carry a status when found on an issue. */
    private static final Set<String> STATUS_LABELS = Set.of(
            "draft", "todo", "backlog", "inprogress", "started", "in-progress", "in_progress",
            "inreview", "in-review", "in_review", "blocked"
    );

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Maps any backend status spelling to a canonical status. Unknown or blank input is {@link #TODO}.
     */
    @JsonCreator
    public static TaskStatus normalise(String raw) {
        if (raw == null || raw.isBlank()) {
            return TODO;
        }
        return ALIASES.getOrDefault(raw.trim().toLowerCase(), TODO);
    }

    /**
     * Returns the status named by the first status label in the list, or {@code null} when none is present.
     */
    public static TaskStatus fromLabels(List<String> labels) {
        if (labels == null) {
            return null;
        }
        for (String label : labels) {
            String key = label == null ? "" : label.trim().toLowerCase();
            if (STATUS_LABELS.contains(key)) {
                return normalise(key);
            }
        }
        return null;
    }

    public boolean isTerminal() {
        return this == DONE || this == CANCELLED;
    }
}
