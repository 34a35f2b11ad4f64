package com.fleetwarden.core.sync;

import com.fleetwarden.core.model.TaskStatus;

import java.util.List;

/**
 * An issue as listed by the board.
 *
 * @param number issue number
 * @param state  {@code OPEN} or {@code CLOSED}, as GitHub reports it
 * @param labels lower-cased label names
 */
public record BoardIssue(String number, String title, String state, List<String> labels, String url, String body) {

    public BoardIssue {
        labels = labels == null ? List.of() : labels.stream().map(l -> l.trim().toLowerCase()).toList();
    }

    public boolean isOpen() {
        return !"closed".equalsIgnoreCase(state);
    }

    /**
     * Closed issues are done; open ones take their status label, default todo.
     */
    public TaskStatus status() {
        if (!isOpen()) {
            return TaskStatus.DONE;
        }
        TaskStatus fromLabels = TaskStatus.fromLabels(labels);
        return fromLabels != null ? fromLabels : TaskStatus.TODO;
    }

    public boolean hasAnyLabel(List<String> candidates) {
        return candidates.stream().anyMatch(labels::contains);
    }
}
