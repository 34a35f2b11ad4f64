package com.fleetwarden.core.sync;

/**
 * Where task status is read from: issue labels only, or a project board on top of the issues.
 */
public enum ProjectMode {
    ISSUES,
    KANBAN;

    /** Case-insensitive parse; anything other than {@code kanban} is {@link #ISSUES}. */
    public static ProjectMode parse(String raw) {
        return raw != null && "kanban".equals(raw.trim().toLowerCase()) ? KANBAN : ISSUES;
    }
}
