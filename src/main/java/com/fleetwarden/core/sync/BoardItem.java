package com.fleetwarden.core.sync;

import com.fleetwarden.core.model.TaskStatus;

/**
 * An issue's card on a project board.
 *
 * @param rawStatus the board column as written, before normalisation
 */
public record BoardItem(String issueNumber, String itemId, String title, TaskStatus status, String rawStatus) {}
