package com.fleetwarden.core.sync;

import com.fleetwarden.core.model.SharedState;
import com.fleetwarden.core.model.TaskStatus;

import java.util.List;
import java.util.Optional;

/**
 * Operations reconciliation needs from the external board.
 * <p>
 * Implementations throw {@link GhCommandException} or {@link BoardBackoffException} for failed
 * calls; malformed listings are returned as empty lists after a warning.
 */
public interface BoardAdapter {

    enum IssueState { OPEN, CLOSED }

    enum PullRequestState { OPEN, MERGED }

    /** In-scope issues in the given state. */
    List<BoardIssue> listIssues(IssueState state);

    List<PullRequestRef> listPullRequests(PullRequestState state);

    /** Issue cards on a project board. */
    List<BoardItem> listProjectItems(String boardId);

    /** The issue, or empty when the board reports it does not exist. */
    Optional<BoardIssue> getIssue(String issueNumber);

    /** Moves an issue to a status, opening or closing it as needed. */
    void updateTaskStatus(String issueNumber, TaskStatus status);

    void addComment(String issueNumber, String body);

    /** Latest complete claim recorded on the issue. */
    Optional<SharedState> readSharedState(String issueNumber);

    /** Writes the claim comment and the matching claim label. */
    boolean persistSharedState(String issueNumber, SharedState state);

    /** Excludes an issue from automation and explains why in a comment. */
    void markTaskIgnored(String issueNumber, String reason);
}
