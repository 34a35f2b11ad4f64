package com.fleetwarden.core.events;

/**
 * Queues a finished task for automated code review.
 */
public interface ReviewHandoff {

    void requestReview(ReviewRequest request);

    /**
     * @param taskId      task under review
     * @param title       task title
     * @param prNumber    pull request number, may be {@code null}
     * @param branch      branch carrying the commits, may be {@code null}
     * @param description task description
     */
    record ReviewRequest(String taskId, String title, Integer prNumber, String branch, String description) {}
}
