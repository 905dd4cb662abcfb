package com.github.dimitryivaniuta.content.publishing.domain;

/**
 * Lifecycle status of a {@link Post}, stored as a string in the database.
 */
public enum PostStatus {
    /** Created by the content-generation side, editable. */
    DRAFT,

    /** Waiting for a human review decision. */
    NEEDS_REVIEW,

    /** Approved by a reviewer, may be scheduled. */
    APPROVED,

    /** Rejected by a reviewer. */
    REJECTED,

    /** Waiting for its scheduled time. */
    SCHEDULED,

    /** Claimed by exactly one scheduler instance; the external call is in flight. */
    PUBLISHING,

    /** Accepted by the external platform. */
    PUBLISHED,

    /** Last publication attempt failed. */
    FAILED,

    /** Retired, may still be edited back to a draft. */
    ARCHIVED,

    /** Terminal. The row no longer exists once a post reaches this status. */
    DELETED;

    /**
     * Returns true when no lifecycle event is accepted anymore.
     *
     * @return true for {@link #DELETED}
     */
    public boolean isTerminal() {
        return this == DELETED;
    }
}
