package com.github.dimitryivaniuta.content.publishing.domain.lifecycle;

import com.github.dimitryivaniuta.content.publishing.domain.PostStatus;
import java.util.Objects;

/**
 * The part of a post the transition engine decides on.
 *
 * @param status current status
 * @param retryCount failed publication attempts so far
 * @param approvedBy current approver, if any
 * @param rejectedBy current rejecter, if any
 */
public record PostState(PostStatus status, int retryCount, String approvedBy, String rejectedBy) {

    public PostState {
        Objects.requireNonNull(status, "status");
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0");
        }
    }

    /**
     * State of a fresh post with no provenance.
     *
     * @param status status
     * @return state
     */
    public static PostState of(PostStatus status) {
        return new PostState(status, 0, null, null);
    }
}
