package com.github.dimitryivaniuta.content.publishing.domain.lifecycle;

import java.time.Instant;
import java.util.Objects;

/**
 * A lifecycle event together with its payload.
 *
 * <p>Only the payload values relevant for {@link #event()} are read by the engine; use the
 * static factories to build well-formed commands.</p>
 *
 * @param event event to apply
 * @param actor approver or rejecter
 * @param reason rejection or archive reason
 * @param scheduledTime publication time for SCHEDULE
 * @param platform target platform for SCHEDULE
 * @param content replacement content for EDIT (null keeps the current content)
 * @param externalPostId platform id for PUBLISH_SUCCESS
 * @param error failure description for PUBLISH_FAILED
 * @param occurredAt when the outcome was observed, used for PUBLISH_SUCCESS
 */
public record PostCommand(
        LifecycleEvent event,
        String actor,
        String reason,
        Instant scheduledTime,
        String platform,
        String content,
        String externalPostId,
        String error,
        Instant occurredAt
) {

    public PostCommand {
        Objects.requireNonNull(event, "event");
    }

    /**
     * Command without payload.
     *
     * @param event event
     * @return command
     */
    public static PostCommand of(LifecycleEvent event) {
        return new PostCommand(event, null, null, null, null, null, null, null, null);
    }

    public static PostCommand submitForReview() {
        return of(LifecycleEvent.SUBMIT_FOR_REVIEW);
    }

    public static PostCommand approve(String approvedBy) {
        return new PostCommand(LifecycleEvent.APPROVE, approvedBy, null, null, null, null, null, null, null);
    }

    public static PostCommand reject(String rejectedBy, String reason) {
        return new PostCommand(LifecycleEvent.REJECT, rejectedBy, reason, null, null, null, null, null, null);
    }

    public static PostCommand schedule(Instant scheduledTime, String platform) {
        return new PostCommand(LifecycleEvent.SCHEDULE, null, null, scheduledTime, platform, null, null, null, null);
    }

    public static PostCommand unschedule() {
        return of(LifecycleEvent.UNSCHEDULE);
    }

    public static PostCommand publishSucceeded(String externalPostId, Instant publishedAt) {
        return new PostCommand(LifecycleEvent.PUBLISH_SUCCESS, null, null, null, null, null, externalPostId, null, publishedAt);
    }

    public static PostCommand publishFailed(String error) {
        return new PostCommand(LifecycleEvent.PUBLISH_FAILED, null, null, null, null, null, null, error, null);
    }

    public static PostCommand retry() {
        return of(LifecycleEvent.RETRY);
    }

    public static PostCommand archive(String reason) {
        return new PostCommand(LifecycleEvent.ARCHIVE, null, reason, null, null, null, null, null, null);
    }

    public static PostCommand edit(String content) {
        return new PostCommand(LifecycleEvent.EDIT, null, null, null, null, content, null, null, null);
    }

    public static PostCommand delete() {
        return of(LifecycleEvent.DELETE);
    }

    /**
     * Copy with {@code occurredAt} filled in when the caller left it empty.
     *
     * @param now fallback time
     * @return command with an observation time
     */
    public PostCommand withOccurredAtIfMissing(Instant now) {
        if (occurredAt != null) {
            return this;
        }
        return new PostCommand(event, actor, reason, scheduledTime, platform, content, externalPostId, error, now);
    }
}
