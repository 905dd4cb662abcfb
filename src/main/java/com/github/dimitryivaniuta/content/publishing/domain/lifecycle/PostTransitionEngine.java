package com.github.dimitryivaniuta.content.publishing.domain.lifecycle;

import com.github.dimitryivaniuta.content.publishing.domain.PostStatus;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Pure decision function of the post lifecycle.
 *
 * <p>Maps (current state, command) to the new status plus the field updates to persist, or rejects
 * the command with {@link InvalidTransitionException}. No clock, no I/O: the same inputs always
 * give the same decision, so callers own persistence and time.</p>
 *
 * <p>Evaluation order:
 * <ol>
 *   <li>table lookup (status × event), rejection lists the legal events;</li>
 *   <li>guards registered for the event (e.g. the retry cap);</li>
 *   <li>payload validation ({@link IllegalArgumentException} for missing required values);</li>
 *   <li>side effects as {@link PostChanges}.</li>
 * </ol>
 */
public class PostTransitionEngine {

    static final String DEFAULT_ACTOR = "system";
    static final String DEFAULT_REJECTION_REASON = "Rejected during review";
    static final String DEFAULT_ARCHIVE_REASON = "Post archived";

    private final Map<LifecycleEvent, TransitionGuard> guards;

    /**
     * Creates the engine with the retry cap as the only guard.
     *
     * @param retryPolicy retry guard for RETRY
     */
    public PostTransitionEngine(RetryPolicy retryPolicy) {
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.guards = new EnumMap<>(LifecycleEvent.class);
        this.guards.put(LifecycleEvent.RETRY, retryPolicy);
    }

    /**
     * Decides a transition.
     *
     * @param current current state of the post
     * @param command event and payload
     * @return accepted decision
     * @throws InvalidTransitionException when the event is not legal or a guard refuses it
     * @throws IllegalArgumentException when a required payload value is missing
     */
    public TransitionDecision apply(PostState current, PostCommand command) {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(command, "command");

        PostStatus from = current.status();
        LifecycleEvent event = command.event();

        PostStatus to = TransitionTable.target(from, event)
                .orElseThrow(() -> new InvalidTransitionException(from, event, allowedEvents(from), null));

        TransitionGuard guard = guards.get(event);
        if (guard != null) {
            Optional<String> refusal = guard.check(current);
            if (refusal.isPresent()) {
                throw new InvalidTransitionException(from, event, allowedEvents(from), refusal.get());
            }
        }

        return new TransitionDecision(from, event, to, sideEffects(current, command));
    }

    /**
     * Returns true when {@link #apply} would accept the command's event for the state.
     *
     * @param current state
     * @param event event
     * @return true if the table allows it and its guards pass
     */
    public boolean canApply(PostState current, LifecycleEvent event) {
        if (TransitionTable.target(current.status(), event).isEmpty()) {
            return false;
        }
        TransitionGuard guard = guards.get(event);
        return guard == null || guard.check(current).isEmpty();
    }

    /**
     * Events legal from a status, guards not evaluated.
     *
     * @param status status
     * @return legal events
     */
    public Set<LifecycleEvent> allowedEvents(PostStatus status) {
        return TransitionTable.allowedEvents(status);
    }

    private PostChanges sideEffects(PostState current, PostCommand command) {
        PostChanges.Builder changes = PostChanges.builder();

        switch (command.event()) {
            case APPROVE -> changes
                    .set(PostField.APPROVED_BY, orDefault(command.actor(), DEFAULT_ACTOR))
                    .clear(PostField.REJECTED_BY)
                    .clear(PostField.REJECTED_REASON);
            case REJECT -> changes
                    .set(PostField.REJECTED_BY, orDefault(command.actor(), DEFAULT_ACTOR))
                    .set(PostField.REJECTED_REASON, orDefault(command.reason(), DEFAULT_REJECTION_REASON))
                    .clear(PostField.APPROVED_BY);
            case SCHEDULE -> {
                if (command.scheduledTime() == null) {
                    throw new IllegalArgumentException("SCHEDULE requires a scheduled time");
                }
                if (isBlank(command.platform())) {
                    throw new IllegalArgumentException("SCHEDULE requires a platform");
                }
                changes.set(PostField.SCHEDULED_TIME, command.scheduledTime())
                        .set(PostField.PLATFORM, command.platform().trim());
            }
            case UNSCHEDULE -> changes.clear(PostField.SCHEDULED_TIME);
            case PUBLISH_SUCCESS -> {
                if (isBlank(command.externalPostId())) {
                    throw new IllegalArgumentException("PUBLISH_SUCCESS requires an external post id");
                }
                changes.set(PostField.EXTERNAL_POST_ID, command.externalPostId())
                        .set(PostField.PUBLISHED_AT, command.occurredAt())
                        .clear(PostField.LAST_ERROR)
                        .clear(PostField.SCHEDULED_TIME);
            }
            case PUBLISH_FAILED -> {
                if (isBlank(command.error())) {
                    throw new IllegalArgumentException("PUBLISH_FAILED requires an error message");
                }
                changes.set(PostField.LAST_ERROR, command.error())
                        .set(PostField.RETRY_COUNT, current.retryCount() + 1);
            }
            case ARCHIVE -> changes
                    .set(PostField.ARCHIVED_REASON, archivedReason(current, command.reason()))
                    .clear(PostField.SCHEDULED_TIME);
            case EDIT -> {
                if (command.content() != null) {
                    if (command.content().isBlank()) {
                        throw new IllegalArgumentException("EDIT content must not be blank");
                    }
                    changes.set(PostField.CONTENT, command.content());
                }
                // edited content voids the previous review and revives an archived post
                changes.clear(PostField.LAST_ERROR)
                        .clear(PostField.APPROVED_BY)
                        .clear(PostField.REJECTED_BY)
                        .clear(PostField.REJECTED_REASON)
                        .clear(PostField.ARCHIVED_REASON);
            }
            case SUBMIT_FOR_REVIEW, RETRY, DELETE -> {
                // status change only
            }
        }
        return changes.build();
    }

    private static String archivedReason(PostState current, String reason) {
        String base = orDefault(reason, DEFAULT_ARCHIVE_REASON);
        if (current.approvedBy() != null) {
            return base + " (was approved)";
        }
        if (current.rejectedBy() != null) {
            return base + " (was rejected)";
        }
        return base;
    }

    private static String orDefault(String value, String fallback) {
        return isBlank(value) ? fallback : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
