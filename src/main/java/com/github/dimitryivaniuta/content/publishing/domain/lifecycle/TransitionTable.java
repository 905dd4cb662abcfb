package com.github.dimitryivaniuta.content.publishing.domain.lifecycle;

import static com.github.dimitryivaniuta.content.publishing.domain.PostStatus.APPROVED;
import static com.github.dimitryivaniuta.content.publishing.domain.PostStatus.ARCHIVED;
import static com.github.dimitryivaniuta.content.publishing.domain.PostStatus.DELETED;
import static com.github.dimitryivaniuta.content.publishing.domain.PostStatus.DRAFT;
import static com.github.dimitryivaniuta.content.publishing.domain.PostStatus.FAILED;
import static com.github.dimitryivaniuta.content.publishing.domain.PostStatus.NEEDS_REVIEW;
import static com.github.dimitryivaniuta.content.publishing.domain.PostStatus.PUBLISHED;
import static com.github.dimitryivaniuta.content.publishing.domain.PostStatus.PUBLISHING;
import static com.github.dimitryivaniuta.content.publishing.domain.PostStatus.REJECTED;
import static com.github.dimitryivaniuta.content.publishing.domain.PostStatus.SCHEDULED;
import static com.github.dimitryivaniuta.content.publishing.domain.lifecycle.LifecycleEvent.APPROVE;
import static com.github.dimitryivaniuta.content.publishing.domain.lifecycle.LifecycleEvent.ARCHIVE;
import static com.github.dimitryivaniuta.content.publishing.domain.lifecycle.LifecycleEvent.DELETE;
import static com.github.dimitryivaniuta.content.publishing.domain.lifecycle.LifecycleEvent.EDIT;
import static com.github.dimitryivaniuta.content.publishing.domain.lifecycle.LifecycleEvent.PUBLISH_FAILED;
import static com.github.dimitryivaniuta.content.publishing.domain.lifecycle.LifecycleEvent.PUBLISH_SUCCESS;
import static com.github.dimitryivaniuta.content.publishing.domain.lifecycle.LifecycleEvent.REJECT;
import static com.github.dimitryivaniuta.content.publishing.domain.lifecycle.LifecycleEvent.RETRY;
import static com.github.dimitryivaniuta.content.publishing.domain.lifecycle.LifecycleEvent.SCHEDULE;
import static com.github.dimitryivaniuta.content.publishing.domain.lifecycle.LifecycleEvent.SUBMIT_FOR_REVIEW;
import static com.github.dimitryivaniuta.content.publishing.domain.lifecycle.LifecycleEvent.UNSCHEDULE;

import com.github.dimitryivaniuta.content.publishing.domain.PostStatus;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static (status × event → status) table of the post lifecycle.
 *
 * <p>Happy path:</p>
 * <pre>
 * DRAFT → NEEDS_REVIEW → APPROVED → SCHEDULED → (claim) PUBLISHING → PUBLISHED
 * </pre>
 *
 * <p>The claim (SCHEDULED → PUBLISHING) is not an event: it is a conditional update owned by the
 * scheduler. PUBLISHING only accepts the two publication outcomes, so a claimed post cannot be
 * unscheduled, archived or deleted mid-flight.</p>
 */
public final class TransitionTable {

    private static final Map<PostStatus, Map<LifecycleEvent, PostStatus>> TABLE = build();

    private TransitionTable() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Looks up the target status.
     *
     * @param from current status
     * @param event event
     * @return target, or empty when the pair is not in the table
     */
    public static Optional<PostStatus> target(PostStatus from, LifecycleEvent event) {
        return Optional.ofNullable(TABLE.get(from).get(event));
    }

    /**
     * Events accepted (guards aside) from the given status.
     *
     * @param from status
     * @return read-only set, empty for terminal statuses
     */
    public static Set<LifecycleEvent> allowedEvents(PostStatus from) {
        Map<LifecycleEvent, PostStatus> row = TABLE.get(from);
        return row.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(row.keySet()));
    }

    private static Map<PostStatus, Map<LifecycleEvent, PostStatus>> build() {
        Map<PostStatus, Map<LifecycleEvent, PostStatus>> t = new EnumMap<>(PostStatus.class);
        for (PostStatus s : PostStatus.values()) {
            t.put(s, new EnumMap<>(LifecycleEvent.class));
        }

        t.get(DRAFT).put(SUBMIT_FOR_REVIEW, NEEDS_REVIEW);
        t.get(DRAFT).put(ARCHIVE, ARCHIVED);
        t.get(DRAFT).put(DELETE, DELETED);

        t.get(NEEDS_REVIEW).put(APPROVE, APPROVED);
        t.get(NEEDS_REVIEW).put(REJECT, REJECTED);
        t.get(NEEDS_REVIEW).put(EDIT, DRAFT);
        t.get(NEEDS_REVIEW).put(ARCHIVE, ARCHIVED);
        t.get(NEEDS_REVIEW).put(DELETE, DELETED);

        t.get(APPROVED).put(SCHEDULE, SCHEDULED);
        t.get(APPROVED).put(EDIT, NEEDS_REVIEW);
        t.get(APPROVED).put(ARCHIVE, ARCHIVED);
        t.get(APPROVED).put(DELETE, DELETED);

        t.get(REJECTED).put(EDIT, DRAFT);
        t.get(REJECTED).put(ARCHIVE, ARCHIVED);
        t.get(REJECTED).put(DELETE, DELETED);

        t.get(SCHEDULED).put(PUBLISH_SUCCESS, PUBLISHED);
        t.get(SCHEDULED).put(PUBLISH_FAILED, FAILED);
        t.get(SCHEDULED).put(UNSCHEDULE, APPROVED);
        t.get(SCHEDULED).put(ARCHIVE, ARCHIVED);
        t.get(SCHEDULED).put(DELETE, DELETED);

        t.get(PUBLISHING).put(PUBLISH_SUCCESS, PUBLISHED);
        t.get(PUBLISHING).put(PUBLISH_FAILED, FAILED);

        t.get(PUBLISHED).put(ARCHIVE, ARCHIVED);

        t.get(FAILED).put(RETRY, SCHEDULED);
        t.get(FAILED).put(UNSCHEDULE, APPROVED);
        t.get(FAILED).put(ARCHIVE, ARCHIVED);
        t.get(FAILED).put(DELETE, DELETED);

        t.get(ARCHIVED).put(EDIT, DRAFT);
        t.get(ARCHIVED).put(DELETE, DELETED);

        Map<PostStatus, Map<LifecycleEvent, PostStatus>> frozen = new EnumMap<>(PostStatus.class);
        t.forEach((status, row) -> frozen.put(status, Collections.unmodifiableMap(row)));
        return Collections.unmodifiableMap(frozen);
    }
}
