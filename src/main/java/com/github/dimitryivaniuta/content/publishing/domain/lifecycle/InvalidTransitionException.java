package com.github.dimitryivaniuta.content.publishing.domain.lifecycle;

import com.github.dimitryivaniuta.content.publishing.domain.PostStatus;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Raised when an event is not legal from the current status or a guard refuses it.
 *
 * <p>Always recoverable; nothing has been written when this is thrown.</p>
 */
public class InvalidTransitionException extends RuntimeException {

    private final PostStatus currentStatus;
    private final LifecycleEvent event;
    private final Set<LifecycleEvent> allowedEvents;
    private final String guardReason;

    public InvalidTransitionException(PostStatus currentStatus, LifecycleEvent event,
                                      Set<LifecycleEvent> allowedEvents, String guardReason) {
        super(buildMessage(currentStatus, event, allowedEvents, guardReason));
        this.currentStatus = currentStatus;
        this.event = event;
        this.allowedEvents = allowedEvents.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(allowedEvents));
        this.guardReason = guardReason;
    }

    public PostStatus getCurrentStatus() {
        return currentStatus;
    }

    public LifecycleEvent getEvent() {
        return event;
    }

    public Set<LifecycleEvent> getAllowedEvents() {
        return allowedEvents;
    }

    /**
     * @return the guard's reason, or null when the event is simply not in the table
     */
    public String getGuardReason() {
        return guardReason;
    }

    public boolean isGuardRejection() {
        return guardReason != null;
    }

    private static String buildMessage(PostStatus status, LifecycleEvent event,
                                       Set<LifecycleEvent> allowed, String guardReason) {
        String head = guardReason == null
                ? "Event " + event + " is not allowed for a post in status " + status
                : "Event " + event + " was refused for a post in status " + status + ": " + guardReason;
        return head + ". Allowed events: " + allowed;
    }
}
