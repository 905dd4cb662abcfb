package com.github.dimitryivaniuta.content.publishing.domain.lifecycle;

import com.github.dimitryivaniuta.content.publishing.domain.PostStatus;

/**
 * Accepted transition: the new status plus the field updates to persist with it.
 *
 * @param from status the decision was made on
 * @param event applied event
 * @param to resulting status
 * @param changes field updates
 */
public record TransitionDecision(PostStatus from, LifecycleEvent event, PostStatus to, PostChanges changes) {
}
