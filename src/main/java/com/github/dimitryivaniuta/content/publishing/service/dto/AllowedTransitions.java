package com.github.dimitryivaniuta.content.publishing.service.dto;

import com.github.dimitryivaniuta.content.publishing.domain.PostStatus;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.LifecycleEvent;
import java.util.Set;

/**
 * Events a post currently accepts, guards included.
 *
 * @param postId post id
 * @param status current status
 * @param events events that would be accepted now
 */
public record AllowedTransitions(String postId, PostStatus status, Set<LifecycleEvent> events) {}
