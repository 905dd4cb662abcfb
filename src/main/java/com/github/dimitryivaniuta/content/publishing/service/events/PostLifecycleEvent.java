package com.github.dimitryivaniuta.content.publishing.service.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;

/**
 * Payload of every lifecycle event.
 *
 * <p>Stored in the outbox and later published to Kafka keyed by {@code postId}. Fields that do not
 * apply to an event type are omitted from the JSON.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PostLifecycleEvent(
        String schemaVersion,
        String eventId,
        String eventType,
        Instant occurredAt,
        String postId,
        String platform,
        String lifecycleEvent,
        String fromStatus,
        String toStatus,
        Integer retryCount,
        String actor,
        String reason,
        String externalPostId,
        String error,
        List<String> allowedEvents
) {}
