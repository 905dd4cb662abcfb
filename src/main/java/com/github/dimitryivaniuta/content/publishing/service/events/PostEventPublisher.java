package com.github.dimitryivaniuta.content.publishing.service.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.content.publishing.domain.OutboxEvent;
import com.github.dimitryivaniuta.content.publishing.domain.Post;
import com.github.dimitryivaniuta.content.publishing.domain.PostEventType;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.InvalidTransitionException;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.LifecycleEvent;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.TransitionDecision;
import com.github.dimitryivaniuta.content.publishing.repo.OutboxEventRepository;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes lifecycle events to the outbox.
 *
 * <p>Propagation is MANDATORY: the caller owns the transaction, so the post row and its outbox
 * rows commit (or roll back) together. {@code OutboxDispatcher} relays them to Kafka later.</p>
 */
@Service
public class PostEventPublisher {

    static final String SCHEMA_VERSION = "1";

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    public PostEventPublisher(OutboxEventRepository outboxEventRepository, ObjectMapper objectMapper) {
        this.outboxEventRepository = outboxEventRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Records an accepted transition: always {@code post.state.changed}, plus the specific event
     * for approval, rejection and publication outcomes.
     *
     * @param post post after the transition was applied
     * @param decision accepted decision
     * @param occurredAt transition time
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void transitionApplied(Post post, TransitionDecision decision, Instant occurredAt) {
        write(post, PostEventType.STATE_CHANGED, stateChanged(post, decision, occurredAt), occurredAt);

        PostEventType specific = specificType(decision.event());
        if (specific != null) {
            write(post, specific, specificEvent(specific, post, decision, occurredAt), occurredAt);
        }
    }

    /**
     * Records a refused command. The post row itself is not touched.
     *
     * @param post post as loaded when the command was refused
     * @param ex refusal
     * @param occurredAt refusal time
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void transitionRejected(Post post, InvalidTransitionException ex, Instant occurredAt) {
        List<String> allowed = ex.getAllowedEvents().stream().map(Enum::name).toList();
        write(post, PostEventType.TRANSITION_INVALID, new PostLifecycleEvent(
                SCHEMA_VERSION,
                UUID.randomUUID().toString(),
                PostEventType.TRANSITION_INVALID.wireName(),
                occurredAt,
                post.getId(),
                post.getPlatform(),
                ex.getEvent().name(),
                ex.getCurrentStatus().name(),
                null,
                null,
                null,
                ex.getGuardReason(),
                null,
                null,
                allowed
        ), occurredAt);
    }

    private static PostEventType specificType(LifecycleEvent event) {
        return switch (event) {
            case APPROVE -> PostEventType.APPROVED;
            case REJECT -> PostEventType.REJECTED;
            case PUBLISH_SUCCESS -> PostEventType.PUBLISHED;
            case PUBLISH_FAILED -> PostEventType.PUBLICATION_FAILED;
            default -> null;
        };
    }

    private static PostLifecycleEvent stateChanged(Post post, TransitionDecision decision, Instant occurredAt) {
        return new PostLifecycleEvent(
                SCHEMA_VERSION,
                UUID.randomUUID().toString(),
                PostEventType.STATE_CHANGED.wireName(),
                occurredAt,
                post.getId(),
                post.getPlatform(),
                decision.event().name(),
                decision.from().name(),
                decision.to().name(),
                post.getRetryCount(),
                null,
                null,
                null,
                null,
                null
        );
    }

    private static PostLifecycleEvent specificEvent(PostEventType type, Post post, TransitionDecision decision, Instant occurredAt) {
        String actor = null;
        String reason = null;
        String externalPostId = null;
        String error = null;
        switch (type) {
            case APPROVED -> actor = post.getApprovedBy();
            case REJECTED -> {
                actor = post.getRejectedBy();
                reason = post.getRejectedReason();
            }
            case PUBLISHED -> externalPostId = post.getExternalPostId();
            case PUBLICATION_FAILED -> error = post.getLastError();
            default -> {
            }
        }
        return new PostLifecycleEvent(
                SCHEMA_VERSION,
                UUID.randomUUID().toString(),
                type.wireName(),
                occurredAt,
                post.getId(),
                post.getPlatform(),
                decision.event().name(),
                decision.from().name(),
                decision.to().name(),
                post.getRetryCount(),
                actor,
                reason,
                externalPostId,
                error,
                null
        );
    }

    private void write(Post post, PostEventType type, PostLifecycleEvent event, Instant occurredAt) {
        outboxEventRepository.save(OutboxEvent.pending(post.getId(), post.getVersion(), type, toJson(event), occurredAt));
    }

    private String toJson(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize outbox payload", e);
        }
    }
}
