package com.github.dimitryivaniuta.content.publishing.service;

import com.github.dimitryivaniuta.content.publishing.domain.Post;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.InvalidTransitionException;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.LifecycleEvent;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.PostCommand;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.PostTransitionEngine;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.TransitionDecision;
import com.github.dimitryivaniuta.content.publishing.repo.PostRepository;
import com.github.dimitryivaniuta.content.publishing.service.events.PostEventPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The only place where lifecycle decisions are turned into writes.
 *
 * <p>Per command, in one transaction: load the post, ask {@link PostTransitionEngine} for a
 * decision, write the new status and fields once (version-checked), and append the lifecycle
 * events to the outbox. A refused command leaves the row as it was; only a
 * {@code post.transition.invalid} outbox row is committed.</p>
 */
@Service
public class PostLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(PostLifecycleService.class);

    private final PostRepository postRepository;
    private final PostTransitionEngine engine;
    private final PostEventPublisher eventPublisher;
    private final PostCacheService cacheService;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Counter invalidCounter;

    public PostLifecycleService(
            PostRepository postRepository,
            PostTransitionEngine engine,
            PostEventPublisher eventPublisher,
            PostCacheService cacheService,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.postRepository = postRepository;
        this.engine = engine;
        this.eventPublisher = eventPublisher;
        this.cacheService = cacheService;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        this.invalidCounter = Counter.builder("posts.lifecycle.invalid").register(meterRegistry);
    }

    /**
     * Applies a command to a post.
     *
     * @param postId post id
     * @param command event and payload
     * @return the post after the transition (status DELETED for a delete)
     * @throws PostNotFoundException if the post does not exist
     * @throws InvalidTransitionException if the lifecycle refuses the event
     * @throws ConcurrentPostModificationException if the row changed while the command ran
     */
    @Transactional(noRollbackFor = InvalidTransitionException.class)
    public Post execute(String postId, PostCommand command) {
        Instant now = clock.instant();
        Post post = postRepository.findById(postId).orElseThrow(() -> new PostNotFoundException(postId));

        TransitionDecision decision;
        try {
            decision = engine.apply(post.lifecycleState(), command.withOccurredAtIfMissing(now));
        } catch (InvalidTransitionException ex) {
            eventPublisher.transitionRejected(post, ex, now);
            invalidCounter.increment();
            log.info("Transition refused. postId={} event={} status={} guard={}",
                    postId, ex.getEvent(), ex.getCurrentStatus(), ex.getGuardReason());
            throw ex;
        }

        if (decision.event() == LifecycleEvent.DELETE) {
            if (postRepository.deleteIfUnchanged(postId, post.getVersion()) == 0) {
                throw new ConcurrentPostModificationException(postId);
            }
            // detached after the bulk delete; the snapshot is what callers get back
            post.applyTransition(decision, now);
        } else {
            post.applyTransition(decision, now);
            postRepository.saveAndFlush(post);
        }

        eventPublisher.transitionApplied(post, decision, now);
        cacheService.evict(postId);

        meterRegistry.counter("posts.lifecycle.transitions", "event", decision.event().name()).increment();
        log.info("Post transitioned. postId={} event={} {} -> {}", postId, decision.event(), decision.from(), decision.to());
        return post;
    }

    @Transactional(noRollbackFor = InvalidTransitionException.class)
    public Post submitForReview(String postId) {
        return execute(postId, PostCommand.submitForReview());
    }

    @Transactional(noRollbackFor = InvalidTransitionException.class)
    public Post approve(String postId, String approvedBy) {
        return execute(postId, PostCommand.approve(approvedBy));
    }

    @Transactional(noRollbackFor = InvalidTransitionException.class)
    public Post reject(String postId, String rejectedBy, String reason) {
        return execute(postId, PostCommand.reject(rejectedBy, reason));
    }

    /**
     * Schedules an approved post.
     *
     * @param postId post id
     * @param scheduledTime publication time, must not be in the past
     * @param platform target platform
     * @return scheduled post
     */
    @Transactional(noRollbackFor = InvalidTransitionException.class)
    public Post schedule(String postId, Instant scheduledTime, String platform) {
        if (scheduledTime == null) {
            throw new IllegalArgumentException("scheduledTime is required");
        }
        if (scheduledTime.isBefore(clock.instant())) {
            throw new IllegalArgumentException("scheduledTime " + scheduledTime + " is in the past");
        }
        return execute(postId, PostCommand.schedule(scheduledTime, platform));
    }

    /**
     * Schedules an approved post at the current instant, so it is due immediately.
     *
     * @param postId post id
     * @param platform target platform; the post's own when null or blank
     * @return scheduled post
     */
    @Transactional(noRollbackFor = InvalidTransitionException.class)
    public Post scheduleNow(String postId, String platform) {
        Post post = postRepository.findById(postId).orElseThrow(() -> new PostNotFoundException(postId));
        String target = platform == null || platform.isBlank() ? post.getPlatform() : platform;
        return execute(postId, PostCommand.schedule(clock.instant(), target));
    }

    @Transactional(noRollbackFor = InvalidTransitionException.class)
    public Post unschedule(String postId) {
        return execute(postId, PostCommand.unschedule());
    }

    @Transactional(noRollbackFor = InvalidTransitionException.class)
    public Post publishSucceeded(String postId, String externalPostId) {
        return execute(postId, PostCommand.publishSucceeded(externalPostId, clock.instant()));
    }

    @Transactional(noRollbackFor = InvalidTransitionException.class)
    public Post publishFailed(String postId, String error) {
        return execute(postId, PostCommand.publishFailed(error));
    }

    @Transactional(noRollbackFor = InvalidTransitionException.class)
    public Post retry(String postId) {
        return execute(postId, PostCommand.retry());
    }

    @Transactional(noRollbackFor = InvalidTransitionException.class)
    public Post archive(String postId, String reason) {
        return execute(postId, PostCommand.archive(reason));
    }

    @Transactional(noRollbackFor = InvalidTransitionException.class)
    public Post edit(String postId, String content) {
        return execute(postId, PostCommand.edit(content));
    }

    @Transactional(noRollbackFor = InvalidTransitionException.class)
    public Post delete(String postId) {
        return execute(postId, PostCommand.delete());
    }
}
