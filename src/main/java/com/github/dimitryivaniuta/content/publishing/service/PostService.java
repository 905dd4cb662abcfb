package com.github.dimitryivaniuta.content.publishing.service;

import static com.github.dimitryivaniuta.content.publishing.config.CacheConfig.POST_CACHE;

import com.github.dimitryivaniuta.content.publishing.domain.Post;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.LifecycleEvent;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.PostState;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.PostTransitionEngine;
import com.github.dimitryivaniuta.content.publishing.repo.PostRepository;
import com.github.dimitryivaniuta.content.publishing.service.dto.AllowedTransitions;
import com.github.dimitryivaniuta.content.publishing.service.dto.PostView;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.EnumSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Draft creation and reads.
 *
 * <p>Drafts are the entry point used by content producers; every later change goes through
 * {@link PostLifecycleService}.</p>
 */
@Service
public class PostService {

    private static final Logger log = LoggerFactory.getLogger(PostService.class);

    private final PostRepository postRepository;
    private final PostTransitionEngine engine;
    private final Clock clock;
    private final Counter draftCounter;

    public PostService(PostRepository postRepository, PostTransitionEngine engine, Clock clock, MeterRegistry meterRegistry) {
        this.postRepository = postRepository;
        this.engine = engine;
        this.clock = clock;
        this.draftCounter = Counter.builder("posts.lifecycle.drafts").register(meterRegistry);
    }

    /**
     * Stores a new DRAFT post.
     *
     * @param platform target platform
     * @param content text to publish
     * @return created post
     */
    @Transactional
    public PostView createDraft(String platform, String content) {
        if (platform == null || platform.isBlank()) {
            throw new IllegalArgumentException("platform must not be blank");
        }
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("content must not be blank");
        }
        Post post = postRepository.save(Post.draft(platform.trim(), content, clock.instant()));
        draftCounter.increment();
        log.info("Draft created. postId={} platform={}", post.getId(), post.getPlatform());
        return PostView.from(post);
    }

    /**
     * Loads a post snapshot; served from the cache when present.
     *
     * @param postId post id
     * @return snapshot
     * @throws PostNotFoundException if the post does not exist
     */
    @Cacheable(cacheNames = POST_CACHE, key = "#postId")
    @Transactional(readOnly = true)
    public PostView getPost(String postId) {
        return postRepository.findById(postId)
                .map(PostView::from)
                .orElseThrow(() -> new PostNotFoundException(postId));
    }

    /**
     * Events the post would accept right now, the retry cap included.
     *
     * @param postId post id
     * @return current status and accepted events
     */
    @Transactional(readOnly = true)
    public AllowedTransitions allowedTransitions(String postId) {
        Post post = postRepository.findById(postId).orElseThrow(() -> new PostNotFoundException(postId));
        PostState state = post.lifecycleState();

        Set<LifecycleEvent> events = EnumSet.noneOf(LifecycleEvent.class);
        for (LifecycleEvent event : engine.allowedEvents(state.status())) {
            if (engine.canApply(state, event)) {
                events.add(event);
            }
        }
        return new AllowedTransitions(post.getId(), post.getStatus(), events);
    }
}
