package com.github.dimitryivaniuta.content.publishing.service.scheduler;

import com.github.dimitryivaniuta.content.publishing.domain.Post;
import com.github.dimitryivaniuta.content.publishing.domain.PostStatus;
import com.github.dimitryivaniuta.content.publishing.service.PostLifecycleService;
import com.github.dimitryivaniuta.content.publishing.service.publishing.PostPublisher;
import com.github.dimitryivaniuta.content.publishing.service.publishing.PublishException;
import com.github.dimitryivaniuta.content.publishing.service.publishing.PublishReceipt;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Publishes a post this instance has claimed and records the outcome.
 *
 * <p>Called outside any database transaction. The outcome goes back through
 * {@link PostLifecycleService} as PUBLISH_SUCCESS or PUBLISH_FAILED.</p>
 */
@Component
public class ClaimedPostPublisher {

    private static final Logger log = LoggerFactory.getLogger(ClaimedPostPublisher.class);

    private final PostPublisher publisher;
    private final PostLifecycleService lifecycleService;

    private final Counter publishedCounter;
    private final Counter failedCounter;

    public ClaimedPostPublisher(PostPublisher publisher, PostLifecycleService lifecycleService, MeterRegistry meterRegistry) {
        this.publisher = publisher;
        this.lifecycleService = lifecycleService;
        this.publishedCounter = Counter.builder("posts.scheduler.published").register(meterRegistry);
        this.failedCounter = Counter.builder("posts.scheduler.failed").register(meterRegistry);
    }

    /**
     * Runs the external call for a claimed post.
     *
     * @param claimed post in PUBLISHING, as re-read by the claim
     * @return the post after its outcome was recorded
     * @throws IllegalStateException if the post is not claimed
     */
    public Post publish(Post claimed) {
        if (claimed.getStatus() != PostStatus.PUBLISHING) {
            throw new IllegalStateException("Post " + claimed.getId() + " is " + claimed.getStatus() + ", not claimed");
        }

        PublishReceipt receipt;
        try {
            receipt = publisher.publish(claimed);
        } catch (PublishException ex) {
            failedCounter.increment();
            log.warn("Publication failed. platform={} kind={} error={}", claimed.getPlatform(), ex.getKind(), ex.getMessage());
            return lifecycleService.publishFailed(claimed.getId(), ex.describe());
        }

        Post published = lifecycleService.publishSucceeded(claimed.getId(), receipt.externalPostId());
        publishedCounter.increment();
        log.info("Published. platform={} externalId={}", claimed.getPlatform(), receipt.externalPostId());
        return published;
    }
}
