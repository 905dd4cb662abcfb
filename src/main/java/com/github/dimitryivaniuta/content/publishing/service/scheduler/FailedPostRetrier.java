package com.github.dimitryivaniuta.content.publishing.service.scheduler;

import com.github.dimitryivaniuta.content.publishing.config.AppProperties;
import com.github.dimitryivaniuta.content.publishing.domain.Post;
import com.github.dimitryivaniuta.content.publishing.domain.PostStatus;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.RetryPolicy;
import com.github.dimitryivaniuta.content.publishing.repo.PostRepository;
import com.github.dimitryivaniuta.content.publishing.service.PostLifecycleService;
import com.github.dimitryivaniuta.content.publishing.service.publishing.PublishFailureKind;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Optional automatic RETRY of FAILED posts still under the retry cap.
 *
 * <p>Off unless {@code app.scheduler.auto-retry-enabled=true}. A retried post keeps its past
 * scheduled time, so the next scan picks it up right away. Failures recorded by
 * {@link StalePublishingReconciler} are skipped: the platform may already show those posts.</p>
 */
@Slf4j
@Component
public class FailedPostRetrier {

    private final PostRepository postRepository;
    private final PostLifecycleService lifecycleService;
    private final RetryPolicy retryPolicy;
    private final AppProperties properties;
    private final Clock clock;

    public FailedPostRetrier(
            PostRepository postRepository,
            PostLifecycleService lifecycleService,
            RetryPolicy retryPolicy,
            AppProperties properties,
            Clock clock
    ) {
        this.postRepository = postRepository;
        this.lifecycleService = lifecycleService;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${app.scheduler.auto-retry-interval-ms:300000}",
            initialDelayString = "${app.scheduler.auto-retry-interval-ms:300000}"
    )
    public void scheduledRun() {
        if (!properties.getScheduler().isAutoRetryEnabled()) {
            return;
        }
        try {
            retryDue(clock.instant());
        } catch (DataAccessException ex) {
            log.error("Retry-candidate query failed; will retry next interval", ex);
        }
    }

    /**
     * Retries FAILED posts whose last attempt is at least {@code auto-retry-delay} old.
     *
     * @param now reference time
     * @return number of posts moved back to SCHEDULED
     */
    public int retryDue(Instant now) {
        List<Post> candidates = postRepository.findRetryCandidates(
                PostStatus.FAILED,
                retryPolicy.maxRetries(),
                now.minus(properties.getScheduler().getAutoRetryDelay()),
                PublishFailureKind.OUTCOME_UNKNOWN.errorPrefix() + "%",
                PageRequest.of(0, properties.getScheduler().getBatchSize()));

        int retried = 0;
        for (Post post : candidates) {
            try {
                lifecycleService.retry(post.getId());
                retried++;
                log.info("Auto-retry scheduled. postId={} attempt={}", post.getId(), post.getRetryCount() + 1);
            } catch (RuntimeException ex) {
                log.warn("Auto-retry skipped. postId={} error={}", post.getId(), ex.getMessage());
            }
        }
        return retried;
    }
}
