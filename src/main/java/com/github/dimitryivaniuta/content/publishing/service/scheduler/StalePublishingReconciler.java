package com.github.dimitryivaniuta.content.publishing.service.scheduler;

import com.github.dimitryivaniuta.content.publishing.config.AppProperties;
import com.github.dimitryivaniuta.content.publishing.domain.Post;
import com.github.dimitryivaniuta.content.publishing.domain.PostStatus;
import com.github.dimitryivaniuta.content.publishing.repo.PostRepository;
import com.github.dimitryivaniuta.content.publishing.service.PostLifecycleService;
import com.github.dimitryivaniuta.content.publishing.service.publishing.PublishFailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fails posts stuck in PUBLISHING after a crash between claim and outcome.
 *
 * <p>The external call may or may not have happened, so the post is not re-queued: it goes to
 * FAILED with an {@link PublishFailureKind#OUTCOME_UNKNOWN} error (counting toward the retry cap).
 * {@link FailedPostRetrier} never picks such posts up; a human checks the platform and decides.</p>
 */
@Component
public class StalePublishingReconciler {

    private static final Logger log = LoggerFactory.getLogger(StalePublishingReconciler.class);

    private final PostRepository postRepository;
    private final PostLifecycleService lifecycleService;
    private final AppProperties properties;
    private final Clock clock;
    private final Counter reconciledCounter;

    public StalePublishingReconciler(
            PostRepository postRepository,
            PostLifecycleService lifecycleService,
            AppProperties properties,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.postRepository = postRepository;
        this.lifecycleService = lifecycleService;
        this.properties = properties;
        this.clock = clock;
        this.reconciledCounter = Counter.builder("posts.scheduler.stale_reconciled").register(meterRegistry);
    }

    @Scheduled(
            fixedDelayString = "${app.scheduler.reconcile-interval-ms:300000}",
            initialDelayString = "${app.scheduler.reconcile-interval-ms:300000}"
    )
    public void scheduledRun() {
        if (!properties.getScheduler().isReconcileEnabled()) {
            return;
        }
        try {
            reconcile(clock.instant());
        } catch (DataAccessException ex) {
            log.error("Stale-claim query failed; will retry next interval", ex);
        }
    }

    /**
     * Fails every claim older than {@code stale-claim-after} as of {@code now}.
     *
     * @param now reference time
     * @return number of posts moved to FAILED
     */
    public int reconcile(Instant now) {
        Duration staleAfter = properties.getScheduler().getStaleClaimAfter();
        List<Post> stale = postRepository.findStaleClaims(PostStatus.PUBLISHING, now.minus(staleAfter),
                PageRequest.of(0, properties.getScheduler().getBatchSize()));

        int failed = 0;
        for (Post post : stale) {
            MDC.put(DuePostScheduler.MDC_POST_ID, post.getId());
            try {
                lifecycleService.publishFailed(post.getId(), PublishFailureKind.OUTCOME_UNKNOWN.describe(
                        "claimed at " + post.getScheduleAttemptedAt() + " and not resolved within " + staleAfter
                                + "; verify on " + post.getPlatform() + " before retrying"));
                failed++;
                reconciledCounter.increment();
                log.warn("Stale PUBLISHING claim moved to FAILED. claimedAt={}", post.getScheduleAttemptedAt());
            } catch (RuntimeException ex) {
                log.warn("Could not reconcile stale claim; it was probably resolved concurrently. error={}", ex.getMessage());
            } finally {
                MDC.remove(DuePostScheduler.MDC_POST_ID);
            }
        }
        return failed;
    }
}
