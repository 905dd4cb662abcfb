package com.github.dimitryivaniuta.content.publishing.service.scheduler;

import com.github.dimitryivaniuta.content.publishing.config.AppProperties;
import com.github.dimitryivaniuta.content.publishing.domain.Post;
import com.github.dimitryivaniuta.content.publishing.domain.PostStatus;
import com.github.dimitryivaniuta.content.publishing.repo.PostRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.SmartLifecycle;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * Periodic scan / claim / publish loop.
 *
 * <p>Runs with a fixed delay, so scans of one instance never overlap. Each scan takes the oldest
 * due SCHEDULED posts (up to {@code batch-size}) and claims them one by one. A claim only succeeds
 * on the row version the query returned, so a post edited or rescheduled while earlier posts of
 * the batch were publishing is left alone. Won claims are handed to {@link ClaimedPostPublisher}.</p>
 *
 * <p>Shutdown: the application context stops this bean early; the flag is checked before each
 * scan and before each post, and an in-flight publish is bounded by the publish timeout.</p>
 */
@Component
public class DuePostScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(DuePostScheduler.class);

    static final String MDC_POST_ID = "postId";

    private final PostRepository postRepository;
    private final PostClaimService claimService;
    private final ClaimedPostPublisher claimedPostPublisher;
    private final AppProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<Instant> lastScanAt = new AtomicReference<>();
    private final AtomicReference<ScanReport> lastReport = new AtomicReference<>();

    private final Counter claimedCounter;
    private final Counter claimLostCounter;
    private final Counter errorCounter;
    private final Counter abortedScanCounter;

    public DuePostScheduler(
            PostRepository postRepository,
            PostClaimService claimService,
            ClaimedPostPublisher claimedPostPublisher,
            AppProperties properties,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.postRepository = postRepository;
        this.claimService = claimService;
        this.claimedPostPublisher = claimedPostPublisher;
        this.properties = properties;
        this.clock = clock;

        this.claimedCounter = Counter.builder("posts.scheduler.claimed").register(meterRegistry);
        this.claimLostCounter = Counter.builder("posts.scheduler.claim_lost").register(meterRegistry);
        this.errorCounter = Counter.builder("posts.scheduler.errors").register(meterRegistry);
        this.abortedScanCounter = Counter.builder("posts.scheduler.scan_aborted").register(meterRegistry);
    }

    /**
     * Scheduled entry point.
     */
    @Scheduled(
            fixedDelayString = "${app.scheduler.scan-interval-ms:60000}",
            initialDelayString = "${app.scheduler.initial-delay-ms:5000}"
    )
    public void scan() {
        if (!properties.getScheduler().isEnabled() || !running.get()) {
            return;
        }
        ScanReport report = runBatch(clock.instant());
        if (report.due() > 0) {
            log.info("Scan done. due={} claimed={} claimLost={} published={} failed={} errors={}",
                    report.due(), report.claimed(), report.claimLost(), report.published(), report.failed(), report.errors());
        }
    }

    /**
     * Processes one batch of posts due at {@code now}.
     *
     * @param now cut-off for the due query and claim time
     * @return outcome counts
     */
    public ScanReport runBatch(Instant now) {
        if (!running.get()) {
            return ScanReport.skipped();
        }

        List<Post> due;
        try {
            due = postRepository.findDuePosts(PostStatus.SCHEDULED, now,
                    PageRequest.of(0, properties.getScheduler().getBatchSize()));
        } catch (DataAccessException | TransactionException ex) {
            abortedScanCounter.increment();
            log.error("Due-post query failed; scan aborted, next interval runs as usual", ex);
            return record(now, ScanReport.abortedScan());
        }

        int claimed = 0;
        int claimLost = 0;
        int published = 0;
        int failed = 0;
        int errors = 0;

        for (Post post : due) {
            if (!running.get()) {
                log.info("Stop requested; remaining due posts are left for the next run");
                break;
            }
            MDC.put(MDC_POST_ID, post.getId());
            try {
                Optional<Post> claimedPost = claimService.claim(post, now);
                if (claimedPost.isEmpty()) {
                    claimLost++;
                    claimLostCounter.increment();
                    log.info("Claim lost; the post was claimed elsewhere or changed after the due query");
                    continue;
                }
                claimed++;
                claimedCounter.increment();

                if (claimedPostPublisher.publish(claimedPost.get()).getStatus() == PostStatus.PUBLISHED) {
                    published++;
                } else {
                    failed++;
                }
            } catch (RuntimeException ex) {
                errors++;
                errorCounter.increment();
                log.error("Resolving post {} failed; continuing with the batch", post.getId(), ex);
            } finally {
                MDC.remove(MDC_POST_ID);
            }
        }

        return record(now, new ScanReport(due.size(), claimed, claimLost, published, failed, errors, false));
    }

    private ScanReport record(Instant scanTime, ScanReport report) {
        lastScanAt.set(scanTime);
        lastReport.set(report);
        return report;
    }

    /**
     * Reference time of the last scan that ran, aborted ones included.
     *
     * @return last scan time, empty before the first scan
     */
    public Optional<Instant> lastScanAt() {
        return Optional.ofNullable(lastScanAt.get());
    }

    public Optional<ScanReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    @Override
    public void start() {
        running.set(true);
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Due-post scheduler stopping");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }
}
