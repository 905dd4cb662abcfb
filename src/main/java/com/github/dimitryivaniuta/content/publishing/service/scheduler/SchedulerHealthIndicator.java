package com.github.dimitryivaniuta.content.publishing.service.scheduler;

import com.github.dimitryivaniuta.content.publishing.config.AppProperties;
import com.github.dimitryivaniuta.content.publishing.domain.PostStatus;
import com.github.dimitryivaniuta.content.publishing.repo.PostRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Actuator view of the publication scheduler ({@code /actuator/health/scheduler}).
 *
 * <p>DOWN when the last scan was aborted, when claims are stuck in PUBLISHING while
 * reconciliation is off, or when the post store cannot be queried.</p>
 */
@Slf4j
@Component("scheduler")
public class SchedulerHealthIndicator implements HealthIndicator {

    private final DuePostScheduler scheduler;
    private final PostRepository postRepository;
    private final AppProperties properties;
    private final Clock clock;

    public SchedulerHealthIndicator(
            DuePostScheduler scheduler,
            PostRepository postRepository,
            AppProperties properties,
            Clock clock
    ) {
        this.scheduler = scheduler;
        this.postRepository = postRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Health health() {
        return healthAt(clock.instant());
    }

    Health healthAt(Instant now) {
        AppProperties.Scheduler cfg = properties.getScheduler();
        Optional<ScanReport> lastReport = scheduler.lastReport();

        long publishing;
        long stuck;
        try {
            publishing = postRepository.countByStatus(PostStatus.PUBLISHING);
            stuck = postRepository.countByStatusAndScheduleAttemptedAtBefore(
                    PostStatus.PUBLISHING, now.minus(cfg.getStaleClaimAfter()));
        } catch (DataAccessException ex) {
            log.warn("Scheduler health check could not query posts: {}", ex.getMessage());
            return Health.down(ex).withDetail("enabled", cfg.isEnabled()).build();
        }

        boolean lastScanAborted = lastReport.map(ScanReport::aborted).orElse(false);
        boolean stuckUnattended = stuck > 0 && !cfg.isReconcileEnabled();

        Health.Builder builder = lastScanAborted || stuckUnattended ? Health.down() : Health.up();
        builder.withDetail("enabled", cfg.isEnabled())
                .withDetail("running", scheduler.isRunning())
                .withDetail("publishing", publishing)
                .withDetail("stuckPublishing", stuck)
                .withDetail("reconcileEnabled", cfg.isReconcileEnabled());
        scheduler.lastScanAt().ifPresent(at -> builder.withDetail("lastScanAt", at.toString()));
        lastReport.ifPresent(r -> builder.withDetail("lastScan", r));
        return builder.build();
    }
}
