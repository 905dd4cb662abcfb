package com.github.dimitryivaniuta.content.publishing.service.scheduler;

import com.github.dimitryivaniuta.content.publishing.PostgresIntegrationTest;
import com.github.dimitryivaniuta.content.publishing.domain.Post;
import com.github.dimitryivaniuta.content.publishing.domain.PostStatus;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.InvalidTransitionException;
import com.github.dimitryivaniuta.content.publishing.service.publishing.PublishException;
import com.github.dimitryivaniuta.content.publishing.service.publishing.PublishFailureKind;
import com.github.dimitryivaniuta.content.publishing.service.publishing.PublishRequest;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * Scan / claim / publish loop against a real Postgres, with the platform client mocked.
 */
@SpringBootTest
class DuePostSchedulerTest extends PostgresIntegrationTest {

    @Autowired
    DuePostScheduler scheduler;

    @Autowired
    PostClaimService claimService;

    @Test
    void duePostIsPublished() {
        Instant at = Instant.now().plus(Duration.ofHours(1));
        String id = scheduledPost("linkedin", at);
        Mockito.when(platformClient.publish(Mockito.any(), Mockito.any())).thenReturn("urn:li:share:1");

        ScanReport report = scheduler.runBatch(at.plusSeconds(1));

        Assertions.assertEquals(1, report.published());
        Post post = reload(id);
        Assertions.assertEquals(PostStatus.PUBLISHED, post.getStatus());
        Assertions.assertEquals("urn:li:share:1", post.getExternalPostId());
        Assertions.assertNotNull(post.getPublishedAt());
        Assertions.assertNull(post.getLastError());
        Assertions.assertNull(post.getScheduledTime());
        Assertions.assertNotNull(post.getScheduleAttemptedAt());

        ArgumentCaptor<PublishRequest> request = ArgumentCaptor.forClass(PublishRequest.class);
        Mockito.verify(platformClient).publish(request.capture(), Mockito.any());
        Assertions.assertEquals(id, request.getValue().postId());
        Assertions.assertEquals("Hello from linkedin", request.getValue().content());
    }

    @Test
    void postNotYetDueIsLeftAlone() {
        Instant at = Instant.now().plus(Duration.ofHours(1));
        String id = scheduledPost("linkedin", at);

        ScanReport report = scheduler.runBatch(at.minusSeconds(1));

        Assertions.assertEquals(0, report.due());
        Assertions.assertEquals(PostStatus.SCHEDULED, reload(id).getStatus());
        Mockito.verifyNoInteractions(platformClient);
    }

    @Test
    void emptyScanWritesNothing() {
        String id = postService.createDraft("linkedin", "draft").id();
        long outboxRows = outboxEventRepository.count();
        long version = reload(id).getVersion();

        ScanReport report = scheduler.runBatch(Instant.now().plus(Duration.ofDays(365)));

        Assertions.assertEquals(0, report.due());
        Assertions.assertEquals(outboxRows, outboxEventRepository.count());
        Assertions.assertEquals(version, reload(id).getVersion());
        Mockito.verifyNoInteractions(platformClient);
    }

    @Test
    void repeatedFailuresExhaustRetries() {
        Instant at = Instant.now().plus(Duration.ofHours(1));
        String id = scheduledPost("linkedin", at);
        Mockito.when(platformClient.publish(Mockito.any(), Mockito.any()))
                .thenThrow(new PublishException(PublishFailureKind.GENERIC, "platform returned 503"));

        for (int attempt = 1; attempt <= 3; attempt++) {
            ScanReport report = scheduler.runBatch(at.plus(Duration.ofMinutes(attempt)));
            Assertions.assertEquals(1, report.failed(), "attempt " + attempt);

            Post failed = reload(id);
            Assertions.assertEquals(PostStatus.FAILED, failed.getStatus());
            Assertions.assertEquals(attempt, failed.getRetryCount());
            Assertions.assertEquals("GENERIC: platform returned 503", failed.getLastError());

            if (attempt < 3) {
                lifecycleService.retry(id);
                Assertions.assertEquals(PostStatus.SCHEDULED, reload(id).getStatus());
            }
        }

        InvalidTransitionException ex = Assertions.assertThrows(InvalidTransitionException.class, () -> lifecycleService.retry(id));
        Assertions.assertTrue(ex.isGuardRejection());
        Assertions.assertEquals(PostStatus.FAILED, reload(id).getStatus());
        Mockito.verify(platformClient, Mockito.times(3)).publish(Mockito.any(), Mockito.any());
    }

    @Test
    void slowPlatformTimesOutAndFails() {
        Instant at = Instant.now().plus(Duration.ofHours(1));
        String id = scheduledPost("linkedin", at);
        Mockito.when(platformClient.publish(Mockito.any(), Mockito.any())).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return "too-late";
        });

        long t0 = System.nanoTime();
        ScanReport report = scheduler.runBatch(at.plusSeconds(1));
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000;

        Assertions.assertEquals(1, report.failed());
        Assertions.assertTrue(elapsedMs < 4_000, "scan must not wait for the slow call, took " + elapsedMs + "ms");
        Post post = reload(id);
        Assertions.assertEquals(PostStatus.FAILED, post.getStatus());
        Assertions.assertTrue(post.getLastError().startsWith("TIMEOUT"), post.getLastError());
        Assertions.assertEquals(1, post.getRetryCount());
    }

    @Test
    void unexpectedClientErrorIsRecordedAsFailure() {
        Instant at = Instant.now().plus(Duration.ofHours(1));
        String id = scheduledPost("x", at);
        Mockito.when(platformClient.publish(Mockito.any(), Mockito.any())).thenThrow(new IllegalStateException("socket closed"));

        scheduler.runBatch(at.plusSeconds(1));

        Post post = reload(id);
        Assertions.assertEquals(PostStatus.FAILED, post.getStatus());
        Assertions.assertEquals("GENERIC: socket closed", post.getLastError());
    }

    @Test
    void batchIsLimitedAndOldestFirst() {
        Instant base = Instant.now().plus(Duration.ofHours(1));
        List<String> ids = new ArrayList<>();
        // created newest first so insertion order differs from due order
        for (int i = 11; i >= 0; i--) {
            ids.add(0, scheduledPost("linkedin", base.plus(Duration.ofMinutes(i))));
        }
        List<String> publishedOrder = new ArrayList<>();
        Mockito.when(platformClient.publish(Mockito.any(), Mockito.any())).thenAnswer(inv -> {
            PublishRequest r = inv.getArgument(0);
            publishedOrder.add(r.postId());
            return "ext-" + r.postId();
        });

        ScanReport first = scheduler.runBatch(base.plus(Duration.ofHours(1)));

        Assertions.assertEquals(10, first.due());
        Assertions.assertEquals(10, first.published());
        Assertions.assertEquals(ids.subList(0, 10), publishedOrder);
        Assertions.assertEquals(PostStatus.SCHEDULED, reload(ids.get(10)).getStatus());
        Assertions.assertEquals(PostStatus.SCHEDULED, reload(ids.get(11)).getStatus());

        ScanReport second = scheduler.runBatch(base.plus(Duration.ofHours(1)));
        Assertions.assertEquals(2, second.published());
        Assertions.assertEquals(12, postRepository.countByStatus(PostStatus.PUBLISHED));
    }

    @Test
    void concurrentScansPublishEachPostOnce() throws Exception {
        Instant base = Instant.now().plus(Duration.ofHours(1));
        int posts = 5;
        for (int i = 0; i < posts; i++) {
            scheduledPost("linkedin", base.plusSeconds(i));
        }
        AtomicInteger calls = new AtomicInteger();
        Mockito.when(platformClient.publish(Mockito.any(), Mockito.any()))
                .thenAnswer(inv -> "ext-" + calls.incrementAndGet());

        int scanners = 4;
        ExecutorService exec = Executors.newFixedThreadPool(scanners);
        CountDownLatch ready = new CountDownLatch(scanners);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<ScanReport>> results = new ArrayList<>();
        for (int i = 0; i < scanners; i++) {
            Callable<ScanReport> scan = () -> {
                ready.countDown();
                go.await(5, TimeUnit.SECONDS);
                return scheduler.runBatch(base.plus(Duration.ofMinutes(5)));
            };
            results.add(exec.submit(scan));
        }

        Assertions.assertTrue(ready.await(5, TimeUnit.SECONDS));
        go.countDown();

        int claimed = 0;
        for (Future<ScanReport> f : results) {
            claimed += f.get(30, TimeUnit.SECONDS).claimed();
        }
        exec.shutdown();

        Assertions.assertEquals(posts, claimed);
        Assertions.assertEquals(posts, calls.get());
        Mockito.verify(platformClient, Mockito.times(posts)).publish(Mockito.any(), Mockito.any());
        Assertions.assertEquals(posts, postRepository.countByStatus(PostStatus.PUBLISHED));
    }

    @Test
    void exactlyOneOfManyClaimersWins() throws Exception {
        Instant at = Instant.now().plus(Duration.ofHours(1));
        String id = scheduledPost("linkedin", at);
        Post observed = reload(id);

        int claimers = 8;
        ExecutorService exec = Executors.newFixedThreadPool(claimers);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < claimers; i++) {
            results.add(exec.submit(() -> {
                go.await(5, TimeUnit.SECONDS);
                return claimService.claim(observed, at).isPresent();
            }));
        }
        go.countDown();

        int winners = 0;
        for (Future<Boolean> f : results) {
            if (f.get(10, TimeUnit.SECONDS)) {
                winners++;
            }
        }
        exec.shutdown();

        Assertions.assertEquals(1, winners);
        Assertions.assertEquals(PostStatus.PUBLISHING, reload(id).getStatus());
    }

    @Test
    void claimedPostCannotBeUnscheduled() {
        Instant at = Instant.now().plus(Duration.ofHours(1));
        String id = scheduledPost("linkedin", at);

        Post claimed = claimService.claim(reload(id), at).orElseThrow();
        Assertions.assertEquals(PostStatus.PUBLISHING, claimed.getStatus());
        Assertions.assertEquals(at.toEpochMilli(), claimed.getScheduleAttemptedAt().toEpochMilli());

        Assertions.assertThrows(InvalidTransitionException.class, () -> lifecycleService.unschedule(id));
        Assertions.assertThrows(InvalidTransitionException.class, () -> lifecycleService.delete(id));
        Assertions.assertEquals(PostStatus.PUBLISHING, reload(id).getStatus());
    }

    @Test
    void claimOfOutdatedSnapshotIsLost() {
        Instant at = Instant.now().plus(Duration.ofHours(1));
        String id = scheduledPost("linkedin", at);
        Post snapshot = reload(id);

        lifecycleService.unschedule(id);
        lifecycleService.edit(id, "rewritten after the due query");
        lifecycleService.approve(id, "bob");
        // same due time as before; only the row version tells the snapshot is outdated
        lifecycleService.schedule(id, at, "linkedin");

        Assertions.assertTrue(claimService.claim(snapshot, at).isEmpty());
        Post post = reload(id);
        Assertions.assertEquals(PostStatus.SCHEDULED, post.getStatus());
        Assertions.assertEquals("rewritten after the due query", post.getContent());
        Assertions.assertEquals("bob", post.getApprovedBy());
    }

    @Test
    void claimBeforeScheduledTimeIsLost() {
        Instant at = Instant.now().plus(Duration.ofHours(1));
        String id = scheduledPost("linkedin", at);

        Assertions.assertTrue(claimService.claim(reload(id), at.minusSeconds(1)).isEmpty());
        Assertions.assertEquals(PostStatus.SCHEDULED, reload(id).getStatus());
    }

    @Test
    void postRescheduledDuringTheBatchIsNotPublished() {
        Instant at = Instant.now().plus(Duration.ofHours(1));
        String first = scheduledPost("linkedin", at);
        String second = scheduledPost("linkedin", at.plusSeconds(1));
        Instant tomorrow = at.plus(Duration.ofDays(1));

        // while the first post is at the platform, someone moves the second one to tomorrow
        Mockito.when(platformClient.publish(Mockito.any(), Mockito.any())).thenAnswer(inv -> {
            PublishRequest r = inv.getArgument(0);
            if (first.equals(r.postId())) {
                lifecycleService.unschedule(second);
                lifecycleService.schedule(second, tomorrow, "linkedin");
            }
            return "ext-" + r.postId();
        });

        ScanReport report = scheduler.runBatch(at.plus(Duration.ofMinutes(1)));

        Assertions.assertEquals(2, report.due());
        Assertions.assertEquals(1, report.published());
        Assertions.assertEquals(1, report.claimLost());
        Assertions.assertEquals(PostStatus.PUBLISHED, reload(first).getStatus());

        Post moved = reload(second);
        Assertions.assertEquals(PostStatus.SCHEDULED, moved.getStatus());
        Assertions.assertEquals(tomorrow.toEpochMilli(), moved.getScheduledTime().toEpochMilli());
        Assertions.assertNull(moved.getExternalPostId());
        Mockito.verify(platformClient, Mockito.times(1)).publish(Mockito.any(), Mockito.any());
    }

    @Test
    void lastScanIsKept() {
        Instant at = Instant.now().plus(Duration.ofHours(1));
        scheduledPost("linkedin", at);
        Mockito.when(platformClient.publish(Mockito.any(), Mockito.any())).thenReturn("ext-1");

        ScanReport report = scheduler.runBatch(at);

        Assertions.assertEquals(at, scheduler.lastScanAt().orElseThrow());
        Assertions.assertEquals(report, scheduler.lastReport().orElseThrow());
    }
}
