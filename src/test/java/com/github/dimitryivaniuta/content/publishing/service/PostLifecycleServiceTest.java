package com.github.dimitryivaniuta.content.publishing.service;

import com.github.dimitryivaniuta.content.publishing.PostgresIntegrationTest;
import com.github.dimitryivaniuta.content.publishing.domain.OutboxEvent;
import com.github.dimitryivaniuta.content.publishing.domain.OutboxStatus;
import com.github.dimitryivaniuta.content.publishing.domain.Post;
import com.github.dimitryivaniuta.content.publishing.domain.PostEventType;
import com.github.dimitryivaniuta.content.publishing.domain.PostStatus;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.InvalidTransitionException;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.LifecycleEvent;
import com.github.dimitryivaniuta.content.publishing.service.dto.AllowedTransitions;
import com.github.dimitryivaniuta.content.publishing.service.scheduler.PostClaimService;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Lifecycle writes against a real Postgres: single write per transition, outbox rows in the
 * same transaction, untouched rows on refusal.
 */
@SpringBootTest
class PostLifecycleServiceTest extends PostgresIntegrationTest {

    @Autowired
    PlatformTransactionManager transactionManager;

    @Autowired
    PostClaimService claimService;

    @Test
    void happyPathUpToScheduledRecordsProvenanceAndEvents() {
        Instant at = Instant.now().plus(Duration.ofHours(2));
        String id = scheduledPost("linkedin", at);

        Post post = reload(id);
        Assertions.assertEquals(PostStatus.SCHEDULED, post.getStatus());
        Assertions.assertEquals("alice", post.getApprovedBy());
        Assertions.assertNull(post.getRejectedBy());
        Assertions.assertEquals(at.toEpochMilli(), post.getScheduledTime().toEpochMilli());

        List<OutboxEvent> events = outboxEventRepository.findByPostIdOrderByCreatedAtAsc(id);
        List<PostEventType> types = events.stream().map(OutboxEvent::getEventType).toList();
        Assertions.assertEquals(3, types.stream().filter(PostEventType.STATE_CHANGED::equals).count());
        Assertions.assertTrue(types.contains(PostEventType.APPROVED));
        Assertions.assertTrue(events.stream().allMatch(e -> e.getStatus() == OutboxStatus.PENDING));
        // every event carries the version its transition wrote, the last one the current row's
        Assertions.assertEquals(post.getVersion(),
                events.stream().map(OutboxEvent::getPostVersion).max(Long::compare).orElseThrow());
    }

    @Test
    void refusedEventLeavesRowUntouchedAndRecordsInvalidEvent() {
        String id = postService.createDraft("linkedin", "draft text").id();
        Post before = reload(id);

        InvalidTransitionException ex = Assertions.assertThrows(InvalidTransitionException.class,
                () -> lifecycleService.approve(id, "alice"));
        Assertions.assertEquals(PostStatus.DRAFT, ex.getCurrentStatus());

        Post after = reload(id);
        Assertions.assertEquals(PostStatus.DRAFT, after.getStatus());
        Assertions.assertEquals(before.getVersion(), after.getVersion());
        Assertions.assertNull(after.getApprovedBy());

        List<OutboxEvent> events = outboxEventRepository.findByPostIdOrderByCreatedAtAsc(id);
        Assertions.assertEquals(1, events.size());
        Assertions.assertEquals(PostEventType.TRANSITION_INVALID, events.get(0).getEventType());
        Assertions.assertEquals(before.getVersion(), events.get(0).getPostVersion());
        Assertions.assertTrue(events.get(0).getPayload().contains("SUBMIT_FOR_REVIEW"));
    }

    @Test
    void rejectThenEditReturnsToDraftWithoutProvenance() {
        String id = postService.createDraft("x", "v1").id();
        lifecycleService.submitForReview(id);
        lifecycleService.reject(id, null, null);

        Post rejected = reload(id);
        Assertions.assertEquals("system", rejected.getRejectedBy());
        Assertions.assertEquals("Rejected during review", rejected.getRejectedReason());

        lifecycleService.edit(id, "v2");
        Post draft = reload(id);
        Assertions.assertEquals(PostStatus.DRAFT, draft.getStatus());
        Assertions.assertEquals("v2", draft.getContent());
        Assertions.assertNull(draft.getRejectedBy());
        Assertions.assertNull(draft.getRejectedReason());
    }

    @Test
    void schedulingInThePastIsRejected() {
        String id = approvedPost("linkedin");

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> lifecycleService.schedule(id, Instant.now().minusSeconds(60), "linkedin"));
        Assertions.assertEquals(PostStatus.APPROVED, reload(id).getStatus());
    }

    @Test
    void unscheduleReturnsToApproved() {
        String id = scheduledPost("linkedin", Instant.now().plus(Duration.ofDays(1)));

        Post post = lifecycleService.unschedule(id);

        Assertions.assertEquals(PostStatus.APPROVED, post.getStatus());
        Assertions.assertNull(reload(id).getScheduledTime());
    }

    @Test
    void archiveRecordsReasonAndClearsSchedule() {
        String id = scheduledPost("linkedin", Instant.now().plus(Duration.ofDays(1)));

        lifecycleService.archive(id, "campaign cancelled");

        Post archived = reload(id);
        Assertions.assertEquals(PostStatus.ARCHIVED, archived.getStatus());
        Assertions.assertEquals("campaign cancelled (was approved)", archived.getArchivedReason());
        Assertions.assertNull(archived.getScheduledTime());
    }

    @Test
    void deleteRemovesRowAndReturnsDeletedSnapshot() {
        String id = postService.createDraft("linkedin", "to be removed").id();

        Post deleted = lifecycleService.delete(id);

        Assertions.assertEquals(PostStatus.DELETED, deleted.getStatus());
        Assertions.assertTrue(postRepository.findById(id).isEmpty());
        Assertions.assertTrue(outboxEventRepository.findByPostIdOrderByCreatedAtAsc(id).stream()
                .anyMatch(e -> e.getPayload().contains("\"toStatus\":\"DELETED\"")));
        Assertions.assertThrows(PostNotFoundException.class, () -> lifecycleService.submitForReview(id));
    }

    @Test
    void unknownPostIsNotFound() {
        Assertions.assertThrows(PostNotFoundException.class, () -> lifecycleService.submitForReview("missing"));
        Assertions.assertThrows(PostNotFoundException.class, () -> postService.getPost("missing"));
    }

    @Test
    void allowedTransitionsEvaluateRetryCap() {
        String id = postService.createDraft("linkedin", "text").id();

        AllowedTransitions allowed = postService.allowedTransitions(id);

        Assertions.assertEquals(PostStatus.DRAFT, allowed.status());
        Assertions.assertTrue(allowed.events().contains(LifecycleEvent.SUBMIT_FOR_REVIEW));
        Assertions.assertFalse(allowed.events().contains(LifecycleEvent.APPROVE));
    }

    @Test
    void commandOnSnapshotClaimedMeanwhileLosesWithOptimisticLock() {
        Instant at = Instant.now().plus(Duration.ofHours(1));
        String id = scheduledPost("linkedin", at);
        TransactionTemplate tx = new TransactionTemplate(transactionManager);

        Assertions.assertThrows(OptimisticLockingFailureException.class, () -> tx.executeWithoutResult(status -> {
            Post loaded = postRepository.findById(id).orElseThrow();
            Assertions.assertEquals(PostStatus.SCHEDULED, loaded.getStatus());

            // the scheduler claims the row in its own transaction
            Assertions.assertTrue(claimService.claim(loaded, at).isPresent());

            // this transaction still sees SCHEDULED, so the engine accepts the command
            lifecycleService.unschedule(id);
        }));

        Post post = reload(id);
        Assertions.assertEquals(PostStatus.PUBLISHING, post.getStatus());
        Assertions.assertEquals(at.toEpochMilli(), post.getScheduledTime().toEpochMilli());
    }

    @Test
    void deleteOfOutdatedDraftIsRefused() {
        String id = postService.createDraft("linkedin", "draft").id();
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        TransactionTemplate concurrent = new TransactionTemplate(transactionManager);
        concurrent.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);

        Assertions.assertThrows(ConcurrentPostModificationException.class, () -> tx.executeWithoutResult(status -> {
            Assertions.assertEquals(PostStatus.DRAFT, postRepository.findById(id).orElseThrow().getStatus());
            concurrent.executeWithoutResult(inner -> lifecycleService.submitForReview(id));
            lifecycleService.delete(id);
        }));

        Post post = reload(id);
        Assertions.assertEquals(PostStatus.NEEDS_REVIEW, post.getStatus());
        Assertions.assertTrue(outboxEventRepository.findByPostIdOrderByCreatedAtAsc(id).stream()
                .noneMatch(e -> e.getPayload().contains("\"toStatus\":\"DELETED\"")));
    }

    @Test
    void allowedTransitionsDropRetryOnceTheCapIsReached() {
        Instant at = Instant.now().plus(Duration.ofHours(1));
        String id = scheduledPost("linkedin", at);

        for (int attempt = 1; attempt <= 3; attempt++) {
            Assertions.assertTrue(claimService.claim(reload(id), at).isPresent(), "claim " + attempt);
            lifecycleService.publishFailed(id, "GENERIC: platform returned 503");

            AllowedTransitions allowed = postService.allowedTransitions(id);
            Assertions.assertEquals(PostStatus.FAILED, allowed.status());
            Assertions.assertEquals(attempt < 3, allowed.events().contains(LifecycleEvent.RETRY), "after attempt " + attempt);
            Assertions.assertTrue(allowed.events().contains(LifecycleEvent.ARCHIVE));

            if (attempt < 3) {
                lifecycleService.retry(id);
            }
        }

        Assertions.assertEquals(3, reload(id).getRetryCount());
        InvalidTransitionException ex = Assertions.assertThrows(InvalidTransitionException.class, () -> lifecycleService.retry(id));
        Assertions.assertTrue(ex.isGuardRejection());
    }
}
