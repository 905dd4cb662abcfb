package com.github.dimitryivaniuta.content.publishing.service.scheduler;

import com.github.dimitryivaniuta.content.publishing.PostgresIntegrationTest;
import com.github.dimitryivaniuta.content.publishing.domain.Post;
import com.github.dimitryivaniuta.content.publishing.domain.PostStatus;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.InvalidTransitionException;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.LifecycleEvent;
import com.github.dimitryivaniuta.content.publishing.service.PostNotFoundException;
import com.github.dimitryivaniuta.content.publishing.service.publishing.PublishException;
import com.github.dimitryivaniuta.content.publishing.service.publishing.PublishFailureKind;
import com.github.dimitryivaniuta.content.publishing.service.publishing.PublishRequest;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class PublishNowServiceTest extends PostgresIntegrationTest {

    @Autowired
    PublishNowService publishNowService;

    @Test
    void approvedPostIsPublishedRightAway() {
        String id = approvedPost("linkedin");
        Mockito.when(platformClient.publish(Mockito.any(), Mockito.any())).thenReturn("urn:li:share:9");

        Post post = publishNowService.publishNow(id, null);

        Assertions.assertEquals(PostStatus.PUBLISHED, post.getStatus());
        Assertions.assertEquals("urn:li:share:9", post.getExternalPostId());
        Assertions.assertNotNull(post.getScheduleAttemptedAt());
        Assertions.assertEquals(PostStatus.PUBLISHED, reload(id).getStatus());
    }

    @Test
    void platformOverrideIsUsed() {
        String id = approvedPost("linkedin");
        Mockito.when(platformClient.publish(Mockito.any(), Mockito.any())).thenReturn("x-1");

        publishNowService.publishNow(id, "x");

        ArgumentCaptor<PublishRequest> request = ArgumentCaptor.forClass(PublishRequest.class);
        Mockito.verify(platformClient).publish(request.capture(), Mockito.any());
        Assertions.assertEquals("x", request.getValue().platform());
        Assertions.assertEquals("x", reload(id).getPlatform());
    }

    @Test
    void failedAttemptIsRecordedAndRetryable() {
        String id = approvedPost("linkedin");
        Mockito.when(platformClient.publish(Mockito.any(), Mockito.any()))
                .thenThrow(new PublishException(PublishFailureKind.AUTHENTICATION, "token expired"));

        Post post = publishNowService.publishNow(id, null);

        Assertions.assertEquals(PostStatus.FAILED, post.getStatus());
        Assertions.assertEquals(1, post.getRetryCount());
        Assertions.assertEquals("AUTHENTICATION: token expired", post.getLastError());
        Assertions.assertTrue(postService.allowedTransitions(id).events().contains(LifecycleEvent.RETRY));
    }

    @Test
    void onlyApprovedPostsCanBePublishedNow() {
        String draft = postService.createDraft("linkedin", "unreviewed").id();
        String scheduled = scheduledPost("linkedin", Instant.now().plus(Duration.ofDays(1)));

        InvalidTransitionException ex = Assertions.assertThrows(InvalidTransitionException.class,
                () -> publishNowService.publishNow(draft, null));
        Assertions.assertEquals(PostStatus.DRAFT, ex.getCurrentStatus());
        Assertions.assertThrows(InvalidTransitionException.class, () -> publishNowService.publishNow(scheduled, null));
        Assertions.assertThrows(PostNotFoundException.class, () -> publishNowService.publishNow("missing", null));

        Assertions.assertEquals(PostStatus.DRAFT, reload(draft).getStatus());
        Assertions.assertEquals(PostStatus.SCHEDULED, reload(scheduled).getStatus());
        Mockito.verifyNoInteractions(platformClient);
    }
}
