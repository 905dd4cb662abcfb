package com.github.dimitryivaniuta.content.publishing.service.scheduler;

import com.github.dimitryivaniuta.content.publishing.domain.Post;
import com.github.dimitryivaniuta.content.publishing.repo.PostRepository;
import com.github.dimitryivaniuta.content.publishing.service.PostLifecycleService;
import com.github.dimitryivaniuta.content.publishing.service.PostNotFoundException;
import java.time.Clock;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Publishes an approved post without waiting for the next scan.
 *
 * <p>Schedules the post at the current instant and runs the same claim and publish steps as
 * {@link DuePostScheduler}, in the caller's thread. A scan that claims the post in between wins;
 * the post is then returned as stored and not published a second time.</p>
 */
@Slf4j
@Service
public class PublishNowService {

    private final PostLifecycleService lifecycleService;
    private final PostClaimService claimService;
    private final ClaimedPostPublisher claimedPostPublisher;
    private final PostRepository postRepository;
    private final Clock clock;

    public PublishNowService(
            PostLifecycleService lifecycleService,
            PostClaimService claimService,
            ClaimedPostPublisher claimedPostPublisher,
            PostRepository postRepository,
            Clock clock
    ) {
        this.lifecycleService = lifecycleService;
        this.claimService = claimService;
        this.claimedPostPublisher = claimedPostPublisher;
        this.postRepository = postRepository;
        this.clock = clock;
    }

    /**
     * Schedules, claims and publishes a post.
     *
     * @param postId post id, must be APPROVED
     * @param platform target platform; the post's own when null or blank
     * @return the post after the attempt (PUBLISHED or FAILED), or as stored if a scan claimed it first
     */
    public Post publishNow(String postId, String platform) {
        MDC.put(DuePostScheduler.MDC_POST_ID, postId);
        try {
            Post scheduled = lifecycleService.scheduleNow(postId, platform);

            Optional<Post> claimed = claimService.claim(scheduled, clock.instant());
            if (claimed.isEmpty()) {
                log.info("Publish-now claim lost; a scheduler scan took the post first");
                return postRepository.findById(postId).orElseThrow(() -> new PostNotFoundException(postId));
            }
            return claimedPostPublisher.publish(claimed.get());
        } finally {
            MDC.remove(DuePostScheduler.MDC_POST_ID);
        }
    }
}
