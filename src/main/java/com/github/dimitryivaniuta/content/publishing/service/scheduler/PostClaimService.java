package com.github.dimitryivaniuta.content.publishing.service.scheduler;

import com.github.dimitryivaniuta.content.publishing.domain.Post;
import com.github.dimitryivaniuta.content.publishing.domain.PostStatus;
import com.github.dimitryivaniuta.content.publishing.repo.PostRepository;
import com.github.dimitryivaniuta.content.publishing.service.PostCacheService;
import java.time.Instant;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Exclusive SCHEDULED → PUBLISHING claim.
 *
 * <p>A separate bean so {@code @Transactional} goes through the proxy: the claim runs in its own
 * transaction and commits before the caller starts the external call, even when the caller is
 * already inside one. The conditional {@code UPDATE} is the only cross-instance mutual exclusion;
 * of K concurrent claimers exactly one sees one affected row.</p>
 */
@Service
public class PostClaimService {

    private final PostRepository postRepository;
    private final PostCacheService cacheService;

    public PostClaimService(PostRepository postRepository, PostCacheService cacheService) {
        this.postRepository = postRepository;
        this.cacheService = cacheService;
    }

    /**
     * Tries to claim a due post as it was read.
     *
     * <p>Fails when the row moved on since {@code observed} was loaded (edited, rescheduled,
     * claimed elsewhere) or is not due at {@code now}.</p>
     *
     * @param observed post as returned by the due query
     * @param now claim time, stored as {@code scheduleAttemptedAt}
     * @return the claimed post re-read after the update, or empty if the claim was lost
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<Post> claim(Post observed, Instant now) {
        int rows = postRepository.compareAndSwapStatus(
                observed.getId(), PostStatus.SCHEDULED, PostStatus.PUBLISHING, observed.getVersion(), now);
        if (rows == 0) {
            return Optional.empty();
        }
        cacheService.evict(observed.getId());
        return postRepository.findById(observed.getId());
    }
}
