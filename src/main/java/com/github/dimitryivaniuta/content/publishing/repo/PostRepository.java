package com.github.dimitryivaniuta.content.publishing.repo;

import com.github.dimitryivaniuta.content.publishing.domain.Post;
import com.github.dimitryivaniuta.content.publishing.domain.PostStatus;
import java.time.Instant;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Post store.
 *
 * <p>Besides the versioned {@code save} used by lifecycle transitions, it exposes the two conditional
 * writes the scheduler relies on. Both are single {@code UPDATE}/{@code DELETE} statements so the
 * database, not application memory, decides which concurrent writer wins.</p>
 */
public interface PostRepository extends JpaRepository<Post, String> {

    /**
     * Posts in {@code status} whose scheduled time is at or before {@code now}, oldest first.
     *
     * @param status status to match, normally SCHEDULED
     * @param now cut-off time
     * @param page batch limit
     * @return due posts
     */
    @Query("""
            select p from Post p
            where p.status = :status
              and p.scheduledTime <= :now
            order by p.scheduledTime asc, p.id asc
            """)
    List<Post> findDuePosts(@Param("status") PostStatus status, @Param("now") Instant now, Pageable page);

    /**
     * Atomically moves a due post from {@code expected} to {@code next} and stamps the attempt time.
     *
     * <p>The row must still carry the version the caller read and be due at {@code now}. Returns 0
     * when another writer got there first or the post was edited or rescheduled since it was read;
     * that is the "claim lost" outcome.</p>
     *
     * @param id post id
     * @param expected status the caller observed
     * @param next new status
     * @param observedVersion version the caller observed
     * @param now claim time, also the due cut-off
     * @return rows affected (0 or 1)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Post p
               set p.status = :next,
                   p.scheduleAttemptedAt = :now,
                   p.updatedAt = :now,
                   p.version = p.version + 1
             where p.id = :id
               and p.status = :expected
               and p.version = :observedVersion
               and p.scheduledTime <= :now
            """)
    int compareAndSwapStatus(
            @Param("id") String id,
            @Param("expected") PostStatus expected,
            @Param("next") PostStatus next,
            @Param("observedVersion") long observedVersion,
            @Param("now") Instant now
    );

    /**
     * Hard-deletes a post only if nobody wrote it since it was read.
     *
     * @param id post id
     * @param version version observed by the caller
     * @return rows affected (0 or 1)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Post p where p.id = :id and p.version = :version")
    int deleteIfUnchanged(@Param("id") String id, @Param("version") long version);

    /**
     * Claims older than {@code claimedBefore} that never got an outcome.
     *
     * @param status normally PUBLISHING
     * @param claimedBefore staleness cut-off
     * @param page batch limit
     * @return stale posts, oldest claim first
     */
    @Query("""
            select p from Post p
            where p.status = :status
              and p.scheduleAttemptedAt < :claimedBefore
            order by p.scheduleAttemptedAt asc
            """)
    List<Post> findStaleClaims(@Param("status") PostStatus status, @Param("claimedBefore") Instant claimedBefore, Pageable page);

    /**
     * Failed posts still under the retry cap whose last attempt is old enough.
     *
     * <p>Posts whose {@code lastError} starts with {@code excludedErrorPrefix} are skipped; the
     * reconciler marks failures with an unknown outcome this way.</p>
     *
     * @param status normally FAILED
     * @param maxRetries retry cap
     * @param attemptedBefore last attempt cut-off
     * @param excludedErrorPrefix {@code like} pattern of errors that must not be retried automatically
     * @param page batch limit
     * @return candidates, oldest attempt first
     */
    @Query("""
            select p from Post p
            where p.status = :status
              and p.retryCount < :maxRetries
              and (p.scheduleAttemptedAt is null or p.scheduleAttemptedAt <= :attemptedBefore)
              and (p.lastError is null or p.lastError not like :excludedErrorPrefix)
            order by p.scheduleAttemptedAt asc
            """)
    List<Post> findRetryCandidates(
            @Param("status") PostStatus status,
            @Param("maxRetries") int maxRetries,
            @Param("attemptedBefore") Instant attemptedBefore,
            @Param("excludedErrorPrefix") String excludedErrorPrefix,
            Pageable page
    );

    /**
     * Posts in {@code status} claimed before {@code claimedBefore}.
     *
     * @param status normally PUBLISHING
     * @param claimedBefore staleness cut-off
     * @return count
     */
    long countByStatusAndScheduleAttemptedAtBefore(PostStatus status, Instant claimedBefore);

    long countByStatus(PostStatus status);
}
