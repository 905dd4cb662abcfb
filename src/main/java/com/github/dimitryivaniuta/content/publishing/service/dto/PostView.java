package com.github.dimitryivaniuta.content.publishing.service.dto;

import com.github.dimitryivaniuta.content.publishing.domain.Post;
import com.github.dimitryivaniuta.content.publishing.domain.PostStatus;
import java.time.Instant;

/**
 * Read snapshot of a post, returned over HTTP and cached in Redis.
 */
public record PostView(
        String id,
        PostStatus status,
        String platform,
        String content,
        Instant scheduledTime,
        Instant scheduleAttemptedAt,
        int retryCount,
        String lastError,
        String approvedBy,
        String rejectedBy,
        String rejectedReason,
        String archivedReason,
        String externalPostId,
        Instant publishedAt,
        Instant createdAt,
        Instant updatedAt,
        long version
) {
    /**
     * Maps a domain {@link Post} to its snapshot.
     *
     * @param p post entity
     * @return view
     */
    public static PostView from(Post p) {
        return new PostView(
                p.getId(),
                p.getStatus(),
                p.getPlatform(),
                p.getContent(),
                p.getScheduledTime(),
                p.getScheduleAttemptedAt(),
                p.getRetryCount(),
                p.getLastError(),
                p.getApprovedBy(),
                p.getRejectedBy(),
                p.getRejectedReason(),
                p.getArchivedReason(),
                p.getExternalPostId(),
                p.getPublishedAt(),
                p.getCreatedAt(),
                p.getUpdatedAt(),
                p.getVersion()
        );
    }
}
