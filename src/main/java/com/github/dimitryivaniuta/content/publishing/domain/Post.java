package com.github.dimitryivaniuta.content.publishing.domain;

import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.PostField;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.PostState;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.TransitionDecision;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * A content item under lifecycle control.
 *
 * <p>There are no setters: the status and the derived fields change only through
 * {@link #applyTransition(TransitionDecision, Instant)} (decisions of the transition engine) or
 * through the scheduler's conditional claim update in the repository. Every write bumps
 * {@link #version}, which makes request-side writes fail instead of overwriting a concurrent claim.</p>
 */
@Entity
@Table(
        name = "posts",
        indexes = {
                @Index(name = "idx_posts_status_scheduled_time", columnList = "status,scheduled_time"),
                @Index(name = "idx_posts_status_attempted_at", columnList = "status,schedule_attempted_at")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Post {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private PostStatus status;

    @Column(name = "platform", nullable = false, length = 64)
    private String platform;

    @Column(name = "content", nullable = false, columnDefinition = "text")
    private String content;

    @Column(name = "scheduled_time")
    private Instant scheduledTime;

    @Column(name = "schedule_attempted_at")
    private Instant scheduleAttemptedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "approved_by", length = 128)
    private String approvedBy;

    @Column(name = "rejected_by", length = 128)
    private String rejectedBy;

    @Column(name = "rejected_reason", length = 1024)
    private String rejectedReason;

    @Column(name = "archived_reason", length = 1024)
    private String archivedReason;

    @Column(name = "external_post_id", length = 256)
    private String externalPostId;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    /**
     * Creates a new draft.
     *
     * @param platform target platform
     * @param content text to publish
     * @param now creation time
     * @return draft post
     */
    public static Post draft(String platform, String content, Instant now) {
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(now, "now");

        Post p = new Post();
        p.id = UUID.randomUUID().toString();
        p.status = PostStatus.DRAFT;
        p.platform = platform;
        p.content = content;
        p.retryCount = 0;
        p.createdAt = now;
        p.updatedAt = now;
        return p;
    }

    /**
     * Snapshot of the fields the transition engine decides on.
     *
     * @return lifecycle state
     */
    public PostState lifecycleState() {
        return new PostState(status, retryCount, approvedBy, rejectedBy);
    }

    /**
     * Applies an accepted decision: new status plus all field updates.
     *
     * @param decision engine decision made on this post's current state
     * @param now write time
     * @throws IllegalStateException if the decision was made on a different status
     */
    public void applyTransition(TransitionDecision decision, Instant now) {
        if (decision.from() != status) {
            throw new IllegalStateException("Decision for " + decision.from() + " applied to post " + id
                    + " in status " + status);
        }
        for (Map.Entry<PostField, Object> change : decision.changes().asMap().entrySet()) {
            apply(change.getKey(), change.getValue());
        }
        this.status = decision.to();
        this.updatedAt = now;
    }

    private void apply(PostField field, Object value) {
        switch (field) {
            case PLATFORM -> this.platform = (String) value;
            case CONTENT -> this.content = (String) value;
            case SCHEDULED_TIME -> this.scheduledTime = (Instant) value;
            case RETRY_COUNT -> this.retryCount = (Integer) value;
            case LAST_ERROR -> this.lastError = (String) value;
            case APPROVED_BY -> this.approvedBy = (String) value;
            case REJECTED_BY -> this.rejectedBy = (String) value;
            case REJECTED_REASON -> this.rejectedReason = (String) value;
            case ARCHIVED_REASON -> this.archivedReason = (String) value;
            case EXTERNAL_POST_ID -> this.externalPostId = (String) value;
            case PUBLISHED_AT -> this.publishedAt = (Instant) value;
        }
    }
}
