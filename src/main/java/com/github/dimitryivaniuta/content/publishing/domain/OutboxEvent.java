package com.github.dimitryivaniuta.content.publishing.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * One lifecycle event of a post, waiting to be relayed to Kafka.
 *
 * <p>Written in the transaction of the post change that caused it. {@code postVersion} is the
 * version of the post row the event describes, so consumers can drop events older than what they
 * have already seen.</p>
 */
@Entity
@Table(
        name = "post_outbox",
        indexes = {
                @Index(name = "idx_post_outbox_relay", columnList = "status,next_attempt_at,created_at"),
                @Index(name = "idx_post_outbox_post", columnList = "post_id,created_at")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEvent {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "post_id", nullable = false, updatable = false, length = 36)
    private String postId;

    @Column(name = "post_version", updatable = false)
    private Long postVersion;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false, length = 32)
    private PostEventType eventType;

    @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "text")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private OutboxStatus status;

    @Column(name = "relay_attempts", nullable = false)
    private int relayAttempts;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "relayed_at")
    private Instant relayedAt;

    /**
     * Records a PENDING event for a post.
     *
     * @param postId post the event is about
     * @param postVersion version of the post row the event describes
     * @param eventType event type
     * @param payload JSON payload
     * @param now write time
     * @return pending event
     */
    public static OutboxEvent pending(String postId, Long postVersion, PostEventType eventType, String payload, Instant now) {
        OutboxEvent e = new OutboxEvent();
        e.id = UUID.randomUUID().toString();
        e.postId = Objects.requireNonNull(postId, "postId");
        e.postVersion = postVersion;
        e.eventType = Objects.requireNonNull(eventType, "eventType");
        e.payload = Objects.requireNonNull(payload, "payload");
        e.status = OutboxStatus.PENDING;
        e.createdAt = now;
        return e;
    }

    /**
     * True when one more failed attempt reaches {@code maxAttempts}.
     *
     * @param maxAttempts relay attempt limit
     * @return whether the next failure is the last one
     */
    public boolean isLastAttempt(int maxAttempts) {
        return relayAttempts + 1 >= maxAttempts;
    }

    public void markRelayed(Instant at) {
        this.status = OutboxStatus.RELAYED;
        this.relayAttempts++;
        this.relayedAt = at;
        this.nextAttemptAt = null;
        this.lastError = null;
    }

    /**
     * Leaves the event for a later relay run.
     *
     * @param error failure text
     * @param retryAt earliest next attempt
     */
    public void markRetry(String error, Instant retryAt) {
        this.status = OutboxStatus.RETRY;
        this.relayAttempts++;
        this.lastError = error;
        this.nextAttemptAt = retryAt;
    }

    public void markDead(String error) {
        this.status = OutboxStatus.DEAD;
        this.relayAttempts++;
        this.lastError = error;
        this.nextAttemptAt = null;
    }
}
