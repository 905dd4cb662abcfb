package com.github.dimitryivaniuta.content.publishing.domain;

/**
 * Relay status of a lifecycle event in the outbox.
 */
public enum OutboxStatus {
    /** Written with the post change, not relayed yet. */
    PENDING,
    /** A relay attempt failed; picked up again after {@code nextAttemptAt}. */
    RETRY,
    /** Acknowledged by Kafka. */
    RELAYED,
    /** Relay attempts exhausted; needs an operator. */
    DEAD
}
