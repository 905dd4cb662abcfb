package com.github.dimitryivaniuta.content.publishing.domain;

/**
 * Lifecycle event types written to the outbox; {@link #wireName()} is the Kafka-facing name.
 */
public enum PostEventType {

    STATE_CHANGED("post.state.changed"),
    APPROVED("post.approved"),
    REJECTED("post.rejected"),
    PUBLISHED("post.published"),
    PUBLICATION_FAILED("post.publication.failed"),
    TRANSITION_INVALID("post.transition.invalid");

    private final String wireName;

    PostEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
