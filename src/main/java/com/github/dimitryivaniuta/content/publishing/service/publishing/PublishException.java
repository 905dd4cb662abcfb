package com.github.dimitryivaniuta.content.publishing.service.publishing;

import java.util.Objects;

/**
 * Typed failure of an external publish attempt.
 */
public class PublishException extends RuntimeException {

    private final PublishFailureKind kind;

    public PublishException(PublishFailureKind kind, String message) {
        this(kind, message, null);
    }

    public PublishException(PublishFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public PublishFailureKind getKind() {
        return kind;
    }

    /**
     * Text stored as the post's {@code lastError}.
     *
     * @return kind-prefixed message
     */
    public String describe() {
        return kind.describe(getMessage());
    }
}
