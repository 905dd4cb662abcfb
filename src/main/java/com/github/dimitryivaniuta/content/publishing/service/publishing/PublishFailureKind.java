package com.github.dimitryivaniuta.content.publishing.service.publishing;

/**
 * Why an external publish attempt failed.
 *
 * <p>All kinds currently end in the same PUBLISH_FAILED transition; the kind is kept in the
 * recorded error so operators can tell a revoked token from a platform outage.</p>
 */
public enum PublishFailureKind {
    AUTHENTICATION,
    RATE_LIMITED,
    TIMEOUT,
    REJECTED,
    GENERIC,
    /**
     * Set by stale-claim reconciliation, never by a client: the post may already be live.
     */
    OUTCOME_UNKNOWN;

    /**
     * Prefix of every {@code lastError} recorded for this kind.
     *
     * @return e.g. {@code "TIMEOUT: "}
     */
    public String errorPrefix() {
        return name() + ": ";
    }

    /**
     * Text stored as the post's {@code lastError}.
     *
     * @param message failure details, may be null
     * @return kind-prefixed message
     */
    public String describe(String message) {
        return errorPrefix() + (message == null ? "no details" : message);
    }
}
