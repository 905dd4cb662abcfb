package com.github.dimitryivaniuta.content.publishing.domain.lifecycle;

import java.util.Optional;

/**
 * Bounded-retry guard for FAILED → SCHEDULED.
 *
 * <p>Retry accounting lives here and nowhere else: publishers never retry on their own.</p>
 */
public final class RetryPolicy implements TransitionGuard {

    /** Number of failed attempts after which RETRY is refused. */
    public static final int DEFAULT_MAX_RETRIES = 3;

    private final int maxRetries;

    public RetryPolicy(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES);
    }

    public int maxRetries() {
        return maxRetries;
    }

    public boolean canRetry(int retryCount) {
        return retryCount < maxRetries;
    }

    @Override
    public Optional<String> check(PostState state) {
        if (canRetry(state.retryCount())) {
            return Optional.empty();
        }
        return Optional.of("retry limit reached (" + state.retryCount() + " of " + maxRetries + " attempts used)");
    }
}
