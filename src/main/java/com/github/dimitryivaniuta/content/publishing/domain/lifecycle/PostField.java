package com.github.dimitryivaniuta.content.publishing.domain.lifecycle;

import java.time.Instant;

/**
 * Post attributes a transition is allowed to change besides the status itself.
 */
public enum PostField {
    PLATFORM(String.class, false),
    CONTENT(String.class, false),
    SCHEDULED_TIME(Instant.class, true),
    RETRY_COUNT(Integer.class, false),
    LAST_ERROR(String.class, true),
    APPROVED_BY(String.class, true),
    REJECTED_BY(String.class, true),
    REJECTED_REASON(String.class, true),
    ARCHIVED_REASON(String.class, true),
    EXTERNAL_POST_ID(String.class, true),
    PUBLISHED_AT(Instant.class, true);

    private final Class<?> type;
    private final boolean nullable;

    PostField(Class<?> type, boolean nullable) {
        this.type = type;
        this.nullable = nullable;
    }

    public Class<?> type() {
        return type;
    }

    public boolean isNullable() {
        return nullable;
    }
}
