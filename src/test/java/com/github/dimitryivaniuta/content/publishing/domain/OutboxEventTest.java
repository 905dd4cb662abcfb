package com.github.dimitryivaniuta.content.publishing.domain;

import java.time.Instant;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class OutboxEventTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void pendingEventIsDueImmediately() {
        OutboxEvent e = OutboxEvent.pending("p-1", 4L, PostEventType.APPROVED, "{}", T0);

        Assertions.assertEquals(OutboxStatus.PENDING, e.getStatus());
        Assertions.assertEquals(0, e.getRelayAttempts());
        Assertions.assertNull(e.getNextAttemptAt());
        Assertions.assertEquals(4L, e.getPostVersion());
    }

    @Test
    void failuresCountTowardsTheAttemptLimit() {
        OutboxEvent e = OutboxEvent.pending("p-1", 1L, PostEventType.STATE_CHANGED, "{}", T0);

        e.markRetry("broker down", T0.plusSeconds(1));
        Assertions.assertFalse(e.isLastAttempt(3));
        e.markRetry("broker down", T0.plusSeconds(3));
        Assertions.assertTrue(e.isLastAttempt(3));

        e.markDead("broker down");
        Assertions.assertEquals(OutboxStatus.DEAD, e.getStatus());
        Assertions.assertEquals(3, e.getRelayAttempts());
        Assertions.assertNull(e.getNextAttemptAt());
    }

    @Test
    void relayClearsThePreviousError() {
        OutboxEvent e = OutboxEvent.pending("p-1", 1L, PostEventType.PUBLISHED, "{}", T0);
        e.markRetry("timeout", T0.plusSeconds(1));

        e.markRelayed(T0.plusSeconds(2));

        Assertions.assertEquals(OutboxStatus.RELAYED, e.getStatus());
        Assertions.assertNull(e.getLastError());
        Assertions.assertEquals(T0.plusSeconds(2), e.getRelayedAt());
    }

    @Test
    void postIdIsRequired() {
        Assertions.assertThrows(NullPointerException.class,
                () -> OutboxEvent.pending(null, 1L, PostEventType.PUBLISHED, "{}", T0));
    }
}
