package org.mides.pooling.grasp;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class DeadlineTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC);

    @Test
    void after_zeroBudget_shouldBeExpired() {
        assertTrue(Deadline.after(Duration.ZERO, clock).isExpired());
    }

    @Test
    void after_positiveBudget_shouldReportRemainingTime() {
        var deadline = Deadline.after(Duration.ofSeconds(30), clock);

        assertFalse(deadline.isExpired());
        assertEquals(Duration.ofSeconds(30), deadline.remaining());
    }

    @Test
    void cancel_shouldExpireImmediately() {
        var deadline = Deadline.none();
        assertFalse(deadline.isExpired());

        deadline.cancel();

        assertTrue(deadline.isExpired());
        assertEquals(Duration.ZERO, deadline.remaining());
    }

    @Test
    void after_budgetBeyondTheTimeline_shouldNeverExpire() {
        var deadline = Deadline.after(Duration.ofSeconds(Long.MAX_VALUE), clock);

        assertFalse(deadline.isExpired());
        assertEquals(Duration.between(clock.instant(), Instant.MAX), deadline.remaining());
    }
}
