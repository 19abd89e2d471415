package com.trustboundary.infrastructure.ratelimit;

import com.trustboundary.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CaffeineRateLimiterTest {

    private static final Duration MINUTE = Duration.ofMinutes(1);

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
    private final CaffeineRateLimiter limiter = new CaffeineRateLimiter(clock, 1_000);

    @Test
    void permitsUpToLimitWithinWindow() {
        assertTrue(limiter.tryAcquire("c1:agent", 2, MINUTE));
        assertTrue(limiter.tryAcquire("c1:agent", 2, MINUTE));
        assertFalse(limiter.tryAcquire("c1:agent", 2, MINUTE));
    }

    @Test
    void newWindowResetsCount() {
        limiter.tryAcquire("c1:agent", 1, MINUTE);
        assertFalse(limiter.tryAcquire("c1:agent", 1, MINUTE));

        clock.advance(Duration.ofSeconds(60));

        assertTrue(limiter.tryAcquire("c1:agent", 1, MINUTE));
    }

    @Test
    void keysAreIndependent() {
        assertTrue(limiter.tryAcquire("c1:agent-a", 1, MINUTE));
        assertTrue(limiter.tryAcquire("c1:agent-b", 1, MINUTE));
        assertFalse(limiter.tryAcquire("c1:agent-a", 1, MINUTE));
    }

    @Test
    void zeroLimitDeniesEverything() {
        assertFalse(limiter.tryAcquire("c1:agent", 0, MINUTE));
    }
}
