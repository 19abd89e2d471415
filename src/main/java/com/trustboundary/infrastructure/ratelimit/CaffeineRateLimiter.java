package com.trustboundary.infrastructure.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.trustboundary.application.control.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fixed-window rate limiter with windows held in a bounded Caffeine cache.
 *
 * <p>Window boundaries come from the injected {@link Clock}. Idle windows are
 * evicted after an hour, and the number of tracked keys is capped so a flood of
 * distinct requesters cannot grow memory without bound.
 */
@Slf4j
public class CaffeineRateLimiter implements RateLimiter {

    private final Clock clock;
    private final Cache<String, Window> windows;

    public CaffeineRateLimiter(Clock clock, long maximumTrackedKeys) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.windows = Caffeine.newBuilder()
            .maximumSize(maximumTrackedKeys)
            .expireAfterAccess(Duration.ofHours(1))
            .build();
    }

    @Override
    public boolean tryAcquire(String key, int maxRequests, Duration window) {
        if (maxRequests <= 0) {
            return false;
        }
        Instant now = clock.instant();
        Window current = windows.asMap().compute(key, (k, existing) -> {
            if (existing == null || !now.isBefore(existing.start.plus(window))) {
                return new Window(now, 1);
            }
            return new Window(existing.start, existing.count + 1);
        });

        boolean allowed = current.count <= maxRequests;
        if (!allowed) {
            log.debug("Rate limit exceeded for {}: {}/{} in {}", key, current.count, maxRequests, window);
        }
        return allowed;
    }

    private record Window(Instant start, int count) {
    }
}
