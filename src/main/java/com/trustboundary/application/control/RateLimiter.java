package com.trustboundary.application.control;

import java.time.Duration;

/**
 * Rate limiter consulted by {@code rate_limiting} controls.
 */
public interface RateLimiter {

    /**
     * Take one permit for {@code key}.
     *
     * @return {@code false} when {@code maxRequests} permits were already taken in the current window
     */
    boolean tryAcquire(String key, int maxRequests, Duration window);
}
