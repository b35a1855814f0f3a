package com.prediction.market.exchange.ratelimit;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;

/**
 * One resilience4j limiter per caller. A denied call fails immediately
 * instead of waiting for the next refresh.
 */
public class AccountRateLimiter {

    private final Map<String, RateLimiter> limiters = new ConcurrentHashMap<>();
    private final RateLimiterConfig config;

    public AccountRateLimiter(int limitForPeriod, Duration refreshPeriod) {
        this.config = RateLimiterConfig.custom()
            .limitRefreshPeriod(refreshPeriod)
            .limitForPeriod(limitForPeriod)
            .timeoutDuration(Duration.ZERO)
            .build();
    }

    public boolean tryAcquire(String identifier) {
        return limiters.computeIfAbsent(identifier, id -> RateLimiter.of(id, config)).acquirePermission();
    }

    /**
     * Whole seconds until the caller's limit refreshes, at least 1.
     */
    public long getRetryAfterSeconds() {
        long millis = config.getLimitRefreshPeriod().toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }

    public void reset(String identifier) {
        limiters.remove(identifier);
    }

    public int size() {
        return limiters.size();
    }
}
