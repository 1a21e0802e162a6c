package com.company.guardian.alerting;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Token bucket that starts full. Tokens refill continuously at {@code permits / period} up to
 * the burst capacity; each admission consumes one.
 */
public class TokenBucketRateLimiter {

    private final int burst;
    private final double tokensPerNano;
    private final Clock clock;

    private double tokens;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(int burst, int permits, Duration period, Clock clock) {
        if (burst < 1) {
            throw new IllegalArgumentException("burst must be at least 1");
        }
        if (permits < 0 || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("invalid refill rate");
        }
        this.burst = burst;
        this.tokensPerNano = (double) permits / period.toNanos();
        this.clock = clock;
        this.tokens = burst;
        this.lastRefillNanos = nowNanos();
    }

    public static TokenBucketRateLimiter perHour(int burst, int maxPerHour, Clock clock) {
        return new TokenBucketRateLimiter(burst, maxPerHour, Duration.ofHours(1), clock);
    }

    public static TokenBucketRateLimiter perMinute(int burst, int maxPerMinute, Clock clock) {
        return new TokenBucketRateLimiter(burst, maxPerMinute, Duration.ofMinutes(1), clock);
    }

    public synchronized boolean tryAcquire() {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return true;
        }
        return false;
    }

    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    public int getBurst() {
        return burst;
    }

    private void refill() {
        long now = nowNanos();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(burst, tokens + elapsed * tokensPerNano);
            lastRefillNanos = now;
        }
    }

    private long nowNanos() {
        Instant instant = clock.instant();
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }
}
