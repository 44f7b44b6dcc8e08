package com.yupacgo.backend.cache;

import java.time.Duration;

/**
 * Attempt budget and linear backoff for cache commands: attempt {@code n} (1-based) waits
 * {@code min(n * baseDelay, maxDelay)} before the next try.
 */
public record CacheRetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {

    public static final CacheRetryPolicy DEFAULT =
            new CacheRetryPolicy(3, Duration.ofMillis(50), Duration.ofMillis(2000));

    public CacheRetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (baseDelay == null || baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay must be >= 0");
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) throw new IllegalArgumentException("maxDelay must be >= baseDelay");
    }

    public Duration delayFor(long attempt) {
        if (attempt < 1) return Duration.ZERO;
        Duration d = baseDelay.multipliedBy(attempt);
        return d.compareTo(maxDelay) > 0 ? maxDelay : d;
    }

    /**
     * Sleeps for the delay of {@code attempt}.
     *
     * @return false if interrupted; the interrupt flag is restored and the caller should give up
     */
    boolean pause(long attempt) {
        long ms = delayFor(attempt).toMillis();
        if (ms <= 0) return true;
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
