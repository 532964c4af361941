package com.footballtransfers.infrastructure.scraper;

import java.time.Duration;
import java.util.Random;

/**
 * Bounded retries with exponential backoff and jitter.
 *
 * @param maxAttempts total attempts including the first one
 * @param baseBackoff wait after the first failure, before jitter
 * @param maxBackoff  upper bound of any single wait
 */
public record RetryPolicy(int maxAttempts, Duration baseBackoff, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    /**
     * Wait before the attempt following {@code failedAttempt} (1-based):
     * half of the capped exponential delay plus a random share of the other half.
     */
    public Duration backoff(int failedAttempt, Random random) {
        long base = baseBackoff.toMillis();
        long cap = maxBackoff.toMillis();
        int shift = Math.min(failedAttempt - 1, 30);
        long exponential = Math.min(cap, base << shift);
        if (exponential <= 0) {
            exponential = cap;
        }
        long half = exponential / 2;
        long jitter = half > 0 ? (long) (random.nextDouble() * (exponential - half)) : 0;
        return Duration.ofMillis(half + jitter);
    }
}
