package com.tempo.scheduler;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry settings for scheduled dispatches. The default makes a single attempt; anything more has
 * to be asked for.
 */
public final class RetryPolicy {
    private static final RetryPolicy NONE = new RetryPolicy(1, Duration.ofSeconds(1), Duration.ofSeconds(60));

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("retry delays must be >= 0");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    public static RetryPolicy none() {
        return NONE;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public boolean shouldRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Delay before the attempt following {@code attemptsMade} failed ones: exponential from the base
     * delay, capped at the max delay, with +-20% jitter.
     */
    public Duration delayAfter(int attemptsMade) {
        long delay = Math.min(maxDelay.toMillis(), (long) (baseDelay.toMillis() * Math.pow(2, attemptsMade - 1)));
        double jitter = 0.8 + (ThreadLocalRandom.current().nextDouble() * 0.4);
        return Duration.ofMillis((long) (delay * jitter));
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", baseDelay=" + baseDelay + ", maxDelay=" + maxDelay + "}";
    }
}
