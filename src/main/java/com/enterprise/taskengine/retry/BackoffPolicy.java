package com.enterprise.taskengine.retry;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff for retried task attempts.
 * <p>
 * The delay for a retry is {@code multiplier * 2^attempt} seconds where
 * {@code attempt} is the number of retries that already happened, capped at
 * the configured maximum. With jitter the delay is replaced by a uniformly
 * drawn whole number of seconds in {@code [0, delay)}.
 */
public class BackoffPolicy {
    
    private final Random random;
    
    public BackoffPolicy() {
        this(null);
    }
    
    /**
     * @param random source for jitter; {@code null} uses {@link ThreadLocalRandom}
     */
    public BackoffPolicy(Random random) {
        this.random = random;
    }
    
    /**
     * Compute the countdown for the next retry
     *
     * @param attempt number of prior retries, 0 for the first retry
     * @param backoff the task's backoff setting
     * @param backoffMax ceiling on the delay; {@code null} for no ceiling
     * @param jitter whether to randomize the delay
     * @return delay in seconds, or {@code null} when backoff is disabled
     */
    public Long computeDelay(int attempt, Backoff backoff, Duration backoffMax, boolean jitter) {
        if (backoff == null || !backoff.isEnabled()) {
            return null;
        }
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt cannot be negative: " + attempt);
        }
        
        long maximum = backoffMax == null ? Long.MAX_VALUE : backoffMax.getSeconds();
        long delay = Math.min(maximum, exponentialDelay(backoff.multiplier(), attempt));
        
        if (jitter) {
            delay = randomBelow(delay);
        }
        return Math.max(0L, delay);
    }
    
    /**
     * {@code multiplier * 2^attempt}, saturating at {@link Long#MAX_VALUE}
     */
    static long exponentialDelay(int multiplier, int attempt) {
        if (attempt >= Long.SIZE - 1) {
            return Long.MAX_VALUE;
        }
        try {
            return Math.multiplyExact((long) multiplier, 1L << attempt);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
    
    private long randomBelow(long bound) {
        if (bound <= 0) {
            return 0L;
        }
        Random source = random != null ? random : ThreadLocalRandom.current();
        if (bound <= Integer.MAX_VALUE) {
            return source.nextInt((int) bound);
        }
        return (long) (source.nextDouble() * bound);
    }
}
