package com.enterprise.taskengine.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Options applied to automatic retries of a task: a max retries value that
 * replaces the task's own, and a fixed countdown used when backoff is off.
 */
public final class RetryOptions {
    
    private static final RetryOptions EMPTY = new RetryOptions(null, null);
    
    private final Integer maxRetries;
    private final Duration countdown;
    
    private RetryOptions(Integer maxRetries, Duration countdown) {
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative");
        }
        this.maxRetries = maxRetries;
        this.countdown = countdown;
    }
    
    public static RetryOptions empty() {
        return EMPTY;
    }
    
    public static RetryOptions of(Integer maxRetries, Duration countdown) {
        return maxRetries == null && countdown == null ? EMPTY : new RetryOptions(maxRetries, countdown);
    }
    
    public static RetryOptions maxRetries(int maxRetries) {
        return new RetryOptions(maxRetries, null);
    }
    
    public RetryOptions withCountdown(Duration countdown) {
        return of(maxRetries, countdown);
    }
    
    public Integer getMaxRetries() {
        return maxRetries;
    }
    
    public Duration getCountdown() {
        return countdown;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryOptions that = (RetryOptions) o;
        return Objects.equals(maxRetries, that.maxRetries) && Objects.equals(countdown, that.countdown);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(maxRetries, countdown);
    }
    
    @Override
    public String toString() {
        return "RetryOptions{maxRetries=" + maxRetries + ", countdown=" + countdown + "}";
    }
}
