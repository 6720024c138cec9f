package com.enterprise.taskengine.core;

import com.enterprise.taskengine.retry.RetryRequest;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of one task attempt
 */
public interface Outcome {
    
    TaskStatus getStatus();
    
    default boolean isSuccess() {
        return getStatus() == TaskStatus.SUCCEEDED;
    }
    
    default boolean isRetry() {
        return getStatus() == TaskStatus.RETRYING;
    }
    
    default boolean isFailure() {
        return getStatus() == TaskStatus.FAILED;
    }
    
    default boolean isRevoked() {
        return getStatus() == TaskStatus.REVOKED;
    }
    
    /**
     * Value returned by the handler
     */
    Object getValue();
    
    /**
     * Failure, or the error a retry was requested for
     */
    Throwable getException();
    
    /**
     * Retry request behind a retry outcome
     */
    RetryRequest getRetryRequest();
    
    /**
     * Delay before the published retry is delivered
     */
    Duration getCountdown();
    
    /**
     * Attempt that was published for a retry. {@code null} until the retry
     * controller has processed the request.
     */
    TaskAttempt getNextAttempt();
    
    Instant getCompletedAt();
    
    long getExecutionDurationMs();
    
    static Outcome success(Object value, long executionDurationMs) {
        return new OutcomeImpl(TaskStatus.SUCCEEDED, value, null, null, null, null, executionDurationMs);
    }
    
    static Outcome failure(Throwable exception, long executionDurationMs) {
        return new OutcomeImpl(TaskStatus.FAILED, null, exception, null, null, null, executionDurationMs);
    }
    
    static Outcome retry(RetryRequest request, TaskAttempt nextAttempt, Duration countdown, long executionDurationMs) {
        return new OutcomeImpl(TaskStatus.RETRYING, null, request.getException(), request,
                               countdown, nextAttempt, executionDurationMs);
    }
    
    /**
     * Retry asked for by a handler that does not throw
     */
    static Outcome retryRequested(RetryRequest request) {
        return retry(request, null, request.getCountdown(), 0);
    }
    
    static Outcome revoked() {
        return new OutcomeImpl(TaskStatus.REVOKED, null, null, null, null, null, 0);
    }
    
    /**
     * Default implementation of Outcome
     */
    class OutcomeImpl implements Outcome {
        private final TaskStatus status;
        private final Object value;
        private final Throwable exception;
        private final RetryRequest retryRequest;
        private final Duration countdown;
        private final TaskAttempt nextAttempt;
        private final Instant completedAt;
        private final long executionDurationMs;
        
        public OutcomeImpl(TaskStatus status, Object value, Throwable exception, RetryRequest retryRequest,
                           Duration countdown, TaskAttempt nextAttempt, long executionDurationMs) {
            this.status = status;
            this.value = value;
            this.exception = exception;
            this.retryRequest = retryRequest;
            this.countdown = countdown;
            this.nextAttempt = nextAttempt;
            this.completedAt = Instant.now();
            this.executionDurationMs = executionDurationMs;
        }
        
        @Override
        public TaskStatus getStatus() { return status; }
        
        @Override
        public Object getValue() { return value; }
        
        @Override
        public Throwable getException() { return exception; }
        
        @Override
        public RetryRequest getRetryRequest() { return retryRequest; }
        
        @Override
        public Duration getCountdown() { return countdown; }
        
        @Override
        public TaskAttempt getNextAttempt() { return nextAttempt; }
        
        @Override
        public Instant getCompletedAt() { return completedAt; }
        
        @Override
        public long getExecutionDurationMs() { return executionDurationMs; }
        
        @Override
        public String toString() {
            switch (status) {
                case SUCCEEDED:
                    return "Outcome{SUCCEEDED value=" + value + "}";
                case RETRYING:
                    return "Outcome{RETRYING countdown=" + countdown + ", exception=" + exception + "}";
                case FAILED:
                    return "Outcome{FAILED exception=" + exception + "}";
                default:
                    return "Outcome{" + status + "}";
            }
        }
    }
}
