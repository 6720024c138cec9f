package com.enterprise.taskengine.retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An explicit request to retry the running task.
 * <p>
 * Every field is optional. Unset args and kwargs mean the next attempt reuses
 * the current ones; an unset countdown falls back to backoff and then to the
 * task's default retry delay; an unset max retries keeps the task's limit.
 */
public final class RetryRequest {
    
    private final Throwable exception;
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private final Duration countdown;
    private final Integer maxRetries;
    private final boolean throwError;
    
    private RetryRequest(Builder builder) {
        this.exception = builder.exception;
        this.args = builder.args == null ? null : Collections.unmodifiableList(new ArrayList<>(builder.args));
        this.kwargs = builder.kwargs == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(builder.kwargs));
        this.countdown = builder.countdown;
        this.maxRetries = builder.maxRetries;
        this.throwError = builder.throwError;
    }
    
    public Throwable getException() { return exception; }
    
    public List<Object> getArgs() { return args; }
    
    public Map<String, Object> getKwargs() { return kwargs; }
    
    public Duration getCountdown() { return countdown; }
    
    public Integer getMaxRetries() { return maxRetries; }
    
    public boolean isThrowError() { return throwError; }
    
    public static RetryRequest of(Throwable exception) {
        return builder().exception(exception).build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public String toString() {
        return "RetryRequest{" +
               "exception=" + exception +
               ", args=" + args +
               ", kwargs=" + kwargs +
               ", countdown=" + countdown +
               ", maxRetries=" + maxRetries +
               ", throwError=" + throwError +
               '}';
    }
    
    public static class Builder {
        private Throwable exception;
        private List<Object> args;
        private Map<String, Object> kwargs;
        private Duration countdown;
        private Integer maxRetries;
        private boolean throwError = true;
        
        public Builder exception(Throwable exception) {
            this.exception = exception;
            return this;
        }
        
        public Builder args(List<Object> args) {
            this.args = args;
            return this;
        }
        
        public Builder args(Object... args) {
            this.args = Arrays.asList(args);
            return this;
        }
        
        public Builder kwargs(Map<String, Object> kwargs) {
            this.kwargs = kwargs;
            return this;
        }
        
        public Builder countdown(Duration countdown) {
            if (countdown != null && countdown.isNegative()) {
                throw new IllegalArgumentException("Countdown cannot be negative");
            }
            this.countdown = countdown;
            return this;
        }
        
        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }
        
        public Builder throwError(boolean throwError) {
            this.throwError = throwError;
            return this;
        }
        
        public RetryRequest build() {
            return new RetryRequest(this);
        }
    }
}
