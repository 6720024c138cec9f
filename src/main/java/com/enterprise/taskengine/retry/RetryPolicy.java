package com.enterprise.taskengine.retry;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Retry configuration of a task.
 * <p>
 * A task either sets a field or inherits it from its base policy; see
 * {@link #withOverrides(Overrides)}. A {@code null} max retries means the
 * task retries without limit.
 */
public final class RetryPolicy {
    
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(180);
    public static final Duration DEFAULT_BACKOFF_MAX = Duration.ofSeconds(600);
    public static final boolean DEFAULT_JITTER = true;
    
    private static final RetryPolicy DEFAULTS = builder().build();
    
    private final Set<Class<? extends Throwable>> autoretryFor;
    private final Set<Class<? extends Throwable>> dontAutoretryFor;
    private final RetryOptions retryOptions;
    private final Backoff backoff;
    private final Duration backoffMax;
    private final boolean jitter;
    private final Integer maxRetries;
    private final Duration defaultRetryDelay;
    
    private RetryPolicy(Builder builder) {
        this.autoretryFor = Collections.unmodifiableSet(new LinkedHashSet<>(builder.autoretryFor));
        this.dontAutoretryFor = Collections.unmodifiableSet(new LinkedHashSet<>(builder.dontAutoretryFor));
        this.retryOptions = builder.retryOptions;
        this.backoff = builder.backoff;
        this.backoffMax = builder.backoffMax;
        this.jitter = builder.jitter;
        this.maxRetries = builder.maxRetries;
        this.defaultRetryDelay = builder.defaultRetryDelay;
    }
    
    public static RetryPolicy defaults() {
        return DEFAULTS;
    }
    
    public Set<Class<? extends Throwable>> getAutoretryFor() { return autoretryFor; }
    
    public Set<Class<? extends Throwable>> getDontAutoretryFor() { return dontAutoretryFor; }
    
    public RetryOptions getRetryOptions() { return retryOptions; }
    
    public Backoff getBackoff() { return backoff; }
    
    public Duration getBackoffMax() { return backoffMax; }
    
    public boolean isJitter() { return jitter; }
    
    public Integer getMaxRetries() { return maxRetries; }
    
    public Duration getDefaultRetryDelay() { return defaultRetryDelay; }
    
    /**
     * Whether errors raised by the task can be retried without an explicit
     * call to retry
     */
    public boolean isAutoretryEnabled() {
        return !autoretryFor.isEmpty();
    }
    
    /**
     * Effective policy of a task that extends this one: each field set on
     * the overrides replaces this policy's value, the rest is inherited
     */
    public RetryPolicy withOverrides(Overrides overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Builder builder = toBuilder();
        if (overrides.autoretryFor != null) {
            builder.autoretryFor = overrides.autoretryFor;
        }
        if (overrides.dontAutoretryFor != null) {
            builder.dontAutoretryFor = overrides.dontAutoretryFor;
        }
        if (overrides.retryOptions != null) {
            builder.retryOptions = overrides.retryOptions;
        }
        if (overrides.backoff != null) {
            builder.backoff = overrides.backoff;
        }
        if (overrides.backoffMax != null) {
            builder.backoffMax = overrides.backoffMax;
        }
        if (overrides.jitter != null) {
            builder.jitter = overrides.jitter;
        }
        if (overrides.maxRetriesSet) {
            builder.maxRetries = overrides.maxRetries;
        }
        if (overrides.defaultRetryDelay != null) {
            builder.defaultRetryDelay = overrides.defaultRetryDelay;
        }
        return builder.build();
    }
    
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.autoretryFor = new LinkedHashSet<>(autoretryFor);
        builder.dontAutoretryFor = new LinkedHashSet<>(dontAutoretryFor);
        builder.retryOptions = retryOptions;
        builder.backoff = backoff;
        builder.backoffMax = backoffMax;
        builder.jitter = jitter;
        builder.maxRetries = maxRetries;
        builder.defaultRetryDelay = defaultRetryDelay;
        return builder;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static Overrides overrides() {
        return new Overrides();
    }
    
    @Override
    public String toString() {
        return "RetryPolicy{" +
               "autoretryFor=" + autoretryFor +
               ", dontAutoretryFor=" + dontAutoretryFor +
               ", retryOptions=" + retryOptions +
               ", backoff=" + backoff +
               ", backoffMax=" + backoffMax +
               ", jitter=" + jitter +
               ", maxRetries=" + maxRetries +
               ", defaultRetryDelay=" + defaultRetryDelay +
               '}';
    }
    
    /**
     * Builder for creating retry policies
     */
    public static class Builder {
        private Set<Class<? extends Throwable>> autoretryFor = new LinkedHashSet<>();
        private Set<Class<? extends Throwable>> dontAutoretryFor = new LinkedHashSet<>();
        private RetryOptions retryOptions = RetryOptions.empty();
        private Backoff backoff = Backoff.disabled();
        private Duration backoffMax = DEFAULT_BACKOFF_MAX;
        private boolean jitter = DEFAULT_JITTER;
        private Integer maxRetries = DEFAULT_MAX_RETRIES;
        private Duration defaultRetryDelay = DEFAULT_RETRY_DELAY;
        
        @SafeVarargs
        public final Builder autoretryFor(Class<? extends Throwable>... kinds) {
            this.autoretryFor = new LinkedHashSet<>(Arrays.asList(kinds));
            return this;
        }
        
        @SafeVarargs
        public final Builder dontAutoretryFor(Class<? extends Throwable>... kinds) {
            this.dontAutoretryFor = new LinkedHashSet<>(Arrays.asList(kinds));
            return this;
        }
        
        public Builder retryOptions(RetryOptions retryOptions) {
            this.retryOptions = retryOptions == null ? RetryOptions.empty() : retryOptions;
            return this;
        }
        
        public Builder backoff(Backoff backoff) {
            this.backoff = backoff == null ? Backoff.disabled() : backoff;
            return this;
        }
        
        public Builder backoffMax(Duration backoffMax) {
            this.backoffMax = backoffMax;
            return this;
        }
        
        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }
        
        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }
        
        public Builder unlimitedRetries() {
            this.maxRetries = null;
            return this;
        }
        
        public Builder defaultRetryDelay(Duration defaultRetryDelay) {
            this.defaultRetryDelay = defaultRetryDelay;
            return this;
        }
        
        public RetryPolicy build() {
            if (maxRetries != null && maxRetries < 0) {
                throw new IllegalArgumentException("Max retries cannot be negative");
            }
            if (defaultRetryDelay == null || defaultRetryDelay.isNegative()) {
                throw new IllegalArgumentException("Default retry delay must be zero or positive");
            }
            if (backoffMax != null && backoffMax.isNegative()) {
                throw new IllegalArgumentException("Backoff max cannot be negative");
            }
            return new RetryPolicy(this);
        }
    }
    
    /**
     * Fields a task sets on top of its base policy. Unset fields are
     * inherited.
     */
    public static class Overrides {
        private Set<Class<? extends Throwable>> autoretryFor;
        private Set<Class<? extends Throwable>> dontAutoretryFor;
        private RetryOptions retryOptions;
        private Backoff backoff;
        private Duration backoffMax;
        private Boolean jitter;
        private boolean maxRetriesSet;
        private Integer maxRetries;
        private Duration defaultRetryDelay;
        
        @SafeVarargs
        public final Overrides autoretryFor(Class<? extends Throwable>... kinds) {
            this.autoretryFor = new LinkedHashSet<>(Arrays.asList(kinds));
            return this;
        }
        
        @SafeVarargs
        public final Overrides dontAutoretryFor(Class<? extends Throwable>... kinds) {
            this.dontAutoretryFor = new LinkedHashSet<>(Arrays.asList(kinds));
            return this;
        }
        
        public Overrides retryOptions(RetryOptions retryOptions) {
            this.retryOptions = retryOptions;
            return this;
        }
        
        public Overrides backoff(Backoff backoff) {
            this.backoff = backoff;
            return this;
        }
        
        public Overrides backoffMax(Duration backoffMax) {
            this.backoffMax = backoffMax;
            return this;
        }
        
        public Overrides jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }
        
        /**
         * Set max retries; {@code null} sets it to unlimited rather than
         * inheriting
         */
        public Overrides maxRetries(Integer maxRetries) {
            this.maxRetriesSet = true;
            this.maxRetries = maxRetries;
            return this;
        }
        
        public Overrides defaultRetryDelay(Duration defaultRetryDelay) {
            this.defaultRetryDelay = defaultRetryDelay;
            return this;
        }
        
        public boolean isEmpty() {
            return autoretryFor == null && dontAutoretryFor == null && retryOptions == null
                && backoff == null && backoffMax == null && jitter == null
                && !maxRetriesSet && defaultRetryDelay == null;
        }
    }
}
