package com.enterprise.taskengine.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Calls a function until it stops failing with one of the caught exception
 * types, sleeping a growing interval between attempts.
 * <p>
 * With {@code maxRetries = N} the function is called at most {@code N + 1}
 * times and the last error is rethrown. Exceptions outside the caught types
 * propagate on the first occurrence. Intervals start at
 * {@code intervalStart}, grow by {@code intervalStep} and stay at the last
 * value once they pass {@code intervalStart + intervalMax}.
 */
public class RetryOverTime {
    
    private static final Logger logger = LoggerFactory.getLogger(RetryOverTime.class);
    
    /**
     * Called before each retry. Returns the number of seconds to sleep.
     */
    @FunctionalInterface
    public interface Errback {
        double onRetry(Exception error, Iterator<Double> intervals, int retries);
    }
    
    private final Set<Class<? extends Exception>> retryOn;
    private final Integer maxRetries;
    private final double intervalStart;
    private final double intervalStep;
    private final double intervalMax;
    private final Errback errback;
    private final Sleeper sleeper;
    
    private RetryOverTime(Builder builder) {
        this.retryOn = builder.retryOn;
        this.maxRetries = builder.maxRetries;
        this.intervalStart = builder.intervalStart;
        this.intervalStep = builder.intervalStep;
        this.intervalMax = builder.intervalMax;
        this.errback = builder.errback;
        this.sleeper = builder.sleeper;
    }
    
    public <T> T call(Callable<T> function) throws Exception {
        Iterator<Double> intervals = intervals(intervalStart, intervalMax + intervalStart, intervalStep);
        for (int retries = 0; ; retries++) {
            try {
                return function.call();
            } catch (Exception e) {
                if (!isCaught(e)) {
                    throw e;
                }
                if (maxRetries != null && retries >= maxRetries) {
                    throw e;
                }
                double seconds = errback != null ? errback.onRetry(e, intervals, retries) : intervals.next();
                logger.debug("Retry {} after {}; sleeping {}s", retries + 1, e.getClass().getSimpleName(), seconds);
                if (seconds > 0) {
                    sleeper.sleep(Duration.ofMillis(Math.round(seconds * 1000)));
                }
            }
        }
    }
    
    public Integer getMaxRetries() {
        return maxRetries;
    }
    
    private boolean isCaught(Exception error) {
        for (Class<? extends Exception> type : retryOn) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }
    
    /**
     * {@code start, start + step, ...} while the value stays at or below
     * {@code stop}, then the last value forever
     */
    public static Iterator<Double> intervals(double start, double stop, double step) {
        return new Iterator<>() {
            private double current = start;
            private double last = start;
            
            @Override
            public boolean hasNext() {
                return true;
            }
            
            @Override
            public Double next() {
                if (current <= stop) {
                    last = current;
                    current += step;
                }
                return last;
            }
        };
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private Set<Class<? extends Exception>> retryOn = new LinkedHashSet<>();
        private Integer maxRetries;
        private double intervalStart = 2.0;
        private double intervalStep = 2.0;
        private double intervalMax = 30.0;
        private Errback errback;
        private Sleeper sleeper = Sleeper.SYSTEM;
        
        @SafeVarargs
        public final Builder retryOn(Class<? extends Exception>... types) {
            this.retryOn = new LinkedHashSet<>(Arrays.asList(types));
            return this;
        }
        
        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }
        
        public Builder intervalStart(double intervalStart) {
            this.intervalStart = intervalStart;
            return this;
        }
        
        public Builder intervalStep(double intervalStep) {
            this.intervalStep = intervalStep;
            return this;
        }
        
        public Builder intervalMax(double intervalMax) {
            this.intervalMax = intervalMax;
            return this;
        }
        
        public Builder errback(Errback errback) {
            this.errback = errback;
            return this;
        }
        
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }
        
        public RetryOverTime build() {
            if (maxRetries != null && maxRetries < 0) {
                throw new IllegalArgumentException("Max retries cannot be negative");
            }
            if (sleeper == null) {
                throw new IllegalArgumentException("Sleeper is required");
            }
            return new RetryOverTime(this);
        }
    }
}
