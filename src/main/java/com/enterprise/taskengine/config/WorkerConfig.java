package com.enterprise.taskengine.config;

import com.enterprise.taskengine.retry.RetryPolicy;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration for a task engine worker
 */
public class WorkerConfig {
    
    private final ExecutorConfig executorConfig;
    private final RevocationConfig revocationConfig;
    private final RetryDefaults retryDefaults;
    private final DelayedDeliveryConfig delayedDeliveryConfig;
    private final MonitoringConfig monitoringConfig;
    private final Map<String, Object> customProperties;
    
    public WorkerConfig(ExecutorConfig executorConfig, RevocationConfig revocationConfig,
                        RetryDefaults retryDefaults, DelayedDeliveryConfig delayedDeliveryConfig,
                        MonitoringConfig monitoringConfig, Map<String, Object> customProperties) {
        this.executorConfig = executorConfig;
        this.revocationConfig = revocationConfig;
        this.retryDefaults = retryDefaults;
        this.delayedDeliveryConfig = delayedDeliveryConfig;
        this.monitoringConfig = monitoringConfig;
        this.customProperties = customProperties;
    }
    
    public ExecutorConfig getExecutorConfig() { return executorConfig; }
    public RevocationConfig getRevocationConfig() { return revocationConfig; }
    public RetryDefaults getRetryDefaults() { return retryDefaults; }
    public DelayedDeliveryConfig getDelayedDeliveryConfig() { return delayedDeliveryConfig; }
    public MonitoringConfig getMonitoringConfig() { return monitoringConfig; }
    public Map<String, Object> getCustomProperties() { return customProperties; }
    
    @Override
    public String toString() {
        return "WorkerConfig{executor=" + executorConfig + ", revocation=" + revocationConfig
            + ", retry=" + retryDefaults + ", delayedDelivery=" + delayedDeliveryConfig + "}";
    }
    
    /**
     * Executor configuration
     */
    public static class ExecutorConfig {
        private final int corePoolSize;
        private final int maximumPoolSize;
        private final Duration keepAliveTime;
        private final int queueCapacity;
        private final Duration shutdownTimeout;
        
        public ExecutorConfig(int corePoolSize, int maximumPoolSize, Duration keepAliveTime,
                              int queueCapacity, Duration shutdownTimeout) {
            this.corePoolSize = corePoolSize;
            this.maximumPoolSize = maximumPoolSize;
            this.keepAliveTime = keepAliveTime;
            this.queueCapacity = queueCapacity;
            this.shutdownTimeout = shutdownTimeout;
        }
        
        public int getCorePoolSize() { return corePoolSize; }
        public int getMaximumPoolSize() { return maximumPoolSize; }
        public Duration getKeepAliveTime() { return keepAliveTime; }
        public int getQueueCapacity() { return queueCapacity; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
        
        @Override
        public String toString() {
            return "{core=" + corePoolSize + ", max=" + maximumPoolSize + ", queue=" + queueCapacity + "}";
        }
    }
    
    /**
     * Revoked task ids: how long they are kept, how many, and where they
     * are saved between restarts ({@code null} for nowhere)
     */
    public static class RevocationConfig {
        private final Duration expires;
        private final int maxSize;
        private final String statePath;
        
        public RevocationConfig(Duration expires, int maxSize, String statePath) {
            this.expires = expires;
            this.maxSize = maxSize;
            this.statePath = statePath;
        }
        
        public Duration getExpires() { return expires; }
        public int getMaxSize() { return maxSize; }
        public String getStatePath() { return statePath; }
        public boolean isPersistent() { return statePath != null; }
        
        @Override
        public String toString() {
            return "{expires=" + expires + ", maxSize=" + maxSize + ", statePath=" + statePath + "}";
        }
    }
    
    /**
     * Retry settings tasks inherit unless they override them
     */
    public static class RetryDefaults {
        private final Integer maxRetries;
        private final Duration defaultRetryDelay;
        private final Duration backoffMax;
        private final boolean jitter;
        
        public RetryDefaults(Integer maxRetries, Duration defaultRetryDelay, Duration backoffMax, boolean jitter) {
            this.maxRetries = maxRetries;
            this.defaultRetryDelay = defaultRetryDelay;
            this.backoffMax = backoffMax;
            this.jitter = jitter;
        }
        
        public Integer getMaxRetries() { return maxRetries; }
        public Duration getDefaultRetryDelay() { return defaultRetryDelay; }
        public Duration getBackoffMax() { return backoffMax; }
        public boolean isJitter() { return jitter; }
        
        /**
         * Base policy for tasks registered on the worker
         */
        public RetryPolicy toRetryPolicy() {
            return RetryPolicy.builder()
                .maxRetries(maxRetries)
                .defaultRetryDelay(defaultRetryDelay)
                .backoffMax(backoffMax)
                .jitter(jitter)
                .build();
        }
        
        @Override
        public String toString() {
            return "{maxRetries=" + maxRetries + ", defaultRetryDelay=" + defaultRetryDelay
                + ", backoffMax=" + backoffMax + ", jitter=" + jitter + "}";
        }
    }
    
    /**
     * Native delayed delivery setup. The broker URL is either a {@code ;}
     * separated string or a list.
     */
    public static class DelayedDeliveryConfig {
        private final boolean enabled;
        private final Object brokerUrl;
        private final String queueType;
        private final int setupMaxRetries;
        private final Duration setupRetryInterval;
        
        public DelayedDeliveryConfig(boolean enabled, Object brokerUrl, String queueType,
                                     int setupMaxRetries, Duration setupRetryInterval) {
            this.enabled = enabled;
            this.brokerUrl = brokerUrl;
            this.queueType = queueType;
            this.setupMaxRetries = setupMaxRetries;
            this.setupRetryInterval = setupRetryInterval;
        }
        
        public boolean isEnabled() { return enabled; }
        public Object getBrokerUrl() { return brokerUrl; }
        public String getQueueType() { return queueType; }
        public int getSetupMaxRetries() { return setupMaxRetries; }
        public Duration getSetupRetryInterval() { return setupRetryInterval; }
        
        @Override
        public String toString() {
            return "{enabled=" + enabled + ", queueType=" + queueType + ", setupMaxRetries=" + setupMaxRetries + "}";
        }
    }
    
    /**
     * Monitoring configuration
     */
    public static class MonitoringConfig {
        private final boolean enableMetrics;
        
        public MonitoringConfig(boolean enableMetrics) {
            this.enableMetrics = enableMetrics;
        }
        
        public boolean isEnableMetrics() { return enableMetrics; }
    }
    
    /**
     * Builder for creating configurations
     */
    public static class Builder {
        private ExecutorConfig executorConfig = Defaults.defaultExecutorConfig();
        private RevocationConfig revocationConfig = Defaults.defaultRevocationConfig();
        private RetryDefaults retryDefaults = Defaults.defaultRetryDefaults();
        private DelayedDeliveryConfig delayedDeliveryConfig = Defaults.defaultDelayedDeliveryConfig();
        private MonitoringConfig monitoringConfig = Defaults.defaultMonitoringConfig();
        private Map<String, Object> customProperties = new java.util.HashMap<>();
        
        public Builder executorConfig(ExecutorConfig executorConfig) {
            this.executorConfig = executorConfig;
            return this;
        }
        
        public Builder revocationConfig(RevocationConfig revocationConfig) {
            this.revocationConfig = revocationConfig;
            return this;
        }
        
        public Builder retryDefaults(RetryDefaults retryDefaults) {
            this.retryDefaults = retryDefaults;
            return this;
        }
        
        public Builder delayedDeliveryConfig(DelayedDeliveryConfig delayedDeliveryConfig) {
            this.delayedDeliveryConfig = delayedDeliveryConfig;
            return this;
        }
        
        public Builder monitoringConfig(MonitoringConfig monitoringConfig) {
            this.monitoringConfig = monitoringConfig;
            return this;
        }
        
        public Builder customProperty(String key, Object value) {
            this.customProperties.put(key, value);
            return this;
        }
        
        public WorkerConfig build() {
            return new WorkerConfig(executorConfig, revocationConfig, retryDefaults,
                                    delayedDeliveryConfig, monitoringConfig, customProperties);
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Default configurations
     */
    public static class Defaults {
        public static ExecutorConfig defaultExecutorConfig() {
            return new ExecutorConfig(
                4, 16, Duration.ofMinutes(1), 1000, Duration.ofSeconds(30)
            );
        }
        
        public static RevocationConfig defaultRevocationConfig() {
            return new RevocationConfig(Duration.ofHours(3), 50000, null);
        }
        
        public static RetryDefaults defaultRetryDefaults() {
            return new RetryDefaults(
                RetryPolicy.DEFAULT_MAX_RETRIES, RetryPolicy.DEFAULT_RETRY_DELAY,
                RetryPolicy.DEFAULT_BACKOFF_MAX, RetryPolicy.DEFAULT_JITTER
            );
        }
        
        public static DelayedDeliveryConfig defaultDelayedDeliveryConfig() {
            return new DelayedDeliveryConfig(
                false, "amqp://guest@localhost:5672//", "quorum", 3, Duration.ofSeconds(1)
            );
        }
        
        public static MonitoringConfig defaultMonitoringConfig() {
            return new MonitoringConfig(true);
        }
    }
}
