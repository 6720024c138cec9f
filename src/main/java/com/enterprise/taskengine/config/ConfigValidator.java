package com.enterprise.taskengine.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates worker configuration.
 * <p>
 * Broker URLs and the delayed delivery queue type are checked when the
 * worker starts, not here.
 */
public class ConfigValidator {
    
    /**
     * Validate the configuration and return any validation errors
     */
    public List<ValidationError> validate(WorkerConfig config) {
        List<ValidationError> errors = new ArrayList<>();
        
        validateExecutorConfig(config.getExecutorConfig(), errors);
        validateRevocationConfig(config.getRevocationConfig(), errors);
        validateRetryDefaults(config.getRetryDefaults(), errors);
        validateDelayedDeliveryConfig(config.getDelayedDeliveryConfig(), errors);
        
        return errors;
    }
    
    private void validateExecutorConfig(WorkerConfig.ExecutorConfig config, List<ValidationError> errors) {
        if (config.getCorePoolSize() <= 0) {
            errors.add(new ValidationError("executor.corePoolSize",
                "Core pool size must be greater than 0"));
        }
        
        if (config.getMaximumPoolSize() <= 0) {
            errors.add(new ValidationError("executor.maximumPoolSize",
                "Maximum pool size must be greater than 0"));
        }
        
        if (config.getCorePoolSize() > config.getMaximumPoolSize()) {
            errors.add(new ValidationError("executor.poolSize",
                "Core pool size cannot be greater than maximum pool size"));
        }
        
        if (isMissingOrNegative(config.getKeepAliveTime())) {
            errors.add(new ValidationError("executor.keepAliveTime",
                "Keep alive time cannot be negative"));
        }
        
        if (config.getQueueCapacity() <= 0) {
            errors.add(new ValidationError("executor.queueCapacity",
                "Queue capacity must be greater than 0"));
        }
        
        if (isMissingOrNegative(config.getShutdownTimeout())) {
            errors.add(new ValidationError("executor.shutdownTimeout",
                "Shutdown timeout cannot be negative"));
        }
    }
    
    private void validateRevocationConfig(WorkerConfig.RevocationConfig config, List<ValidationError> errors) {
        if (isMissingOrNegative(config.getExpires())) {
            errors.add(new ValidationError("revocation.expires",
                "Expiry cannot be negative"));
        }
        
        if (config.getMaxSize() < 0) {
            errors.add(new ValidationError("revocation.maxSize",
                "Maximum size cannot be negative"));
        }
        
        if (config.getStatePath() != null && config.getStatePath().trim().isEmpty()) {
            errors.add(new ValidationError("revocation.statePath",
                "State path cannot be blank"));
        }
    }
    
    private void validateRetryDefaults(WorkerConfig.RetryDefaults config, List<ValidationError> errors) {
        if (config.getMaxRetries() != null && config.getMaxRetries() < 0) {
            errors.add(new ValidationError("retry.maxRetries",
                "Maximum retries cannot be negative"));
        }
        
        if (isMissingOrNegative(config.getDefaultRetryDelay())) {
            errors.add(new ValidationError("retry.defaultRetryDelay",
                "Default retry delay cannot be negative"));
        }
        
        if (config.getBackoffMax() != null && config.getBackoffMax().isNegative()) {
            errors.add(new ValidationError("retry.backoffMax",
                "Maximum backoff cannot be negative"));
        }
    }
    
    private void validateDelayedDeliveryConfig(WorkerConfig.DelayedDeliveryConfig config, List<ValidationError> errors) {
        if (config.getSetupMaxRetries() < 0) {
            errors.add(new ValidationError("delayedDelivery.setupMaxRetries",
                "Setup retries cannot be negative"));
        }
        
        if (isMissingOrNegative(config.getSetupRetryInterval())) {
            errors.add(new ValidationError("delayedDelivery.setupRetryInterval",
                "Setup retry interval cannot be negative"));
        }
    }
    
    private static boolean isMissingOrNegative(Duration duration) {
        return duration == null || duration.isNegative();
    }
    
    /**
     * Validation error
     */
    public static class ValidationError {
        private final String field;
        private final String message;
        
        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }
        
        public String getField() { return field; }
        public String getMessage() { return message; }
        
        @Override
        public String toString() {
            return String.format("%s: %s", field, message);
        }
    }
}
