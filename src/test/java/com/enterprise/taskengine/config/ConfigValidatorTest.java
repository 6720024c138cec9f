package com.enterprise.taskengine.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ConfigValidatorTest {
    
    private final ConfigValidator validator = new ConfigValidator();
    
    private static List<String> fields(List<ConfigValidator.ValidationError> errors) {
        return errors.stream().map(ConfigValidator.ValidationError::getField).collect(Collectors.toList());
    }
    
    @Test
    void testDefaultsAreValid() {
        assertTrue(validator.validate(WorkerConfig.builder().build()).isEmpty());
    }
    
    @Test
    void testInvalidExecutor() {
        WorkerConfig config = WorkerConfig.builder()
            .executorConfig(new WorkerConfig.ExecutorConfig(8, 4, Duration.ofSeconds(-1), 0, null))
            .build();
        
        List<String> fields = fields(validator.validate(config));
        
        assertTrue(fields.contains("executor.poolSize"));
        assertTrue(fields.contains("executor.keepAliveTime"));
        assertTrue(fields.contains("executor.queueCapacity"));
        assertTrue(fields.contains("executor.shutdownTimeout"));
    }
    
    @Test
    void testInvalidRevocation() {
        WorkerConfig config = WorkerConfig.builder()
            .revocationConfig(new WorkerConfig.RevocationConfig(Duration.ofSeconds(-5), -1, "  "))
            .build();
        
        assertEquals(List.of("revocation.expires", "revocation.maxSize", "revocation.statePath"),
                     fields(validator.validate(config)));
    }
    
    @Test
    void testUnlimitedRetriesAreValid() {
        WorkerConfig config = WorkerConfig.builder()
            .retryDefaults(new WorkerConfig.RetryDefaults(null, Duration.ofSeconds(10), null, false))
            .build();
        
        assertTrue(validator.validate(config).isEmpty());
        assertNull(config.getRetryDefaults().toRetryPolicy().getMaxRetries());
    }
    
    @Test
    void testInvalidRetryDefaults() {
        WorkerConfig config = WorkerConfig.builder()
            .retryDefaults(new WorkerConfig.RetryDefaults(-1, null, Duration.ofSeconds(-1), true))
            .build();
        
        assertEquals(List.of("retry.maxRetries", "retry.defaultRetryDelay", "retry.backoffMax"),
                     fields(validator.validate(config)));
    }
    
    @Test
    void testInvalidDelayedDelivery() {
        WorkerConfig config = WorkerConfig.builder()
            .delayedDeliveryConfig(new WorkerConfig.DelayedDeliveryConfig(
                true, "amqp://localhost//", "quorum", -1, Duration.ofSeconds(-1)))
            .build();
        
        assertEquals(List.of("delayedDelivery.setupMaxRetries", "delayedDelivery.setupRetryInterval"),
                     fields(validator.validate(config)));
    }
}
