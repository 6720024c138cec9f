package com.enterprise.taskengine;

import com.enterprise.taskengine.broker.BrokerConnection;
import com.enterprise.taskengine.broker.Enqueuer;
import com.enterprise.taskengine.broker.QueueDefinition;
import com.enterprise.taskengine.config.ConfigValidator;
import com.enterprise.taskengine.config.WorkerConfig;
import com.enterprise.taskengine.core.AsyncTaskExecutor;
import com.enterprise.taskengine.core.WorkerEngineImpl;
import com.enterprise.taskengine.delivery.AmqpQuorumQueueDetector;
import com.enterprise.taskengine.delivery.DelayedDeliveryContext;
import com.enterprise.taskengine.delivery.DelayedDeliverySetup;
import com.enterprise.taskengine.monitoring.MetricsCollector;
import com.enterprise.taskengine.retry.Sleeper;
import com.enterprise.taskengine.revocation.MonotonicClock;
import com.enterprise.taskengine.revocation.RevocationRegistry;
import com.enterprise.taskengine.revocation.RevocationStateStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Factory for creating and configuring worker engines
 */
public class WorkerEngineFactory {
    
    private static final Logger logger = LoggerFactory.getLogger(WorkerEngineFactory.class);
    
    /**
     * Create a worker engine with default configuration
     */
    public static WorkerEngineImpl createDefault() {
        return create(WorkerConfig.builder().build());
    }
    
    /**
     * Create a worker engine that retries locally and has no broker
     */
    public static WorkerEngineImpl create(WorkerConfig config) {
        return create(config, null, null, List.of());
    }
    
    /**
     * Create a worker engine attached to a broker.
     *
     * @param enqueuer where retries are published, or null to retry locally
     * @param connection broker connection used for delayed delivery setup,
     *                   or null to skip that step
     * @param queues the application queues consumed by this worker
     */
    public static WorkerEngineImpl create(WorkerConfig config, Enqueuer enqueuer,
                                          BrokerConnection connection, Collection<QueueDefinition> queues) {
        ConfigValidator validator = new ConfigValidator();
        List<ConfigValidator.ValidationError> errors = validator.validate(config);
        
        if (!errors.isEmpty()) {
            StringBuilder errorMsg = new StringBuilder("Configuration validation failed:\n");
            errors.forEach(error -> errorMsg.append("  - ").append(error).append("\n"));
            throw new IllegalArgumentException(errorMsg.toString());
        }
        
        logger.info("Creating WorkerEngine with configuration: {}", config);
        
        AsyncTaskExecutor executor = createExecutor(config.getExecutorConfig());
        RevocationRegistry revocationRegistry = createRevocationRegistry(config.getRevocationConfig());
        
        WorkerEngineImpl.Builder builder = WorkerEngineImpl.builder()
            .executor(executor)
            .revocationRegistry(revocationRegistry)
            .defaultRetryPolicy(config.getRetryDefaults().toRetryPolicy())
            .enqueuer(enqueuer);
        
        MetricsCollector metricsCollector = null;
        if (config.getMonitoringConfig().isEnableMetrics()) {
            MeterRegistry meterRegistry = new SimpleMeterRegistry();
            metricsCollector = new MetricsCollector(meterRegistry);
            metricsCollector.bindRevocationRegistry(revocationRegistry);
            builder.metricsCollector(metricsCollector);
        }
        
        if (config.getRevocationConfig().isPersistent()) {
            builder.stateStore(new RevocationStateStore(config.getRevocationConfig().getStatePath()));
        }
        
        WorkerConfig.DelayedDeliveryConfig delivery = config.getDelayedDeliveryConfig();
        if (delivery.isEnabled() && connection != null) {
            DelayedDeliverySetup setup = new DelayedDeliverySetup(
                new AmqpQuorumQueueDetector(),
                delivery.getSetupMaxRetries(),
                delivery.getSetupRetryInterval(),
                Sleeper.SYSTEM,
                metricsCollector);
            DelayedDeliveryContext context = DelayedDeliveryContext.builder()
                .brokerUrl(delivery.getBrokerUrl())
                .queueType(delivery.getQueueType())
                .queues(queues)
                .connection(connection)
                .build();
            builder.delayedDelivery(setup, context);
        } else if (delivery.isEnabled()) {
            logger.warn("Delayed delivery is enabled but no broker connection was supplied; skipping setup");
        }
        
        WorkerEngineImpl engine = builder.build();
        logger.info("WorkerEngine created successfully");
        return engine;
    }
    
    private static AsyncTaskExecutor createExecutor(WorkerConfig.ExecutorConfig config) {
        BlockingQueue<Runnable> workQueue = new LinkedBlockingQueue<>(config.getQueueCapacity());
        
        return new AsyncTaskExecutor(
            config.getCorePoolSize(),
            config.getMaximumPoolSize(),
            config.getKeepAliveTime().toMillis(),
            TimeUnit.MILLISECONDS,
            workQueue,
            config.getShutdownTimeout()
        );
    }
    
    private static RevocationRegistry createRevocationRegistry(WorkerConfig.RevocationConfig config) {
        return new RevocationRegistry(config.getExpires(), config.getMaxSize(), MonotonicClock.SYSTEM);
    }
}
