package com.enterprise.taskengine.monitoring;

import com.enterprise.taskengine.core.Outcome;
import com.enterprise.taskengine.core.TaskAttempt;
import com.enterprise.taskengine.revocation.RevocationRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Collects and exposes metrics for the task engine
 */
public class MetricsCollector {
    
    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);
    
    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> taskNameCounters = new ConcurrentHashMap<>();
    
    private final Counter tasksSubmitted;
    private final Counter tasksSucceeded;
    private final Counter tasksFailed;
    private final Counter tasksRetried;
    private final Counter tasksRevoked;
    private final Counter setupSucceeded;
    private final Counter setupFailed;
    
    private final Timer taskExecutionTime;
    
    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        
        this.tasksSubmitted = Counter.builder("taskengine.tasks.submitted")
            .description("Task attempts received by the worker")
            .register(meterRegistry);
        
        this.tasksSucceeded = Counter.builder("taskengine.tasks.succeeded")
            .description("Task attempts that returned a value")
            .register(meterRegistry);
        
        this.tasksFailed = Counter.builder("taskengine.tasks.failed")
            .description("Task attempts that failed terminally")
            .register(meterRegistry);
        
        this.tasksRetried = Counter.builder("taskengine.tasks.retried")
            .description("Task attempts that published a retry")
            .register(meterRegistry);
        
        this.tasksRevoked = Counter.builder("taskengine.tasks.revoked")
            .description("Task attempts skipped because they were revoked")
            .register(meterRegistry);
        
        this.setupSucceeded = Counter.builder("taskengine.delayed_delivery.setup")
            .tag("outcome", "success")
            .description("Broker URLs on which delayed delivery was set up")
            .register(meterRegistry);
        
        this.setupFailed = Counter.builder("taskengine.delayed_delivery.setup")
            .tag("outcome", "failure")
            .description("Broker URLs on which delayed delivery could not be set up")
            .register(meterRegistry);
        
        this.taskExecutionTime = Timer.builder("taskengine.task.execution.time")
            .description("Task attempt execution time")
            .register(meterRegistry);
        
        logger.info("MetricsCollector initialized");
    }
    
    /**
     * Expose the size of the revoked set as a gauge
     */
    public void bindRevocationRegistry(RevocationRegistry registry) {
        Gauge.builder("taskengine.revoked.size", registry, RevocationRegistry::size)
            .description("Task ids currently revoked")
            .register(meterRegistry);
    }
    
    public void recordSubmitted(TaskAttempt attempt) {
        tasksSubmitted.increment();
        getTaskNameCounter(attempt.getTaskName(), "submitted").increment();
    }
    
    /**
     * Record the outcome of an executed attempt
     */
    public void recordOutcome(TaskAttempt attempt, Outcome outcome) {
        switch (outcome.getStatus()) {
            case SUCCEEDED:
                tasksSucceeded.increment();
                break;
            case RETRYING:
                tasksRetried.increment();
                break;
            case FAILED:
                tasksFailed.increment();
                break;
            case REVOKED:
                recordRevoked(attempt);
                return;
            default:
                return;
        }
        getTaskNameCounter(attempt.getTaskName(), outcome.getStatus().name().toLowerCase(Locale.ROOT)).increment();
        taskExecutionTime.record(outcome.getExecutionDurationMs(), TimeUnit.MILLISECONDS);
        
        logger.debug("Recorded {} for {}[{}] in {}ms", outcome.getStatus(), attempt.getTaskName(),
                    attempt.getTaskId(), outcome.getExecutionDurationMs());
    }
    
    public void recordRevoked(TaskAttempt attempt) {
        tasksRevoked.increment();
        getTaskNameCounter(attempt.getTaskName(), "revoked").increment();
    }
    
    public void recordDelayedDeliverySetup(String brokerUrl, boolean success) {
        if (success) {
            setupSucceeded.increment();
        } else {
            setupFailed.increment();
        }
        logger.debug("Recorded delayed delivery setup {} for {}", success ? "success" : "failure", brokerUrl);
    }
    
    private Counter getTaskNameCounter(String taskName, String status) {
        String key = taskName + "." + status;
        return taskNameCounters.computeIfAbsent(key, k ->
            Counter.builder("taskengine.task.name")
                .tag("name", taskName)
                .tag("status", status)
                .description("Task attempts by name and status")
                .register(meterRegistry)
        );
    }
    
    /**
     * Get all metrics as a map
     */
    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new ConcurrentHashMap<>();
        
        metrics.put("tasks.submitted", tasksSubmitted.count());
        metrics.put("tasks.succeeded", tasksSucceeded.count());
        metrics.put("tasks.failed", tasksFailed.count());
        metrics.put("tasks.retried", tasksRetried.count());
        metrics.put("tasks.revoked", tasksRevoked.count());
        metrics.put("delayed_delivery.setup.success", setupSucceeded.count());
        metrics.put("delayed_delivery.setup.failure", setupFailed.count());
        
        metrics.put("task.execution.time.mean", taskExecutionTime.mean(TimeUnit.MILLISECONDS));
        metrics.put("task.execution.time.max", taskExecutionTime.max(TimeUnit.MILLISECONDS));
        
        return metrics;
    }
    
    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
