package com.enterprise.taskengine.core;

import com.enterprise.taskengine.broker.Enqueuer;
import com.enterprise.taskengine.delivery.DelayedDeliveryContext;
import com.enterprise.taskengine.delivery.DelayedDeliverySetup;
import com.enterprise.taskengine.exception.TaskNotRegisteredException;
import com.enterprise.taskengine.monitoring.MetricsCollector;
import com.enterprise.taskengine.retry.BackoffPolicy;
import com.enterprise.taskengine.retry.ErrorClassifier;
import com.enterprise.taskengine.retry.ExceptionTypeClassifier;
import com.enterprise.taskengine.retry.RetryController;
import com.enterprise.taskengine.retry.RetryPolicy;
import com.enterprise.taskengine.revocation.RevocationRegistry;
import com.enterprise.taskengine.revocation.RevocationStateStore;
import com.enterprise.taskengine.serialization.ExceptionCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Main implementation of the WorkerEngine.
 * <p>
 * The engine remembers the state of every task it has seen. Once a task
 * reaches a terminal status it stays queryable until more than
 * {@code finishedRetention} newer tasks have finished; then the oldest
 * finished entries are forgotten.
 */
public class WorkerEngineImpl implements WorkerEngine {
    
    private static final Logger logger = LoggerFactory.getLogger(WorkerEngineImpl.class);
    
    public static final int DEFAULT_FINISHED_RETENTION = 10000;
    
    private final TaskRegistry taskRegistry;
    private final AsyncTaskExecutor executor;
    private final RevocationRegistry revocationRegistry;
    private final RetryController retryController;
    private final RetryPolicy defaultRetryPolicy;
    private final MetricsCollector metricsCollector;
    private final RevocationStateStore stateStore;
    private final DelayedDeliverySetup delayedDeliverySetup;
    private final DelayedDeliveryContext delayedDeliveryContext;
    
    private final Map<String, AttemptState> states = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Outcome>> waiters = new ConcurrentHashMap<>();
    private final Queue<String> finishedOrder = new ConcurrentLinkedQueue<>();
    private final AtomicInteger finishedCount = new AtomicInteger(0);
    private final int finishedRetention;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong totalAttemptsReceived = new AtomicLong(0);
    private final AtomicLong totalRevokedSkipped = new AtomicLong(0);
    private volatile Instant startedAt;
    
    private WorkerEngineImpl(Builder builder) {
        this.taskRegistry = builder.taskRegistry;
        this.executor = builder.executor;
        this.revocationRegistry = builder.revocationRegistry;
        this.defaultRetryPolicy = builder.defaultRetryPolicy;
        this.metricsCollector = builder.metricsCollector;
        this.stateStore = builder.stateStore;
        this.delayedDeliverySetup = builder.delayedDeliverySetup;
        this.delayedDeliveryContext = builder.delayedDeliveryContext;
        this.finishedRetention = builder.finishedRetention;
        
        Enqueuer enqueuer = builder.enqueuer != null ? builder.enqueuer : new LocalEnqueuer(this);
        this.retryController = new RetryController(enqueuer, builder.backoffPolicy,
                                                   builder.errorClassifier, builder.exceptionCodec);
        this.startedAt = Instant.now();
    }
    
    @Override
    public void registerTask(TaskDefinition task) {
        taskRegistry.register(task);
    }
    
    @Override
    public void unregisterTask(String taskName) {
        taskRegistry.unregister(taskName);
    }
    
    /**
     * Start a task definition that inherits this worker's retry defaults
     */
    public TaskDefinition.Builder defineTask(String name, TaskHandler handler) {
        return TaskDefinition.builder().name(name).handler(handler).basePolicy(defaultRetryPolicy);
    }
    
    @Override
    public CompletableFuture<Outcome> dispatch(TaskAttempt attempt) {
        ensureRunning();
        totalAttemptsReceived.incrementAndGet();
        if (metricsCollector != null) {
            metricsCollector.recordSubmitted(attempt);
        }
        
        revocationRegistry.purge();
        if (revocationRegistry.contains(attempt.getTaskId())) {
            logger.info("Discarding revoked task: {}[{}]", attempt.getTaskName(), attempt.getTaskId());
            totalRevokedSkipped.incrementAndGet();
            Outcome outcome = Outcome.revoked();
            record(attempt, outcome);
            return CompletableFuture.completedFuture(outcome);
        }
        
        Optional<TaskDefinition> task = taskRegistry.find(attempt.getTaskName());
        if (task.isEmpty()) {
            logger.error("Received unregistered task of type {}", attempt.getTaskName());
            Outcome outcome = Outcome.failure(new TaskNotRegisteredException(attempt.getTaskName()), 0);
            record(attempt, outcome);
            return CompletableFuture.completedFuture(outcome);
        }
        
        TaskDefinition definition = task.get();
        TaskAttempt admitted = admit(definition, attempt);
        updateState(admitted, TaskStatus.RUNNING);
        return executor.execute(admitted, () -> retryController.execute(definition, admitted))
            .whenComplete((outcome, throwable) -> {
                if (throwable != null) {
                    Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                        ? throwable.getCause() : throwable;
                    CompletableFuture<Outcome> failed = new CompletableFuture<>();
                    failed.completeExceptionally(cause);
                    settle(admitted, TaskStatus.FAILED, failed);
                } else {
                    record(admitted, outcome);
                }
            });
    }
    
    @Override
    public CompletableFuture<Outcome> dispatch(TaskAttempt attempt, Instant eta) {
        long delayMs = eta == null ? 0 : Duration.between(Instant.now(), eta).toMillis();
        if (delayMs <= 0) {
            return dispatch(attempt);
        }
        
        ensureRunning();
        updateState(attempt, TaskStatus.PENDING);
        logger.debug("Holding {} until {}", attempt, eta);
        return executor.schedule(() -> dispatch(attempt), delayMs);
    }
    
    @Override
    public CompletableFuture<Outcome> getResult(String taskId) {
        AttemptState state = states.get(taskId);
        if (state != null && state.settled != null) {
            return state.settled;
        }
        
        CompletableFuture<Outcome> waiter = waiters.computeIfAbsent(taskId, this::newWaiter);
        // the task may have finished between the lookup and the registration
        AttemptState latest = states.get(taskId);
        if (latest != null && latest.settled != null) {
            notifyWaiter(taskId, latest.settled);
        }
        return waiter;
    }
    
    private CompletableFuture<Outcome> newWaiter(String taskId) {
        CompletableFuture<Outcome> waiter = new CompletableFuture<>();
        waiter.whenComplete((outcome, throwable) -> waiters.remove(taskId, waiter));
        return waiter;
    }
    
    @Override
    public void revoke(Collection<?> taskIds) {
        if (taskIds.isEmpty()) {
            return;
        }
        revocationRegistry.update(taskIds);
        logger.info("Tasks flagged as revoked: {}", taskIds);
    }
    
    @Override
    public boolean isRevoked(Object taskId) {
        return revocationRegistry.contains(taskId);
    }
    
    @Override
    public Optional<TaskStatus> getTaskStatus(String taskId) {
        AttemptState state = states.get(taskId);
        return state == null ? Optional.empty() : Optional.of(state.status);
    }
    
    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            logger.info("Starting WorkerEngine...");
            startedAt = Instant.now();
            
            try {
                if (stateStore != null) {
                    stateStore.restore(revocationRegistry);
                }
                startDelayedDelivery();
            } catch (RuntimeException e) {
                running.set(false);
                logger.error("WorkerEngine failed to start: {}", e.getMessage());
                throw e;
            }
            
            logger.info("WorkerEngine started successfully");
        }
    }
    
    private void startDelayedDelivery() {
        if (delayedDeliverySetup == null || delayedDeliveryContext == null) {
            return;
        }
        if (!delayedDeliverySetup.includeIf(delayedDeliveryContext)) {
            logger.debug("Native delayed delivery does not apply to this worker");
            return;
        }
        delayedDeliverySetup.start(delayedDeliveryContext);
    }
    
    @Override
    public CompletableFuture<Void> stop() {
        return CompletableFuture.runAsync(() -> {
            boolean wasRunning = running.getAndSet(false);
            if (wasRunning) {
                logger.info("Stopping WorkerEngine...");
            }
            
            if (executor.isRunning()) {
                executor.shutdown().join();
            }
            
            if (stateStore != null) {
                if (wasRunning) {
                    stateStore.save(revocationRegistry);
                }
                stateStore.close();
            }
            
            waiters.values().forEach(future -> future.cancel(false));
            
            if (wasRunning) {
                logger.info("WorkerEngine stopped successfully");
            }
        });
    }
    
    @Override
    public boolean isRunning() {
        return running.get();
    }
    
    public RevocationRegistry getRevocationRegistry() {
        return revocationRegistry;
    }
    
    public RetryPolicy getDefaultRetryPolicy() {
        return defaultRetryPolicy;
    }
    
    @Override
    public EngineStatistics getStatistics() {
        AsyncTaskExecutor.ExecutorStatistics executorStats = executor.getStatistics();
        
        return new EngineStatistics() {
            @Override
            public long getTotalAttemptsReceived() {
                return totalAttemptsReceived.get();
            }
            
            @Override
            public long getTotalTasksSucceeded() {
                return executorStats.getTotalAttemptsSucceeded();
            }
            
            @Override
            public long getTotalTasksFailed() {
                return executorStats.getTotalAttemptsFailed();
            }
            
            @Override
            public long getTotalRetries() {
                return executorStats.getTotalAttemptsRetried();
            }
            
            @Override
            public long getTotalRevokedSkipped() {
                return totalRevokedSkipped.get();
            }
            
            @Override
            public int getRevokedCount() {
                return revocationRegistry.size();
            }
            
            @Override
            public double getAverageExecutionTimeMs() {
                return executorStats.getAverageExecutionTimeMs();
            }
            
            @Override
            public long getUptimeMs() {
                return Instant.now().toEpochMilli() - startedAt.toEpochMilli();
            }
            
            @Override
            public Instant getStartedAt() {
                return startedAt;
            }
            
            @Override
            public Map<TaskStatus, Long> getTaskCountsByStatus() {
                Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
                for (TaskStatus status : TaskStatus.values()) {
                    counts.put(status, 0L);
                }
                states.values().forEach(state -> counts.merge(state.status, 1L, Long::sum));
                return counts;
            }
            
            @Override
            public int getQueueSize() {
                return executorStats.getQueueSize();
            }
            
            @Override
            public int getActiveThreadCount() {
                return executorStats.getActiveThreadCount();
            }
        };
    }
    
    private void ensureRunning() {
        if (!running.get()) {
            throw new IllegalStateException("WorkerEngine is not running");
        }
    }
    
    /**
     * Stamp the task policy's retry limit on an incoming attempt
     */
    private static TaskAttempt admit(TaskDefinition task, TaskAttempt attempt) {
        Integer limit = task.getRetryPolicy().getMaxRetries();
        return Objects.equals(limit, attempt.getMaxRetries()) ? attempt : attempt.withMaxRetries(limit);
    }
    
    private void record(TaskAttempt attempt, Outcome outcome) {
        if (metricsCollector != null) {
            metricsCollector.recordOutcome(attempt, outcome);
        }
        if (outcome.getStatus().isTerminal()) {
            settle(attempt, outcome.getStatus(), CompletableFuture.completedFuture(outcome));
        } else {
            updateState(attempt, outcome.getStatus());
        }
    }
    
    private void updateState(TaskAttempt attempt, TaskStatus status) {
        settle(attempt, status, null);
    }
    
    /**
     * The state of the most recent attempt of a task wins. A terminal state
     * wakes up whoever waits on the task and counts towards the retention.
     */
    private void settle(TaskAttempt attempt, TaskStatus status, CompletableFuture<Outcome> settled) {
        String taskId = attempt.getTaskId();
        AttemptState update = new AttemptState(attempt.getRetries(), status, settled);
        AttemptState winner = states.merge(taskId, update,
                                           (current, next) -> next.retries >= current.retries ? next : current);
        if (winner != update || settled == null) {
            return;
        }
        
        notifyWaiter(taskId, settled);
        finishedOrder.add(taskId);
        if (finishedCount.incrementAndGet() > finishedRetention) {
            evictFinished();
        }
    }
    
    private void notifyWaiter(String taskId, CompletableFuture<Outcome> settled) {
        CompletableFuture<Outcome> waiter = waiters.remove(taskId);
        if (waiter == null) {
            return;
        }
        settled.whenComplete((outcome, throwable) -> {
            if (throwable != null) {
                waiter.completeExceptionally(throwable);
            } else {
                waiter.complete(outcome);
            }
        });
    }
    
    private void evictFinished() {
        int evicted = 0;
        while (finishedCount.get() > finishedRetention) {
            String taskId = finishedOrder.poll();
            if (taskId == null) {
                break;
            }
            finishedCount.decrementAndGet();
            // a task dispatched again since it finished is kept
            if (states.computeIfPresent(taskId, (id, state) -> state.settled != null ? null : state) == null) {
                evicted++;
            }
        }
        if (evicted > 0) {
            logger.debug("Forgot {} finished tasks, {} still tracked", evicted, states.size());
        }
    }
    
    /**
     * Number of tasks whose state is currently remembered
     */
    int getTrackedTaskCount() {
        return states.size();
    }
    
    /**
     * Number of result futures still waiting for their task
     */
    int getPendingResultCount() {
        return waiters.size();
    }
    
    private static final class AttemptState {
        private final int retries;
        private final TaskStatus status;
        private final CompletableFuture<Outcome> settled;
        
        AttemptState(int retries, TaskStatus status, CompletableFuture<Outcome> settled) {
            this.retries = retries;
            this.status = status;
            this.settled = settled;
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private TaskRegistry taskRegistry = new TaskRegistry();
        private AsyncTaskExecutor executor;
        private RevocationRegistry revocationRegistry = new RevocationRegistry();
        private RetryPolicy defaultRetryPolicy = RetryPolicy.defaults();
        private Enqueuer enqueuer;
        private BackoffPolicy backoffPolicy = new BackoffPolicy();
        private ErrorClassifier errorClassifier = new ExceptionTypeClassifier();
        private ExceptionCodec exceptionCodec = new ExceptionCodec();
        private MetricsCollector metricsCollector;
        private RevocationStateStore stateStore;
        private DelayedDeliverySetup delayedDeliverySetup;
        private DelayedDeliveryContext delayedDeliveryContext;
        private int finishedRetention = DEFAULT_FINISHED_RETENTION;
        
        public Builder taskRegistry(TaskRegistry taskRegistry) {
            this.taskRegistry = taskRegistry;
            return this;
        }
        
        public Builder executor(AsyncTaskExecutor executor) {
            this.executor = executor;
            return this;
        }
        
        public Builder revocationRegistry(RevocationRegistry revocationRegistry) {
            this.revocationRegistry = revocationRegistry;
            return this;
        }
        
        public Builder defaultRetryPolicy(RetryPolicy defaultRetryPolicy) {
            this.defaultRetryPolicy = defaultRetryPolicy;
            return this;
        }
        
        /**
         * Where retries are published; by default they are dispatched back
         * into this engine after their countdown
         */
        public Builder enqueuer(Enqueuer enqueuer) {
            this.enqueuer = enqueuer;
            return this;
        }
        
        public Builder backoffPolicy(BackoffPolicy backoffPolicy) {
            this.backoffPolicy = backoffPolicy;
            return this;
        }
        
        public Builder errorClassifier(ErrorClassifier errorClassifier) {
            this.errorClassifier = errorClassifier;
            return this;
        }
        
        public Builder exceptionCodec(ExceptionCodec exceptionCodec) {
            this.exceptionCodec = exceptionCodec;
            return this;
        }
        
        public Builder metricsCollector(MetricsCollector metricsCollector) {
            this.metricsCollector = metricsCollector;
            return this;
        }
        
        public Builder stateStore(RevocationStateStore stateStore) {
            this.stateStore = stateStore;
            return this;
        }
        
        public Builder delayedDelivery(DelayedDeliverySetup setup, DelayedDeliveryContext context) {
            this.delayedDeliverySetup = setup;
            this.delayedDeliveryContext = context;
            return this;
        }
        
        /**
         * How many finished tasks stay queryable through
         * {@link WorkerEngine#getTaskStatus(String)} and
         * {@link WorkerEngine#getResult(String)}
         */
        public Builder finishedRetention(int finishedRetention) {
            this.finishedRetention = finishedRetention;
            return this;
        }
        
        public WorkerEngineImpl build() {
            if (executor == null) {
                throw new IllegalArgumentException("Executor is required");
            }
            if (finishedRetention <= 0) {
                throw new IllegalArgumentException("Finished retention must be positive");
            }
            return new WorkerEngineImpl(this);
        }
    }
}
