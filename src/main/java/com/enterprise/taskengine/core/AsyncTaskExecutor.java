package com.enterprise.taskengine.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Thread pool that runs task attempts, plus a scheduler for attempts whose
 * ETA lies in the future
 */
public class AsyncTaskExecutor {
    
    private static final Logger logger = LoggerFactory.getLogger(AsyncTaskExecutor.class);
    
    private final ThreadPoolExecutor executor;
    private final ScheduledExecutorService scheduler;
    private final Duration shutdownTimeout;
    private final AtomicLong totalAttemptsExecuted = new AtomicLong(0);
    private final AtomicLong totalAttemptsSucceeded = new AtomicLong(0);
    private final AtomicLong totalAttemptsRetried = new AtomicLong(0);
    private final AtomicLong totalAttemptsFailed = new AtomicLong(0);
    private final AtomicLong totalExecutionTime = new AtomicLong(0);
    
    public AsyncTaskExecutor(int corePoolSize, int maximumPoolSize,
                             long keepAliveTime, TimeUnit unit,
                             BlockingQueue<Runnable> workQueue) {
        this(corePoolSize, maximumPoolSize, keepAliveTime, unit, workQueue, Duration.ofSeconds(30));
    }
    
    public AsyncTaskExecutor(int corePoolSize, int maximumPoolSize,
                             long keepAliveTime, TimeUnit unit,
                             BlockingQueue<Runnable> workQueue, Duration shutdownTimeout) {
        
        this.executor = new ThreadPoolExecutor(
            corePoolSize,
            maximumPoolSize,
            keepAliveTime,
            unit,
            workQueue,
            new TaskThreadFactory("task-worker-"),
            new TaskRejectedExecutionHandler()
        );
        
        this.scheduler = Executors.newScheduledThreadPool(1, new TaskThreadFactory("task-eta-"));
        this.shutdownTimeout = shutdownTimeout;
        
        logger.info("AsyncTaskExecutor initialized with core={}, max={}, keepAlive={}ms",
                   corePoolSize, maximumPoolSize, unit.toMillis(keepAliveTime));
    }
    
    /**
     * Run an attempt on the pool. The future fails if the work throws, e.g.
     * when a retry cannot be published.
     */
    public CompletableFuture<Outcome> execute(TaskAttempt attempt, Supplier<Outcome> work) {
        totalAttemptsExecuted.incrementAndGet();
        
        return CompletableFuture.supplyAsync(() -> {
            long startTime = System.currentTimeMillis();
            try {
                Outcome outcome = work.get();
                totalExecutionTime.addAndGet(System.currentTimeMillis() - startTime);
                
                switch (outcome.getStatus()) {
                    case SUCCEEDED:
                        totalAttemptsSucceeded.incrementAndGet();
                        break;
                    case RETRYING:
                        totalAttemptsRetried.incrementAndGet();
                        break;
                    case FAILED:
                        totalAttemptsFailed.incrementAndGet();
                        break;
                    default:
                        break;
                }
                return outcome;
                
            } catch (RuntimeException e) {
                totalAttemptsFailed.incrementAndGet();
                totalExecutionTime.addAndGet(System.currentTimeMillis() - startTime);
                logger.error("Attempt {} could not be completed", attempt, e);
                throw e;
            }
        }, executor);
    }
    
    /**
     * Run an action after a delay; the returned future follows the action's
     */
    public <T> CompletableFuture<T> schedule(Supplier<CompletableFuture<T>> action, long delayMs) {
        CompletableFuture<T> future = new CompletableFuture<>();
        
        scheduler.schedule(() -> {
            try {
                action.get().whenComplete((result, throwable) -> {
                    if (throwable != null) {
                        future.completeExceptionally(throwable);
                    } else {
                        future.complete(result);
                    }
                });
            } catch (Exception e) {
                future.completeExceptionally(e);
            }
        }, delayMs, TimeUnit.MILLISECONDS);
        
        return future;
    }
    
    /**
     * Get executor statistics
     */
    public ExecutorStatistics getStatistics() {
        return new ExecutorStatistics() {
            @Override
            public long getTotalAttemptsExecuted() {
                return totalAttemptsExecuted.get();
            }
            
            @Override
            public long getTotalAttemptsSucceeded() {
                return totalAttemptsSucceeded.get();
            }
            
            @Override
            public long getTotalAttemptsRetried() {
                return totalAttemptsRetried.get();
            }
            
            @Override
            public long getTotalAttemptsFailed() {
                return totalAttemptsFailed.get();
            }
            
            @Override
            public double getAverageExecutionTimeMs() {
                long executed = totalAttemptsExecuted.get();
                return executed > 0 ? (double) totalExecutionTime.get() / executed : 0.0;
            }
            
            @Override
            public int getActiveThreadCount() {
                return executor.getActiveCount();
            }
            
            @Override
            public int getPoolSize() {
                return executor.getPoolSize();
            }
            
            @Override
            public int getQueueSize() {
                return executor.getQueue().size();
            }
        };
    }
    
    /**
     * Shutdown the executor gracefully
     */
    public CompletableFuture<Void> shutdown() {
        return CompletableFuture.runAsync(() -> {
            logger.info("Shutting down AsyncTaskExecutor...");
            
            scheduler.shutdownNow();
            executor.shutdown();
            
            try {
                if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("Executor did not terminate gracefully, forcing shutdown");
                    executor.shutdownNow();
                }
                
                logger.info("AsyncTaskExecutor shutdown completed");
                
            } catch (InterruptedException e) {
                logger.error("Interrupted during shutdown", e);
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        });
    }
    
    /**
     * Check if executor is running
     */
    public boolean isRunning() {
        return !executor.isShutdown() && !executor.isTerminated();
    }
    
    /**
     * Custom thread factory for task execution threads
     */
    private static class TaskThreadFactory implements ThreadFactory {
        private final AtomicLong threadNumber = new AtomicLong(1);
        private final String namePrefix;
        
        TaskThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }
        
        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + threadNumber.getAndIncrement());
            t.setDaemon(false);
            t.setPriority(Thread.NORM_PRIORITY);
            return t;
        }
    }
    
    /**
     * Custom rejected execution handler
     */
    private static class TaskRejectedExecutionHandler implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            logger.error("Task execution rejected - thread pool is full and queue is full");
            throw new RejectedExecutionException("Task execution rejected - system overloaded");
        }
    }
    
    /**
     * Statistics interface for the executor
     */
    public interface ExecutorStatistics {
        long getTotalAttemptsExecuted();
        long getTotalAttemptsSucceeded();
        long getTotalAttemptsRetried();
        long getTotalAttemptsFailed();
        double getAverageExecutionTimeMs();
        int getActiveThreadCount();
        int getPoolSize();
        int getQueueSize();
    }
}
