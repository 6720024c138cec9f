package com.enterprise.taskengine.core;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A worker: admits task attempts, runs them and handles their retries.
 */
public interface WorkerEngine {
    
    /**
     * Register a task so that attempts naming it can run
     */
    void registerTask(TaskDefinition task);
    
    void unregisterTask(String taskName);
    
    /**
     * Run an attempt now, unless its id is revoked
     *
     * @return the outcome of this attempt; retries have their own outcomes,
     *         see {@link #getResult(String)}
     */
    CompletableFuture<Outcome> dispatch(TaskAttempt attempt);
    
    /**
     * Hold an attempt on the worker until its ETA, then dispatch it. The
     * revocation check happens when the ETA arrives.
     */
    CompletableFuture<Outcome> dispatch(TaskAttempt attempt, Instant eta);
    
    /**
     * Final outcome of a task id across all its attempts. Cancelling the
     * returned future stops waiting; finished tasks are only remembered for
     * a bounded number of newer completions.
     */
    CompletableFuture<Outcome> getResult(String taskId);
    
    /**
     * Revoke task ids; attempts for them are skipped from now on
     */
    void revoke(Collection<?> taskIds);
    
    boolean isRevoked(Object taskId);
    
    /**
     * Latest status of a task id seen by this worker
     */
    Optional<TaskStatus> getTaskStatus(String taskId);
    
    /**
     * Start the engine; runs the delayed delivery setup when it applies
     */
    void start();
    
    /**
     * Stop the engine gracefully
     */
    CompletableFuture<Void> stop();
    
    boolean isRunning();
    
    EngineStatistics getStatistics();
}
