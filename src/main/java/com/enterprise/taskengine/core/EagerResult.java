package com.enterprise.taskengine.core;

import com.enterprise.taskengine.exception.TaskExecutionException;

import java.time.Duration;
import java.util.List;

/**
 * Result of a task applied in the calling thread
 */
public class EagerResult {
    
    private final String taskId;
    private final Outcome outcome;
    private final int iterations;
    private final List<Duration> publishedCountdowns;
    
    public EagerResult(String taskId, Outcome outcome, int iterations, List<Duration> publishedCountdowns) {
        this.taskId = taskId;
        this.outcome = outcome;
        this.iterations = iterations;
        this.publishedCountdowns = List.copyOf(publishedCountdowns);
    }
    
    public String getTaskId() { return taskId; }
    
    public Outcome getOutcome() { return outcome; }
    
    public TaskStatus getStatus() { return outcome.getStatus(); }
    
    public boolean isSuccessful() { return outcome.isSuccess(); }
    
    public Object getValue() { return outcome.getValue(); }
    
    public Throwable getFailure() { return outcome.getException(); }
    
    /**
     * Number of times the handler ran, the first attempt included
     */
    public int getIterations() { return iterations; }
    
    /**
     * Countdowns the retries were published with, in order
     */
    public List<Duration> getPublishedCountdowns() { return publishedCountdowns; }
    
    /**
     * Return the task value or throw its failure
     */
    public Object get() throws TaskExecutionException {
        if (outcome.isSuccess()) {
            return outcome.getValue();
        }
        Throwable failure = outcome.getException();
        if (failure instanceof TaskExecutionException) {
            throw (TaskExecutionException) failure;
        }
        throw new TaskExecutionException("Task " + taskId + " ended as " + outcome.getStatus()
                                         + (failure != null ? ": " + failure : ""), failure);
    }
    
    @Override
    public String toString() {
        return String.format("EagerResult{taskId='%s', status=%s, iterations=%d}",
                           taskId, outcome.getStatus(), iterations);
    }
}
