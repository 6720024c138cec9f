package com.enterprise.taskengine.core;

import java.time.Instant;
import java.util.Map;

/**
 * Statistics about a worker engine
 */
public interface EngineStatistics {
    
    /**
     * Attempts received, including retries and revoked attempts
     */
    long getTotalAttemptsReceived();
    
    long getTotalTasksSucceeded();
    
    long getTotalTasksFailed();
    
    long getTotalRetries();
    
    /**
     * Attempts skipped because their id was revoked
     */
    long getTotalRevokedSkipped();
    
    /**
     * Ids currently in the revoked set
     */
    int getRevokedCount();
    
    double getAverageExecutionTimeMs();
    
    long getUptimeMs();
    
    Instant getStartedAt();
    
    /**
     * Known task ids by their latest status
     */
    Map<TaskStatus, Long> getTaskCountsByStatus();
    
    int getQueueSize();
    
    int getActiveThreadCount();
}
