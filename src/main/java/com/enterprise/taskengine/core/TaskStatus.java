package com.enterprise.taskengine.core;

/**
 * Represents the status of a task attempt on a worker
 */
public enum TaskStatus {
    PENDING,        // Accepted and waiting for its ETA
    RUNNING,        // Handler is executing
    SUCCEEDED,      // Handler returned a value
    RETRYING,       // Attempt failed and a new attempt was published
    FAILED,         // Terminal failure, no further attempts
    REVOKED;        // Skipped because the id was revoked
    
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == REVOKED;
    }
}
