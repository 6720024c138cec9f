package com.enterprise.taskengine.exception;

/**
 * Declaring or binding broker entities failed for a reason other than
 * connectivity.
 */
public class TopologyException extends Exception {
    
    public enum Operation {
        DECLARE,
        BIND
    }
    
    private final Operation operation;
    
    public TopologyException(Operation operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }
    
    public Operation getOperation() {
        return operation;
    }
}
