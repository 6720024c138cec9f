package com.enterprise.taskengine.exception;

/**
 * Publishing a task message to the broker failed.
 */
public class PublishException extends RuntimeException {
    
    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
