package com.enterprise.taskengine.exception;

/**
 * Invalid or missing worker configuration. Fatal: never retried.
 */
public class ConfigurationException extends IllegalArgumentException {
    
    public ConfigurationException(String message) {
        super(message);
    }
}
