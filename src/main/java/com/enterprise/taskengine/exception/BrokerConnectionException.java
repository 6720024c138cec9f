package com.enterprise.taskengine.exception;

/**
 * Broker could not be reached. Treated as transient by setup code.
 */
public class BrokerConnectionException extends Exception {
    
    private final String brokerUrl;
    
    public BrokerConnectionException(String brokerUrl, String message) {
        super(message);
        this.brokerUrl = brokerUrl;
    }
    
    public BrokerConnectionException(String brokerUrl, String message, Throwable cause) {
        super(message, cause);
        this.brokerUrl = brokerUrl;
    }
    
    public String getBrokerUrl() {
        return brokerUrl;
    }
}
