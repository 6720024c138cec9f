package com.enterprise.taskengine.broker;

import com.enterprise.taskengine.exception.BrokerConnectionException;

/**
 * Opens channels to a broker
 */
@FunctionalInterface
public interface BrokerConnection {
    
    /**
     * @throws BrokerConnectionException if the broker cannot be reached
     */
    BrokerChannel connect(String brokerUrl) throws BrokerConnectionException;
}
