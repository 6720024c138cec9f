package com.enterprise.taskengine.broker;

import java.util.Locale;

/**
 * AMQP exchange types
 */
public enum ExchangeType {
    DIRECT,
    TOPIC,
    FANOUT,
    HEADERS;
    
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    @Override
    public String toString() {
        return getName();
    }
}
