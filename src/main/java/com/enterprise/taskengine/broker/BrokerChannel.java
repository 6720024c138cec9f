package com.enterprise.taskengine.broker;

/**
 * An open channel on which topology can be declared.
 * <p>
 * Implementations report broker side failures as unchecked exceptions;
 * callers close the channel when done.
 */
public interface BrokerChannel extends AutoCloseable {
    
    void declareExchange(ExchangeDefinition exchange);
    
    void declareQueue(QueueDefinition queue);
    
    /**
     * Route messages from {@code exchange} matching {@code routingKey} to {@code queue}
     */
    void bindQueue(String queue, String exchange, String routingKey);
    
    /**
     * Route messages from {@code source} matching {@code routingKey} to the
     * {@code destination} exchange
     */
    void bindExchange(String destination, String source, String routingKey);
    
    @Override
    void close();
}
