package com.enterprise.taskengine.delivery;

import com.enterprise.taskengine.broker.BrokerConnection;
import com.enterprise.taskengine.broker.QueueDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Inputs of the delayed delivery setup, as read from the worker's
 * configuration. Values are kept raw; validation happens in
 * {@link DelayedDeliverySetup#start}.
 */
public final class DelayedDeliveryContext {
    
    private final Object brokerUrl;
    private final String queueType;
    private final List<QueueDefinition> queues;
    private final BrokerConnection connection;
    
    private DelayedDeliveryContext(Builder builder) {
        this.brokerUrl = builder.brokerUrl;
        this.queueType = builder.queueType;
        this.queues = Collections.unmodifiableList(new ArrayList<>(builder.queues));
        this.connection = builder.connection;
    }
    
    /**
     * A {@code ;} separated string or a list of URLs
     */
    public Object getBrokerUrl() { return brokerUrl; }
    
    public String getQueueType() { return queueType; }
    
    public List<QueueDefinition> getQueues() { return queues; }
    
    public BrokerConnection getConnection() { return connection; }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private Object brokerUrl;
        private String queueType;
        private Collection<QueueDefinition> queues = List.of();
        private BrokerConnection connection;
        
        public Builder brokerUrl(Object brokerUrl) {
            this.brokerUrl = brokerUrl;
            return this;
        }
        
        public Builder queueType(String queueType) {
            this.queueType = queueType;
            return this;
        }
        
        public Builder queues(Collection<QueueDefinition> queues) {
            this.queues = queues == null ? List.of() : queues;
            return this;
        }
        
        public Builder connection(BrokerConnection connection) {
            this.connection = connection;
            return this;
        }
        
        public DelayedDeliveryContext build() {
            return new DelayedDeliveryContext(this);
        }
    }
}
