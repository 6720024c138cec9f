package com.enterprise.taskengine.broker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A queue with its exchange, routing key and declaration arguments.
 * <p>
 * Application queues carry the exchange they are bound to; the queues of
 * the delayed delivery topology carry their TTL and dead letter arguments.
 */
public final class QueueDefinition {
    
    private final String name;
    private final ExchangeDefinition exchange;
    private final String routingKey;
    private final Map<String, Object> arguments;
    
    public QueueDefinition(String name, ExchangeDefinition exchange, String routingKey) {
        this(name, exchange, routingKey, Map.of());
    }
    
    public QueueDefinition(String name, ExchangeDefinition exchange, String routingKey, Map<String, Object> arguments) {
        this.name = Objects.requireNonNull(name, "name");
        this.exchange = exchange;
        this.routingKey = routingKey;
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
    
    public String getName() { return name; }
    
    public ExchangeDefinition getExchange() { return exchange; }
    
    public String getRoutingKey() { return routingKey; }
    
    public Map<String, Object> getArguments() { return arguments; }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueueDefinition that = (QueueDefinition) o;
        return name.equals(that.name) && Objects.equals(exchange, that.exchange)
            && Objects.equals(routingKey, that.routingKey) && arguments.equals(that.arguments);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, exchange, routingKey, arguments);
    }
    
    @Override
    public String toString() {
        return "Queue{" + name + ", exchange=" + exchange + ", routingKey=" + routingKey + "}";
    }
}
