package com.enterprise.taskengine.broker;

import java.util.Objects;

/**
 * Name and type of an exchange
 */
public final class ExchangeDefinition {
    
    private final String name;
    private final ExchangeType type;
    private final boolean durable;
    
    public ExchangeDefinition(String name, ExchangeType type) {
        this(name, type, true);
    }
    
    public ExchangeDefinition(String name, ExchangeType type, boolean durable) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.durable = durable;
    }
    
    public String getName() { return name; }
    
    public ExchangeType getType() { return type; }
    
    public boolean isDurable() { return durable; }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExchangeDefinition that = (ExchangeDefinition) o;
        return durable == that.durable && name.equals(that.name) && type == that.type;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, type, durable);
    }
    
    @Override
    public String toString() {
        return "Exchange{" + name + ", " + type + "}";
    }
}
