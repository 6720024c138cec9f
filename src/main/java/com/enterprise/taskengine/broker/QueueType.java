package com.enterprise.taskengine.broker;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Queue types a broker can declare
 */
public enum QueueType {
    CLASSIC,
    QUORUM;
    
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    public static Optional<QueueType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> type.getName().equals(name))
            .findFirst();
    }
    
    /**
     * Comma separated list of valid names, e.g. {@code classic, quorum}
     */
    public static String validNames() {
        return Arrays.stream(values()).map(QueueType::getName).collect(Collectors.joining(", "));
    }
    
    @Override
    public String toString() {
        return getName();
    }
}
