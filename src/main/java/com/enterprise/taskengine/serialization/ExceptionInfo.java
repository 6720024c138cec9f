package com.enterprise.taskengine.serialization;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Portable description of a task failure: what travels with a retried
 * message and what a remote caller sees of a terminal error.
 */
public class ExceptionInfo {
    
    private final String type;
    private final String message;
    private final List<Object> arguments;
    
    @JsonCreator
    public ExceptionInfo(@JsonProperty("type") String type,
                         @JsonProperty("message") String message,
                         @JsonProperty("arguments") List<Object> arguments) {
        this.type = Objects.requireNonNull(type, "Exception type cannot be null");
        this.message = message;
        this.arguments = arguments == null ? List.of() : Collections.unmodifiableList(arguments);
    }
    
    /**
     * Fully qualified class name of the original exception
     */
    public String getType() {
        return type;
    }
    
    public String getMessage() {
        return message;
    }
    
    /**
     * Constructor arguments that survived serialization
     */
    public List<Object> getArguments() {
        return arguments;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExceptionInfo that = (ExceptionInfo) o;
        return type.equals(that.type)
            && Objects.equals(message, that.message)
            && arguments.equals(that.arguments);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(type, message, arguments);
    }
    
    @Override
    public String toString() {
        return "ExceptionInfo{" +
                "type='" + type + '\'' +
                ", message='" + message + '\'' +
                ", arguments=" + arguments +
                '}';
    }
}
