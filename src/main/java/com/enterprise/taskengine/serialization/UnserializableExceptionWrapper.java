package com.enterprise.taskengine.serialization;

import java.util.Collections;
import java.util.List;

/**
 * Stand-in for an exception that could not be rebuilt after crossing a
 * process boundary. Keeps the original class name and whatever constructor
 * arguments could be serialized.
 */
public class UnserializableExceptionWrapper extends Exception {
    
    private final String excClassName;
    private final String excMessage;
    private final List<Object> excArgs;
    
    public UnserializableExceptionWrapper(String excClassName, String excMessage, List<Object> excArgs) {
        super(excClassName + ": " + excMessage);
        this.excClassName = excClassName;
        this.excMessage = excMessage;
        this.excArgs = excArgs == null ? List.of() : Collections.unmodifiableList(excArgs);
    }
    
    public String getExcClassName() {
        return excClassName;
    }
    
    public String getExcMessage() {
        return excMessage;
    }
    
    public List<Object> getExcArgs() {
        return excArgs;
    }
    
    /**
     * Simple name of the wrapped class, without its package
     */
    public String getExcSimpleName() {
        int dot = excClassName.lastIndexOf('.');
        int dollar = excClassName.lastIndexOf('$');
        return excClassName.substring(Math.max(dot, dollar) + 1);
    }
}
