package com.enterprise.taskengine.retry;

import java.util.Set;

/**
 * Decides whether an error belongs to a set of error kinds
 */
@FunctionalInterface
public interface ErrorClassifier {
    
    boolean matches(Throwable error, Set<Class<? extends Throwable>> kinds);
}
