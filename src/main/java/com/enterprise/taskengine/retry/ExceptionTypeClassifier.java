package com.enterprise.taskengine.retry;

import java.util.Set;

/**
 * Matches an error against exception classes: the error's own class or any
 * of its superclasses and interfaces.
 */
public class ExceptionTypeClassifier implements ErrorClassifier {
    
    @Override
    public boolean matches(Throwable error, Set<Class<? extends Throwable>> kinds) {
        if (error == null || kinds == null || kinds.isEmpty()) {
            return false;
        }
        for (Class<? extends Throwable> kind : kinds) {
            if (kind.isInstance(error)) {
                return true;
            }
        }
        return false;
    }
}
