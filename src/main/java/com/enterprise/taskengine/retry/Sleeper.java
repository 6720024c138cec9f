package com.enterprise.taskengine.retry;

import java.time.Duration;

/**
 * Pauses the calling thread between retry attempts
 */
@FunctionalInterface
public interface Sleeper {
    
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());
    
    void sleep(Duration duration) throws InterruptedException;
}
