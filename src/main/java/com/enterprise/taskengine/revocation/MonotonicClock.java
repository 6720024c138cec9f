package com.enterprise.taskengine.revocation;

/**
 * Time source for expiry decisions. Must not follow the wall clock, so that
 * a system time change never expires or resurrects entries.
 */
@FunctionalInterface
public interface MonotonicClock {
    
    MonotonicClock SYSTEM = System::nanoTime;
    
    /**
     * Current reading in nanoseconds; only differences are meaningful
     */
    long nanoTime();
}
