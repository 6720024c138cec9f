package com.enterprise.taskengine.delivery;

/**
 * Decides whether a worker needs native delayed delivery
 */
@FunctionalInterface
public interface QuorumQueueDetector {
    
    boolean detect(DelayedDeliveryContext context);
}
