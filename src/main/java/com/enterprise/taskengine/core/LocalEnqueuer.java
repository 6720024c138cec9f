package com.enterprise.taskengine.core;

import com.enterprise.taskengine.broker.Enqueuer;
import com.enterprise.taskengine.exception.PublishException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Enqueuer that hands attempts back to a local engine, which holds them
 * until their countdown has passed
 */
public class LocalEnqueuer implements Enqueuer {
    
    private static final Logger logger = LoggerFactory.getLogger(LocalEnqueuer.class);
    
    private final WorkerEngine engine;
    
    public LocalEnqueuer(WorkerEngine engine) {
        this.engine = engine;
    }
    
    @Override
    public void publish(TaskAttempt attempt, Duration countdown) {
        try {
            engine.dispatch(attempt, Instant.now().plus(countdown))
                .whenComplete((outcome, throwable) -> {
                    if (throwable != null) {
                        logger.error("Retried attempt {} did not complete", attempt, throwable);
                    }
                });
        } catch (RuntimeException e) {
            throw new PublishException("Could not publish " + attempt, e);
        }
    }
}
