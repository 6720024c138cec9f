package com.enterprise.taskengine.broker;

import com.enterprise.taskengine.core.TaskAttempt;
import com.enterprise.taskengine.exception.PublishException;

import java.time.Duration;

/**
 * Puts a task attempt back on the broker
 */
@FunctionalInterface
public interface Enqueuer {
    
    /**
     * Publish an attempt for delivery after the given countdown
     *
     * @param attempt the attempt to deliver
     * @param countdown delay before delivery; {@link Duration#ZERO} for now
     * @throws PublishException if the broker rejects the message
     */
    void publish(TaskAttempt attempt, Duration countdown) throws PublishException;
}
