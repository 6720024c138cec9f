package com.enterprise.taskengine.core;

/**
 * Body of a task.
 * <p>
 * Implementations may be called concurrently for different attempts. A
 * handler asks for a retry through {@link TaskContext#retry}; any other
 * exception is classified against the task's retry policy.
 */
@FunctionalInterface
public interface TaskHandler {
    
    /**
     * Run one attempt
     *
     * @param context arguments and retry state of the attempt
     * @return the task's return value, or the {@link Outcome} produced by
     *         {@code context.retry(...)} when not throwing
     */
    Object run(TaskContext context) throws Exception;
}
