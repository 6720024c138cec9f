package com.enterprise.taskengine.exception;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Terminal failure raised when a task asks to be retried more times than its
 * max retries allow. Carries the arguments of the call that gave up so the
 * failure can be diagnosed without the original message.
 */
public class MaxRetriesExceededException extends TaskExecutionException {
    
    private final String taskName;
    private final String taskId;
    private final List<Object> taskArgs;
    private final Map<String, Object> taskKwargs;
    
    public MaxRetriesExceededException(String taskName, String taskId,
                                       List<Object> taskArgs, Map<String, Object> taskKwargs,
                                       Throwable cause) {
        super(String.format("Can't retry %s[%s] args:%s kwargs:%s",
                            taskName, taskId, taskArgs, taskKwargs), cause);
        this.taskName = taskName;
        this.taskId = taskId;
        this.taskArgs = taskArgs == null ? List.of() : Collections.unmodifiableList(taskArgs);
        this.taskKwargs = taskKwargs == null ? Map.of() : Collections.unmodifiableMap(taskKwargs);
    }
    
    public String getTaskName() {
        return taskName;
    }
    
    public String getTaskId() {
        return taskId;
    }
    
    public List<Object> getTaskArgs() {
        return taskArgs;
    }
    
    public Map<String, Object> getTaskKwargs() {
        return taskKwargs;
    }
    
    /**
     * Copy of this exception with a different cause, used when the cause has
     * to be replaced by its portable form.
     */
    public MaxRetriesExceededException withCause(Throwable cause) {
        return new MaxRetriesExceededException(taskName, taskId, taskArgs, taskKwargs, cause);
    }
}
