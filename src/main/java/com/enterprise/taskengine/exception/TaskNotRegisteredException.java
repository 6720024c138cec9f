package com.enterprise.taskengine.exception;

/**
 * Exception thrown when a message names a task the worker does not know
 */
public class TaskNotRegisteredException extends TaskExecutionException {
    
    private final String taskName;
    
    public TaskNotRegisteredException(String taskName) {
        super("Task of kind '" + taskName + "' is not registered");
        this.taskName = taskName;
    }
    
    public String getTaskName() {
        return taskName;
    }
}
