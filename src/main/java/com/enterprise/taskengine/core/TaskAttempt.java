package com.enterprise.taskengine.core;

import com.enterprise.taskengine.serialization.ExceptionInfo;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One delivery of a task message to a worker.
 * Attempts are immutable; a retry produces a new attempt with the same id.
 */
public final class TaskAttempt {
    
    private final String taskId;
    private final String taskName;
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private final int retries;
    private final Integer maxRetries;
    private final ExceptionInfo exception;
    
    @JsonCreator
    public TaskAttempt(@JsonProperty("taskId") String taskId,
                       @JsonProperty("taskName") String taskName,
                       @JsonProperty("args") List<Object> args,
                       @JsonProperty("kwargs") Map<String, Object> kwargs,
                       @JsonProperty("retries") int retries,
                       @JsonProperty("maxRetries") Integer maxRetries,
                       @JsonProperty("exception") ExceptionInfo exception) {
        if (retries < 0) {
            throw new IllegalArgumentException("Retries cannot be negative");
        }
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.taskName = Objects.requireNonNull(taskName, "taskName");
        this.args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        this.kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
        this.retries = retries;
        this.maxRetries = maxRetries;
        this.exception = exception;
    }
    
    public String getTaskId() { return taskId; }
    
    public String getTaskName() { return taskName; }
    
    public List<Object> getArgs() { return args; }
    
    public Map<String, Object> getKwargs() { return kwargs; }
    
    public int getRetries() { return retries; }
    
    /**
     * Retry limit of the task's policy, stamped when the worker admits the
     * attempt; {@code null} means unlimited or not yet admitted. The retry
     * decision itself always reads the task's policy.
     */
    public Integer getMaxRetries() { return maxRetries; }
    
    /**
     * Error that caused this attempt to be published, if it is a retry
     */
    public ExceptionInfo getException() { return exception; }
    
    @JsonIgnore
    public boolean isRetry() {
        return retries > 0;
    }
    
    /**
     * The attempt that follows this one after a retry
     */
    public TaskAttempt withRetry(int retries, List<Object> args, Map<String, Object> kwargs, ExceptionInfo exception) {
        return new TaskAttempt(taskId, taskName, args, kwargs, retries, maxRetries, exception);
    }
    
    public TaskAttempt withArgs(List<Object> args) {
        return new TaskAttempt(taskId, taskName, args, kwargs, retries, maxRetries, exception);
    }
    
    public TaskAttempt withKwargs(Map<String, Object> kwargs) {
        return new TaskAttempt(taskId, taskName, args, kwargs, retries, maxRetries, exception);
    }
    
    public TaskAttempt withMaxRetries(Integer maxRetries) {
        return new TaskAttempt(taskId, taskName, args, kwargs, retries, maxRetries, exception);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskAttempt that = (TaskAttempt) o;
        return retries == that.retries && taskId.equals(that.taskId) && taskName.equals(that.taskName)
            && args.equals(that.args) && kwargs.equals(that.kwargs)
            && Objects.equals(maxRetries, that.maxRetries) && Objects.equals(exception, that.exception);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(taskId, taskName, args, kwargs, retries, maxRetries, exception);
    }
    
    @Override
    public String toString() {
        return taskName + "[" + taskId + "] retries=" + retries + " args=" + args + " kwargs=" + kwargs;
    }
    
    /**
     * Builder for creating TaskAttempt instances
     */
    public static class Builder {
        private String taskId = UUID.randomUUID().toString();
        private String taskName;
        private List<Object> args = List.of();
        private Map<String, Object> kwargs = Map.of();
        private int retries = 0;
        private Integer maxRetries;
        private ExceptionInfo exception;
        
        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }
        
        public Builder taskName(String taskName) {
            this.taskName = taskName;
            return this;
        }
        
        public Builder args(List<Object> args) {
            this.args = args;
            return this;
        }
        
        public Builder args(Object... args) {
            this.args = Arrays.asList(args);
            return this;
        }
        
        public Builder kwargs(Map<String, Object> kwargs) {
            this.kwargs = kwargs;
            return this;
        }
        
        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }
        
        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }
        
        public Builder exception(ExceptionInfo exception) {
            this.exception = exception;
            return this;
        }
        
        public TaskAttempt build() {
            if (taskName == null) {
                throw new IllegalArgumentException("Task name is required");
            }
            return new TaskAttempt(taskId, taskName, args, kwargs, retries, maxRetries, exception);
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
}
