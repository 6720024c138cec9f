package com.enterprise.taskengine.core;

import com.enterprise.taskengine.retry.RetryPolicy;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named task: its handler and its effective retry policy.
 * <p>
 * The policy is resolved once, when the definition is built, from a base
 * policy and the task's own overrides. A task built with {@link #extend}
 * inherits every field this task does not override.
 */
public final class TaskDefinition {
    
    private final String name;
    private final TaskHandler handler;
    private final RetryPolicy retryPolicy;
    
    private TaskDefinition(String name, TaskHandler handler, RetryPolicy retryPolicy) {
        this.name = name;
        this.handler = handler;
        this.retryPolicy = retryPolicy;
    }
    
    public String getName() { return name; }
    
    public TaskHandler getHandler() { return handler; }
    
    public RetryPolicy getRetryPolicy() { return retryPolicy; }
    
    /**
     * Start a task definition whose base policy is this task's policy
     */
    public Builder extend(String name, TaskHandler handler) {
        return builder().name(name).handler(handler).basePolicy(retryPolicy);
    }
    
    /**
     * First attempt of a call to this task
     */
    public TaskAttempt newAttempt(List<Object> args, Map<String, Object> kwargs) {
        return TaskAttempt.builder()
            .taskName(name)
            .args(args)
            .kwargs(kwargs)
            .maxRetries(retryPolicy.getMaxRetries())
            .build();
    }
    
    public TaskAttempt newAttempt(Object... args) {
        return newAttempt(Arrays.asList(args), Map.of());
    }
    
    @Override
    public String toString() {
        return "TaskDefinition{name='" + name + "', retryPolicy=" + retryPolicy + '}';
    }
    
    public static class Builder {
        private String name;
        private TaskHandler handler;
        private RetryPolicy basePolicy = RetryPolicy.defaults();
        private RetryPolicy.Overrides overrides;
        
        public Builder name(String name) {
            this.name = name;
            return this;
        }
        
        public Builder handler(TaskHandler handler) {
            this.handler = handler;
            return this;
        }
        
        public Builder basePolicy(RetryPolicy basePolicy) {
            this.basePolicy = basePolicy;
            return this;
        }
        
        public Builder overrides(RetryPolicy.Overrides overrides) {
            this.overrides = overrides;
            return this;
        }
        
        public TaskDefinition build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Task name is required");
            }
            Objects.requireNonNull(handler, "handler");
            Objects.requireNonNull(basePolicy, "basePolicy");
            return new TaskDefinition(name, handler, basePolicy.withOverrides(overrides));
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
}
