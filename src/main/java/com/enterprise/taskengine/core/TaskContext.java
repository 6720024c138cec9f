package com.enterprise.taskengine.core;

import com.enterprise.taskengine.retry.RetryException;
import com.enterprise.taskengine.retry.RetryRequest;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What a running handler sees of its attempt
 */
public class TaskContext {
    
    private final TaskDefinition task;
    private final TaskAttempt attempt;
    private volatile RetryRequest requestedRetry;
    
    public TaskContext(TaskDefinition task, TaskAttempt attempt) {
        this.task = task;
        this.attempt = attempt;
    }
    
    public TaskDefinition getTask() { return task; }
    
    public TaskAttempt getAttempt() { return attempt; }
    
    public String getTaskId() { return attempt.getTaskId(); }
    
    public List<Object> getArgs() { return attempt.getArgs(); }
    
    public Map<String, Object> getKwargs() { return attempt.getKwargs(); }
    
    public int getRetries() { return attempt.getRetries(); }
    
    /**
     * Positional argument cast to the given type
     */
    public <T> T arg(int index, Class<T> type) {
        return type.cast(attempt.getArgs().get(index));
    }
    
    public Outcome retry() {
        return retry(RetryRequest.builder().build());
    }
    
    public Outcome retry(Throwable exception) {
        return retry(RetryRequest.of(exception));
    }
    
    /**
     * Ask for this task to be retried.
     * <p>
     * The request is recorded on this context and the retry is published
     * once the handler finishes, whatever it returns. When the request
     * throws (the default) this method never returns: it raises a
     * {@link RetryException} that the retry controller handles.
     */
    public Outcome retry(RetryRequest request) {
        Objects.requireNonNull(request, "Retry request cannot be null");
        requestedRetry = request;
        if (request.isThrowError()) {
            throw new RetryException(request);
        }
        return Outcome.retryRequested(request);
    }
    
    /**
     * The last retry requested by the handler, or {@code null}
     */
    public RetryRequest getRequestedRetry() {
        return requestedRetry;
    }
}
