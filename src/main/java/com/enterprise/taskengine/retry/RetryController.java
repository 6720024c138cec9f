package com.enterprise.taskengine.retry;

import com.enterprise.taskengine.broker.Enqueuer;
import com.enterprise.taskengine.core.Outcome;
import com.enterprise.taskengine.core.TaskAttempt;
import com.enterprise.taskengine.core.TaskContext;
import com.enterprise.taskengine.core.TaskDefinition;
import com.enterprise.taskengine.exception.MaxRetriesExceededException;
import com.enterprise.taskengine.serialization.ExceptionCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one task attempt and decides what happens next: success, a retry
 * published through the {@link Enqueuer}, or a terminal failure.
 * <p>
 * The controller keeps no state between attempts; everything it needs
 * travels on the {@link TaskAttempt}.
 */
public class RetryController {
    
    private static final Logger logger = LoggerFactory.getLogger(RetryController.class);
    
    private final Enqueuer enqueuer;
    private final BackoffPolicy backoffPolicy;
    private final ErrorClassifier errorClassifier;
    private final ExceptionCodec exceptionCodec;
    
    public RetryController(Enqueuer enqueuer) {
        this(enqueuer, new BackoffPolicy(), new ExceptionTypeClassifier(), new ExceptionCodec());
    }
    
    public RetryController(Enqueuer enqueuer, BackoffPolicy backoffPolicy,
                           ErrorClassifier errorClassifier, ExceptionCodec exceptionCodec) {
        this.enqueuer = enqueuer;
        this.backoffPolicy = backoffPolicy;
        this.errorClassifier = errorClassifier;
        this.exceptionCodec = exceptionCodec;
    }
    
    /**
     * Execute an attempt of the given task
     *
     * @throws com.enterprise.taskengine.exception.PublishException if a retry
     *         could not be published
     */
    public Outcome execute(TaskDefinition task, TaskAttempt attempt) {
        long startTime = System.currentTimeMillis();
        logger.debug("Executing {}", attempt);
        
        TaskContext context = new TaskContext(task, attempt);
        Object value;
        try {
            value = task.getHandler().run(context);
        } catch (RetryException e) {
            return retry(task, attempt, e.getRequest(), startTime);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            if (context.getRequestedRetry() != null) {
                logger.debug("Task {}[{}] raised {} after requesting a retry", task.getName(),
                            attempt.getTaskId(), e.getClass().getName());
                return retry(task, attempt, context.getRequestedRetry(), startTime);
            }
            return onError(task, attempt, e, startTime);
        }
        
        if (context.getRequestedRetry() != null) {
            return retry(task, attempt, context.getRequestedRetry(), startTime);
        }
        
        if (value instanceof Outcome) {
            Outcome returned = (Outcome) value;
            if (returned.isRetry() && returned.getNextAttempt() == null) {
                return retry(task, attempt, returned.getRetryRequest(), startTime);
            }
            return returned;
        }
        
        long executionTime = System.currentTimeMillis() - startTime;
        logger.debug("Task {}[{}] succeeded in {}ms", task.getName(), attempt.getTaskId(), executionTime);
        return Outcome.success(value, executionTime);
    }
    
    private Outcome onError(TaskDefinition task, TaskAttempt attempt, Throwable error, long startTime) {
        RetryPolicy policy = task.getRetryPolicy();
        
        if (errorClassifier.matches(error, policy.getDontAutoretryFor())) {
            logger.debug("Task {}[{}] raised excluded error {}, not retrying",
                        task.getName(), attempt.getTaskId(), error.getClass().getName());
            return fail(task, attempt, error, startTime);
        }
        
        if (errorClassifier.matches(error, policy.getAutoretryFor())) {
            RetryOptions options = policy.getRetryOptions();
            RetryRequest request = RetryRequest.builder()
                .exception(error)
                .maxRetries(options.getMaxRetries())
                .countdown(policy.getBackoff().isEnabled() ? null : options.getCountdown())
                .build();
            return retry(task, attempt, request, startTime);
        }
        
        return fail(task, attempt, error, startTime);
    }
    
    /**
     * The request's limit wins over the task policy's; a {@code null} policy
     * limit retries forever
     */
    private Outcome retry(TaskDefinition task, TaskAttempt attempt, RetryRequest request, long startTime) {
        int retries = attempt.getRetries() + 1;
        Integer maxRetries = request.getMaxRetries() != null
            ? request.getMaxRetries() : task.getRetryPolicy().getMaxRetries();
        Throwable error = request.getException();
        
        if (maxRetries != null && retries > maxRetries) {
            MaxRetriesExceededException exceeded = new MaxRetriesExceededException(
                task.getName(), attempt.getTaskId(), attempt.getArgs(), attempt.getKwargs(), error);
            return fail(task, attempt, exceeded, startTime);
        }
        
        Duration countdown = countdown(task.getRetryPolicy(), attempt.getRetries(), request.getCountdown());
        TaskAttempt next = attempt.withRetry(retries,
                                             rebindArgs(attempt, request),
                                             rebindKwargs(attempt, request),
                                             error == null ? null : exceptionCodec.encode(error));
        
        enqueuer.publish(next, countdown);
        
        long executionTime = System.currentTimeMillis() - startTime;
        logger.info("Task {}[{}] retry: Retry in {}s{}", task.getName(), attempt.getTaskId(),
                   countdown.getSeconds(), error == null ? "" : ": " + error);
        return Outcome.retry(request, next, countdown, executionTime);
    }
    
    private Outcome fail(TaskDefinition task, TaskAttempt attempt, Throwable error, long startTime) {
        long executionTime = System.currentTimeMillis() - startTime;
        logger.error("Task {}[{}] failed after {} retries: {}", task.getName(), attempt.getTaskId(),
                    attempt.getRetries(), error.toString());
        return Outcome.failure(exceptionCodec.portable(error), executionTime);
    }
    
    /**
     * Explicit countdown, else backoff for the current retry count, else the
     * task's default retry delay
     */
    Duration countdown(RetryPolicy policy, int retries, Duration explicit) {
        if (explicit != null) {
            return explicit;
        }
        Long backoff = backoffPolicy.computeDelay(retries, policy.getBackoff(), policy.getBackoffMax(), policy.isJitter());
        if (backoff != null) {
            return Duration.ofSeconds(backoff);
        }
        return policy.getDefaultRetryDelay();
    }
    
    private static List<Object> rebindArgs(TaskAttempt attempt, RetryRequest request) {
        return request.getArgs() != null ? request.getArgs() : attempt.getArgs();
    }
    
    private static Map<String, Object> rebindKwargs(TaskAttempt attempt, RetryRequest request) {
        if (request.getKwargs() == null) {
            return attempt.getKwargs();
        }
        if (request.getArgs() != null) {
            return request.getKwargs();
        }
        Map<String, Object> merged = new LinkedHashMap<>(attempt.getKwargs());
        merged.putAll(request.getKwargs());
        return merged;
    }
}
