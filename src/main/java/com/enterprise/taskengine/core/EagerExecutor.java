package com.enterprise.taskengine.core;

import com.enterprise.taskengine.broker.Enqueuer;
import com.enterprise.taskengine.retry.BackoffPolicy;
import com.enterprise.taskengine.retry.ErrorClassifier;
import com.enterprise.taskengine.retry.ExceptionTypeClassifier;
import com.enterprise.taskengine.retry.RetryController;
import com.enterprise.taskengine.serialization.ExceptionCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Runs tasks in the calling thread. Retries are not delayed: each published
 * retry is executed straight away until the task succeeds or fails for good.
 */
public class EagerExecutor {
    
    private static final Logger logger = LoggerFactory.getLogger(EagerExecutor.class);
    
    private final BackoffPolicy backoffPolicy;
    private final ErrorClassifier errorClassifier;
    private final ExceptionCodec exceptionCodec;
    
    public EagerExecutor() {
        this(new BackoffPolicy(), new ExceptionTypeClassifier(), new ExceptionCodec());
    }
    
    public EagerExecutor(BackoffPolicy backoffPolicy, ErrorClassifier errorClassifier,
                         ExceptionCodec exceptionCodec) {
        this.backoffPolicy = backoffPolicy;
        this.errorClassifier = errorClassifier;
        this.exceptionCodec = exceptionCodec;
    }
    
    public EagerResult apply(TaskDefinition task, List<Object> args, Map<String, Object> kwargs) {
        return apply(task, task.newAttempt(args, kwargs));
    }
    
    public EagerResult apply(TaskDefinition task, TaskAttempt attempt) {
        RecordingEnqueuer enqueuer = new RecordingEnqueuer();
        RetryController controller = new RetryController(enqueuer, backoffPolicy, errorClassifier, exceptionCodec);
        
        TaskAttempt current = attempt;
        int iterations = 0;
        Outcome outcome;
        while (true) {
            iterations++;
            outcome = controller.execute(task, current);
            if (!outcome.isRetry() || enqueuer.pending.isEmpty()) {
                break;
            }
            current = enqueuer.pending.poll();
        }
        
        logger.debug("Eager run of {}[{}] finished as {} after {} iteration(s)",
                    task.getName(), attempt.getTaskId(), outcome.getStatus(), iterations);
        return new EagerResult(attempt.getTaskId(), outcome, iterations, enqueuer.countdowns);
    }
    
    private static final class RecordingEnqueuer implements Enqueuer {
        private final Deque<TaskAttempt> pending = new ArrayDeque<>();
        private final List<Duration> countdowns = new ArrayList<>();
        
        @Override
        public void publish(TaskAttempt attempt, Duration countdown) {
            pending.add(attempt);
            countdowns.add(countdown);
        }
    }
}
