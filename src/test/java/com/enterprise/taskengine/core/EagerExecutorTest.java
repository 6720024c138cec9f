package com.enterprise.taskengine.core;

import com.enterprise.taskengine.exception.MaxRetriesExceededException;
import com.enterprise.taskengine.exception.TaskExecutionException;
import com.enterprise.taskengine.retry.Backoff;
import com.enterprise.taskengine.retry.RetryPolicy;
import com.enterprise.taskengine.retry.RetryRequest;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EagerExecutorTest {
    
    private final EagerExecutor executor = new EagerExecutor();
    
    @Test
    void testSuccess() throws Exception {
        TaskDefinition add = TaskDefinition.builder()
            .name("tasks.add")
            .handler(context -> context.arg(0, Integer.class) + context.arg(1, Integer.class))
            .build();
        
        EagerResult result = executor.apply(add, List.of(2, 3), Map.of());
        
        assertTrue(result.isSuccessful());
        assertEquals(5, result.get());
        assertEquals(1, result.getIterations());
        assertTrue(result.getPublishedCountdowns().isEmpty());
    }
    
    @Test
    void testRetriesUntilSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        TaskDefinition flaky = TaskDefinition.builder()
            .name("tasks.flaky")
            .handler(context -> {
                if (calls.incrementAndGet() < 3) {
                    return context.retry(RetryRequest.builder()
                        .exception(new IOException("unavailable"))
                        .countdown(Duration.ofSeconds(10))
                        .build());
                }
                return "ok after " + context.getRetries();
            })
            .build();
        
        EagerResult result = executor.apply(flaky, List.of(), Map.of());
        
        assertEquals("ok after 2", result.get());
        assertEquals(3, result.getIterations());
        assertEquals(List.of(Duration.ofSeconds(10), Duration.ofSeconds(10)), result.getPublishedCountdowns());
    }
    
    @Test
    void testGivesUpAfterMaxRetries() {
        TaskDefinition hopeless = TaskDefinition.builder()
            .name("tasks.hopeless")
            .handler(context -> context.retry(new IllegalStateException("still broken")))
            .build();
        
        EagerResult result = executor.apply(hopeless, List.of(1), Map.of("k", "v"));
        
        assertEquals(TaskStatus.FAILED, result.getStatus());
        assertEquals(4, result.getIterations());
        assertEquals(3, result.getPublishedCountdowns().size());
        
        MaxRetriesExceededException error = assertThrows(MaxRetriesExceededException.class, result::get);
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals(List.of(1), error.getTaskArgs());
    }
    
    @Test
    void testAutoretryBackoffGrowsExponentially() {
        TaskDefinition unreliable = TaskDefinition.builder()
            .name("tasks.unreliable")
            .handler(context -> { throw new IOException("reset by peer"); })
            .overrides(RetryPolicy.overrides()
                .autoretryFor(IOException.class)
                .backoff(Backoff.enabled())
                .jitter(false)
                .maxRetries(4))
            .build();
        
        EagerResult result = executor.apply(unreliable, List.of(), Map.of());
        
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8)),
                     result.getPublishedCountdowns());
        assertInstanceOf(MaxRetriesExceededException.class, result.getFailure());
    }
    
    @Test
    void testDivisionByZeroRetriesThenGivesUp() {
        AtomicInteger executions = new AtomicInteger();
        TaskDefinition divide = TaskDefinition.builder()
            .name("tasks.divide")
            .handler(context -> {
                executions.incrementAndGet();
                return context.arg(0, Integer.class) / context.arg(1, Integer.class);
            })
            .overrides(RetryPolicy.overrides()
                .autoretryFor(ArithmeticException.class)
                .maxRetries(3))
            .build();
        
        EagerResult result = executor.apply(divide, List.of(1, 0), Map.of());
        
        assertEquals(4, executions.get());
        MaxRetriesExceededException error = assertThrows(MaxRetriesExceededException.class, result::get);
        assertEquals(List.of(1, 0), error.getTaskArgs());
        assertInstanceOf(ArithmeticException.class, error.getCause());
    }
    
    @Test
    void testRetryRebindsArguments() throws Exception {
        TaskDefinition countdown = TaskDefinition.builder()
            .name("tasks.countdown")
            .handler(context -> {
                int remaining = context.arg(0, Integer.class);
                if (remaining > 0) {
                    return context.retry(RetryRequest.builder().args(remaining - 1).countdown(Duration.ZERO).build());
                }
                return "liftoff";
            })
            .build();
        
        EagerResult result = executor.apply(countdown, List.of(3), Map.of());
        
        assertEquals("liftoff", result.get());
        assertEquals(4, result.getIterations());
    }
    
    @Test
    void testNonTaskFailureIsWrapped() {
        TaskDefinition broken = TaskDefinition.builder()
            .name("tasks.broken")
            .handler(context -> { throw new ArithmeticException("/ by zero"); })
            .build();
        
        EagerResult result = executor.apply(broken, List.of(), Map.of());
        
        TaskExecutionException error = assertThrows(TaskExecutionException.class, result::get);
        assertInstanceOf(ArithmeticException.class, error.getCause());
        assertEquals(1, result.getIterations());
    }
}
