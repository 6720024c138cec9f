package com.enterprise.taskengine.core;

import com.enterprise.taskengine.delivery.DelayedDeliveryContext;
import com.enterprise.taskengine.delivery.DelayedDeliverySetup;
import com.enterprise.taskengine.exception.ConfigurationException;
import com.enterprise.taskengine.exception.MaxRetriesExceededException;
import com.enterprise.taskengine.exception.TaskNotRegisteredException;
import com.enterprise.taskengine.monitoring.MetricsCollector;
import com.enterprise.taskengine.retry.RetryPolicy;
import com.enterprise.taskengine.retry.RetryRequest;
import com.enterprise.taskengine.revocation.RevocationStateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class WorkerEngineImplTest {
    
    @TempDir
    File tempDir;
    
    private WorkerEngineImpl engine;
    private MetricsCollector metrics;
    
    private static AsyncTaskExecutor newExecutor() {
        return new AsyncTaskExecutor(2, 4, 1000, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(100));
    }
    
    @BeforeEach
    void setUp() {
        metrics = new MetricsCollector(new SimpleMeterRegistry());
        engine = WorkerEngineImpl.builder()
            .executor(newExecutor())
            .metricsCollector(metrics)
            .build();
        engine.start();
    }
    
    @AfterEach
    void tearDown() throws Exception {
        if (engine != null) {
            engine.stop().get(10, TimeUnit.SECONDS);
        }
    }
    
    @Test
    void testDispatchAndComplete() throws Exception {
        engine.registerTask(engine.defineTask("tasks.add",
            context -> context.arg(0, Integer.class) + context.arg(1, Integer.class)).build());
        TaskAttempt attempt = TaskAttempt.builder().taskName("tasks.add").args(2, 3).build();
        
        Outcome outcome = engine.dispatch(attempt).get(10, TimeUnit.SECONDS);
        
        assertTrue(outcome.isSuccess());
        assertEquals(5, outcome.getValue());
        assertEquals(5, engine.getResult(attempt.getTaskId()).get(1, TimeUnit.SECONDS).getValue());
        assertEquals(TaskStatus.SUCCEEDED, engine.getTaskStatus(attempt.getTaskId()).orElseThrow());
    }
    
    @Test
    void testRetriesRunUntilSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        engine.registerTask(engine.defineTask("tasks.flaky", context -> {
            if (calls.incrementAndGet() < 3) {
                return context.retry(RetryRequest.builder()
                    .exception(new IllegalStateException("not yet"))
                    .countdown(Duration.ofMillis(50))
                    .build());
            }
            return "done";
        }).build());
        TaskAttempt attempt = TaskAttempt.builder().taskName("tasks.flaky").build();
        
        Outcome first = engine.dispatch(attempt).get(10, TimeUnit.SECONDS);
        assertTrue(first.isRetry());
        
        Outcome result = engine.getResult(attempt.getTaskId()).get(10, TimeUnit.SECONDS);
        assertTrue(result.isSuccess());
        assertEquals("done", result.getValue());
        assertEquals(3, calls.get());
        assertEquals(TaskStatus.SUCCEEDED, engine.getTaskStatus(attempt.getTaskId()).orElseThrow());
        assertEquals(2, engine.getStatistics().getTotalRetries());
    }
    
    @Test
    void testResultFailsAfterMaxRetries() throws Exception {
        TaskDefinition hopeless = engine.defineTask("tasks.hopeless", context -> context.retry(
            RetryRequest.builder().exception(new IllegalStateException("broken")).countdown(Duration.ZERO).build()))
            .build();
        engine.registerTask(hopeless);
        TaskAttempt attempt = hopeless.newAttempt();
        
        engine.dispatch(attempt);
        Outcome result = engine.getResult(attempt.getTaskId()).get(10, TimeUnit.SECONDS);
        
        assertTrue(result.isFailure());
        assertInstanceOf(MaxRetriesExceededException.class, result.getException());
        assertEquals(TaskStatus.FAILED, engine.getTaskStatus(attempt.getTaskId()).orElseThrow());
    }
    
    @Test
    void testRevokedAttemptIsSkipped() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        engine.registerTask(engine.defineTask("tasks.count", context -> calls.incrementAndGet()).build());
        TaskAttempt attempt = TaskAttempt.builder().taskName("tasks.count").build();
        
        engine.revoke(List.of(attempt.getTaskId()));
        Outcome outcome = engine.dispatch(attempt).get(10, TimeUnit.SECONDS);
        
        assertTrue(outcome.isRevoked());
        assertEquals(0, calls.get());
        assertTrue(engine.isRevoked(attempt.getTaskId()));
        assertEquals(TaskStatus.REVOKED, engine.getTaskStatus(attempt.getTaskId()).orElseThrow());
        assertTrue(engine.getResult(attempt.getTaskId()).get(1, TimeUnit.SECONDS).isRevoked());
        assertEquals(1, engine.getStatistics().getTotalRevokedSkipped());
        assertEquals(1.0, metrics.getMetrics().get("tasks.revoked"));
    }
    
    @Test
    void testRevokeStopsPendingRetry() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        engine.registerTask(engine.defineTask("tasks.slow", context -> {
            calls.incrementAndGet();
            return context.retry(RetryRequest.builder().countdown(Duration.ofMillis(300)).build());
        }).build());
        TaskAttempt attempt = TaskAttempt.builder().taskName("tasks.slow").build();
        
        assertTrue(engine.dispatch(attempt).get(10, TimeUnit.SECONDS).isRetry());
        engine.revoke(Set.of(attempt.getTaskId()));
        
        Outcome result = engine.getResult(attempt.getTaskId()).get(10, TimeUnit.SECONDS);
        
        assertTrue(result.isRevoked());
        assertEquals(1, calls.get());
    }
    
    @Test
    void testEtaHoldsAttempt() throws Exception {
        engine.registerTask(engine.defineTask("tasks.now", context -> Instant.now()).build());
        TaskAttempt attempt = TaskAttempt.builder().taskName("tasks.now").build();
        Instant eta = Instant.now().plusMillis(200);
        
        CompletableFuture<Outcome> future = engine.dispatch(attempt, eta);
        assertEquals(TaskStatus.PENDING, engine.getTaskStatus(attempt.getTaskId()).orElseThrow());
        
        Outcome outcome = future.get(10, TimeUnit.SECONDS);
        assertFalse(((Instant) outcome.getValue()).isBefore(eta.minusMillis(20)));
    }
    
    @Test
    void testUnregisteredTaskFails() throws Exception {
        TaskAttempt attempt = TaskAttempt.builder().taskName("tasks.unknown").build();
        
        Outcome outcome = engine.dispatch(attempt).get(10, TimeUnit.SECONDS);
        
        assertTrue(outcome.isFailure());
        assertInstanceOf(TaskNotRegisteredException.class, outcome.getException());
    }
    
    @Test
    void testUnregisterTask() throws Exception {
        engine.registerTask(engine.defineTask("tasks.gone", context -> 1).build());
        engine.unregisterTask("tasks.gone");
        
        Outcome outcome = engine.dispatch(TaskAttempt.builder().taskName("tasks.gone").build()).get(10, TimeUnit.SECONDS);
        
        assertTrue(outcome.isFailure());
    }
    
    @Test
    void testDispatchRequiresRunningEngine() throws Exception {
        engine.stop().get(10, TimeUnit.SECONDS);
        
        assertFalse(engine.isRunning());
        assertThrows(IllegalStateException.class,
                     () -> engine.dispatch(TaskAttempt.builder().taskName("t").build()));
        engine = null;
    }
    
    @Test
    void testStatistics() throws Exception {
        engine.registerTask(engine.defineTask("tasks.one", context -> 1).build());
        engine.dispatch(TaskAttempt.builder().taskName("tasks.one").build()).get(10, TimeUnit.SECONDS);
        engine.dispatch(TaskAttempt.builder().taskName("tasks.one").build()).get(10, TimeUnit.SECONDS);
        
        EngineStatistics stats = engine.getStatistics();
        
        assertEquals(2, stats.getTotalAttemptsReceived());
        assertEquals(2, stats.getTotalTasksSucceeded());
        assertEquals(0, stats.getTotalTasksFailed());
        assertEquals(2L, stats.getTaskCountsByStatus().get(TaskStatus.SUCCEEDED));
        assertEquals(0L, stats.getTaskCountsByStatus().get(TaskStatus.FAILED));
        assertTrue(stats.getUptimeMs() >= 0);
        assertEquals(2.0, metrics.getMetrics().get("tasks.succeeded"));
    }
    
    @Test
    void testDefineTaskInheritsWorkerDefaults() {
        WorkerEngineImpl custom = WorkerEngineImpl.builder()
            .executor(newExecutor())
            .defaultRetryPolicy(RetryPolicy.builder().maxRetries(10).build())
            .build();
        try {
            TaskDefinition task = custom.defineTask("tasks.x", context -> null).build();
            assertEquals(10, task.getRetryPolicy().getMaxRetries());
            assertEquals(10, task.newAttempt().getMaxRetries());
        } finally {
            custom.stop().join();
        }
    }
    
    @Test
    void testRevokedIdsSurviveRestart() throws Exception {
        String dbPath = new File(tempDir, "revoked.db").getAbsolutePath();
        
        WorkerEngineImpl first = WorkerEngineImpl.builder()
            .executor(newExecutor())
            .stateStore(new RevocationStateStore(dbPath))
            .build();
        first.start();
        first.revoke(List.of("task-1", "task-2"));
        first.stop().get(10, TimeUnit.SECONDS);
        
        WorkerEngineImpl second = WorkerEngineImpl.builder()
            .executor(newExecutor())
            .stateStore(new RevocationStateStore(dbPath))
            .build();
        try {
            second.start();
            assertTrue(second.isRevoked("task-1"));
            assertTrue(second.isRevoked("task-2"));
            assertFalse(second.isRevoked("task-3"));
        } finally {
            second.stop().get(10, TimeUnit.SECONDS);
        }
    }
    
    @Test
    void testStartRunsDelayedDeliverySetup() throws Exception {
        DelayedDeliverySetup setup = mock(DelayedDeliverySetup.class);
        DelayedDeliveryContext context = DelayedDeliveryContext.builder().brokerUrl("amqp://a//").build();
        when(setup.includeIf(context)).thenReturn(true);
        when(setup.start(context)).thenReturn(Set.of("amqp://a//"));
        
        WorkerEngineImpl worker = WorkerEngineImpl.builder()
            .executor(newExecutor())
            .delayedDelivery(setup, context)
            .build();
        try {
            worker.start();
            verify(setup).start(context);
            assertTrue(worker.isRunning());
        } finally {
            worker.stop().get(10, TimeUnit.SECONDS);
        }
    }
    
    @Test
    void testSetupSkippedWhenNotApplicable() throws Exception {
        DelayedDeliverySetup setup = mock(DelayedDeliverySetup.class);
        when(setup.includeIf(any())).thenReturn(false);
        
        WorkerEngineImpl worker = WorkerEngineImpl.builder()
            .executor(newExecutor())
            .delayedDelivery(setup, DelayedDeliveryContext.builder().build())
            .build();
        try {
            worker.start();
            verify(setup, never()).start(any());
        } finally {
            worker.stop().get(10, TimeUnit.SECONDS);
        }
    }
    
    @Test
    void testInvalidDelayedDeliveryConfigurationStopsStartup() throws Exception {
        DelayedDeliverySetup setup = mock(DelayedDeliverySetup.class);
        when(setup.includeIf(any())).thenReturn(true);
        when(setup.start(any())).thenThrow(new ConfigurationException("broker URL configuration is empty"));
        
        WorkerEngineImpl worker = WorkerEngineImpl.builder()
            .executor(newExecutor())
            .delayedDelivery(setup, DelayedDeliveryContext.builder().build())
            .build();
        
        assertThrows(ConfigurationException.class, worker::start);
        assertFalse(worker.isRunning());
        worker.stop().get(10, TimeUnit.SECONDS);
    }
    
    @Test
    void testKwargsReachHandler() throws Exception {
        engine.registerTask(engine.defineTask("tasks.greet",
            context -> "hello " + context.getKwargs().get("name")).build());
        TaskAttempt attempt = TaskAttempt.builder().taskName("tasks.greet").kwargs(Map.of("name", "ada")).build();
        
        assertEquals("hello ada", engine.dispatch(attempt).get(10, TimeUnit.SECONDS).getValue());
    }
    
    @Test
    void testUnlimitedPolicyOutlastsLimitOnIncomingAttempt() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        engine.registerTask(engine.defineTask("tasks.patient", context -> {
            if (calls.incrementAndGet() <= 5) {
                return context.retry(RetryRequest.builder().countdown(Duration.ZERO).build());
            }
            return context.getAttempt().getMaxRetries() == null ? "unlimited" : "limited";
        }).overrides(RetryPolicy.overrides().maxRetries(null)).build());
        TaskAttempt attempt = TaskAttempt.builder().taskName("tasks.patient").maxRetries(3).build();
        
        engine.dispatch(attempt);
        Outcome result = engine.getResult(attempt.getTaskId()).get(10, TimeUnit.SECONDS);
        
        assertTrue(result.isSuccess());
        assertEquals("unlimited", result.getValue());
        assertEquals(6, calls.get());
    }
    
    @Test
    void testPolicyLimitStopsIncomingAttemptWithHigherLimit() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        engine.registerTask(engine.defineTask("tasks.impatient", context -> {
            calls.incrementAndGet();
            return context.retry(RetryRequest.builder().countdown(Duration.ZERO).build());
        }).overrides(RetryPolicy.overrides().maxRetries(1)).build());
        TaskAttempt attempt = TaskAttempt.builder().taskName("tasks.impatient").maxRetries(10).build();
        
        engine.dispatch(attempt);
        Outcome result = engine.getResult(attempt.getTaskId()).get(10, TimeUnit.SECONDS);
        
        assertInstanceOf(MaxRetriesExceededException.class, result.getException());
        assertEquals(2, calls.get());
    }
    
    @Test
    void testFinishedTasksAreForgottenBeyondRetention() throws Exception {
        WorkerEngineImpl worker = WorkerEngineImpl.builder()
            .executor(newExecutor())
            .finishedRetention(100)
            .build();
        worker.start();
        try {
            worker.registerTask(worker.defineTask("tasks.echo", context -> context.arg(0, Integer.class)).build());
            
            TaskAttempt first = null;
            TaskAttempt last = null;
            for (int i = 0; i < 1000; i++) {
                last = TaskAttempt.builder().taskName("tasks.echo").args(i).build();
                if (first == null) {
                    first = last;
                }
                assertEquals(i, worker.dispatch(last).get(10, TimeUnit.SECONDS).getValue());
            }
            
            assertEquals(100, worker.getTrackedTaskCount());
            assertEquals(0, worker.getPendingResultCount());
            assertFalse(worker.getTaskStatus(first.getTaskId()).isPresent());
            assertEquals(TaskStatus.SUCCEEDED, worker.getTaskStatus(last.getTaskId()).orElseThrow());
            assertEquals(999, worker.getResult(last.getTaskId()).get(1, TimeUnit.SECONDS).getValue());
            assertEquals(0, worker.getPendingResultCount());
        } finally {
            worker.stop().get(10, TimeUnit.SECONDS);
        }
    }
    
    @Test
    void testAbandonedResultWaiterIsReleased() {
        CompletableFuture<Outcome> waiter = engine.getResult("never-sent");
        assertEquals(1, engine.getPendingResultCount());
        assertSame(waiter, engine.getResult("never-sent"));
        
        waiter.cancel(false);
        
        assertEquals(0, engine.getPendingResultCount());
        assertEquals(0, engine.getTrackedTaskCount());
    }
    
    @Test
    void testResultWaiterIsReleasedOnCompletion() throws Exception {
        engine.registerTask(engine.defineTask("tasks.slow", context -> {
            Thread.sleep(100);
            return "late";
        }).build());
        TaskAttempt attempt = TaskAttempt.builder().taskName("tasks.slow").build();
        
        CompletableFuture<Outcome> dispatched = engine.dispatch(attempt);
        CompletableFuture<Outcome> waiter = engine.getResult(attempt.getTaskId());
        
        assertEquals("late", waiter.get(10, TimeUnit.SECONDS).getValue());
        dispatched.get(10, TimeUnit.SECONDS);
        assertEquals(0, engine.getPendingResultCount());
    }
    
    @Test
    void testFinishedRetentionMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                     () -> WorkerEngineImpl.builder().executor(newExecutor()).finishedRetention(0).build());
    }
}
