package com.enterprise.taskengine.delivery;

import ch.qos.logback.classic.Level;
import com.enterprise.taskengine.broker.BrokerChannel;
import com.enterprise.taskengine.broker.BrokerConnection;
import com.enterprise.taskengine.broker.ExchangeDefinition;
import com.enterprise.taskengine.broker.ExchangeType;
import com.enterprise.taskengine.broker.QueueDefinition;
import com.enterprise.taskengine.broker.QueueType;
import com.enterprise.taskengine.exception.BrokerConnectionException;
import com.enterprise.taskengine.exception.ConfigurationException;
import com.enterprise.taskengine.monitoring.Markers;
import com.enterprise.taskengine.monitoring.MetricsCollector;
import com.enterprise.taskengine.retry.RetryOverTime;
import com.enterprise.taskengine.support.LogCapture;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DelayedDeliverySetupTest {
    
    private static final QueueDefinition CELERY_QUEUE = new QueueDefinition(
        "celery", new ExchangeDefinition("celery", ExchangeType.TOPIC), "celery");
    
    @Mock
    private BrokerConnection connection;
    
    @Mock
    private BrokerChannel channel;
    
    private final List<Duration> sleeps = new ArrayList<>();
    private MetricsCollector metrics;
    private DelayedDeliverySetup setup;
    
    @BeforeEach
    void setUp() {
        metrics = new MetricsCollector(new SimpleMeterRegistry());
        setup = new DelayedDeliverySetup(context -> true, 2, Duration.ofSeconds(1), sleeps::add, metrics);
    }
    
    private DelayedDeliveryContext context(Object brokerUrl) {
        return DelayedDeliveryContext.builder()
            .brokerUrl(brokerUrl)
            .queueType("quorum")
            .queues(List.of(CELERY_QUEUE))
            .connection(connection)
            .build();
    }
    
    @Test
    void testSetupOnEveryBroker() throws Exception {
        when(connection.connect(anyString())).thenReturn(channel);
        
        Set<String> configured = setup.start(context("amqp://a//;amqp://b//"));
        
        assertEquals(Set.of("amqp://a//", "amqp://b//"), configured);
        verify(connection).connect("amqp://a//");
        verify(connection).connect("amqp://b//");
        verify(channel, times(2)).bindQueue("celery", "celery", "#.celery");
        verify(channel, times(2)).close();
        assertEquals(2.0, metrics.getMetrics().get("delayed_delivery.setup.success"));
        assertTrue(sleeps.isEmpty());
    }
    
    @Test
    void testDuplicateUrlsAreSetUpOnce() throws Exception {
        when(connection.connect(anyString())).thenReturn(channel);
        
        Set<String> configured = setup.start(context(List.of("amqp://a//", " amqp://a// ")));
        
        assertEquals(Set.of("amqp://a//"), configured);
        verify(connection, times(1)).connect("amqp://a//");
    }
    
    @Test
    void testConnectionErrorsAreRetriedThenReported() throws Exception {
        when(connection.connect(anyString()))
            .thenAnswer(invocation -> {
                throw new BrokerConnectionException(invocation.getArgument(0), "Connection refused");
            });
        
        try (LogCapture logs = LogCapture.attach(DelayedDeliverySetup.class)) {
            Set<String> configured = setup.start(context("a;b"));
            
            assertTrue(configured.isEmpty());
            verify(connection, times(3)).connect("a");
            verify(connection, times(3)).connect("b");
            
            List<String> warnings = logs.messages(Level.WARN);
            assertEquals(4, warnings.stream().filter(m -> m.startsWith("Retrying delayed delivery setup")).count());
            assertEquals(2, warnings.stream().filter(m -> m.startsWith("Failed to setup delayed delivery for")).count());
            assertEquals(1, logs.messagesWith(Markers.CRITICAL).size());
            assertTrue(logs.messagesWith(Markers.CRITICAL).get(0)
                .startsWith("Failed to setup delayed delivery for all broker URLs."));
        }
        
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(3),
                             Duration.ofSeconds(1), Duration.ofSeconds(3)), sleeps);
        assertEquals(2.0, metrics.getMetrics().get("delayed_delivery.setup.failure"));
    }
    
    @Test
    void testRecoversAfterTransientConnectionError() throws Exception {
        when(connection.connect("amqp://a//"))
            .thenThrow(new BrokerConnectionException("amqp://a//", "Connection refused"))
            .thenReturn(channel);
        
        try (LogCapture logs = LogCapture.attach(DelayedDeliverySetup.class)) {
            Set<String> configured = setup.start(context("amqp://a//"));
            
            assertEquals(Set.of("amqp://a//"), configured);
            assertEquals(1, logs.count(Level.WARN));
            assertTrue(logs.messagesWith(Markers.CRITICAL).isEmpty());
        }
    }
    
    @Test
    void testDeclareErrorIsNotRetried() throws Exception {
        when(connection.connect(anyString())).thenReturn(channel);
        doThrow(new IllegalStateException("PRECONDITION_FAILED")).when(channel).declareQueue(any());
        
        try (LogCapture logs = LogCapture.attach(DelayedDeliverySetup.class)) {
            Set<String> configured = setup.start(context("amqp://a//"));
            
            assertTrue(configured.isEmpty());
            verify(connection, times(1)).connect("amqp://a//");
            verify(channel).close();
            
            List<String> warnings = logs.messages(Level.WARN);
            assertEquals(2, warnings.size());
            assertTrue(warnings.get(0).startsWith("Failed to declare exchanges and queues for amqp://a//"));
            assertTrue(warnings.get(1).startsWith("Failed to setup delayed delivery for amqp://a//"));
            assertEquals(1, logs.messagesWith(Markers.CRITICAL).size());
        }
        assertTrue(sleeps.isEmpty());
    }
    
    @Test
    void testBindErrorIsLoggedAndSkipped() throws Exception {
        when(connection.connect(anyString())).thenReturn(channel);
        lenient().doThrow(new IllegalStateException("NOT_FOUND"))
            .when(channel).bindExchange(eq("celery"), eq(DelayedDeliveryTopology.DELIVERY_EXCHANGE), anyString());
        
        try (LogCapture logs = LogCapture.attach(DelayedDeliverySetup.class)) {
            Set<String> configured = setup.start(context("amqp://a//"));
            
            assertTrue(configured.isEmpty());
            assertEquals(2, logs.count(Level.WARN));
            assertTrue(logs.messages(Level.ERROR).contains("Failed to bind queue celery: NOT_FOUND"));
            assertEquals(1, logs.messagesWith(Markers.CRITICAL).size());
        }
    }
    
    @Test
    void testNoQueuesToBind() throws Exception {
        when(connection.connect(anyString())).thenReturn(channel);
        DelayedDeliveryContext empty = DelayedDeliveryContext.builder()
            .brokerUrl("amqp://a//")
            .queueType("classic")
            .connection(connection)
            .build();
        
        try (LogCapture logs = LogCapture.attach(DelayedDeliverySetup.class)) {
            assertEquals(Set.of("amqp://a//"), setup.start(empty));
            assertTrue(logs.messages(Level.WARN).contains("No queues found to bind for delayed delivery"));
        }
    }
    
    @Test
    void testInvalidConfigurationStopsWorker() {
        try (LogCapture logs = LogCapture.attach(DelayedDeliverySetup.class)) {
            ConfigurationException error = assertThrows(ConfigurationException.class,
                                                        () -> setup.start(context("   ")));
            assertEquals("broker URL configuration is empty", error.getMessage());
            assertEquals(1, logs.messagesWith(Markers.CRITICAL).size());
        }
        verifyNoInteractions(connection);
    }
    
    @Test
    void testInvalidQueueType() {
        DelayedDeliveryContext badType = DelayedDeliveryContext.builder()
            .brokerUrl("amqp://a//")
            .queueType("stream")
            .connection(connection)
            .build();
        
        ConfigurationException error = assertThrows(ConfigurationException.class, () -> setup.start(badType));
        assertEquals("Invalid queue type 'stream'. Must be one of: classic, quorum", error.getMessage());
    }
    
    @Test
    void testValidateBrokerUrls() {
        assertEquals(List.of("a", "b"), new ArrayList<>(DelayedDeliverySetup.validateBrokerUrls("a; b;;a")));
        assertThrows(ConfigurationException.class, () -> DelayedDeliverySetup.validateBrokerUrls(null));
        assertThrows(ConfigurationException.class, () -> DelayedDeliverySetup.validateBrokerUrls(List.of()));
        assertEquals("All broker URLs must be strings",
                     assertThrows(ConfigurationException.class,
                                  () -> DelayedDeliverySetup.validateBrokerUrls(List.of("a", 1))).getMessage());
        assertEquals("broker URL must be a string or list",
                     assertThrows(ConfigurationException.class,
                                  () -> DelayedDeliverySetup.validateBrokerUrls(42)).getMessage());
    }
    
    @Test
    void testValidateQueueType() {
        assertEquals(QueueType.QUORUM, DelayedDeliverySetup.validateQueueType("quorum"));
        assertEquals(QueueType.CLASSIC, DelayedDeliverySetup.validateQueueType("classic"));
        assertThrows(ConfigurationException.class, () -> DelayedDeliverySetup.validateQueueType(null));
        assertThrows(ConfigurationException.class, () -> DelayedDeliverySetup.validateQueueType(""));
    }
    
    @Test
    void testRetryLogReportsAttemptNumber() {
        DelayedDeliverySetup threeRetries = new DelayedDeliverySetup(context -> true, 3, Duration.ofSeconds(1),
                                                                     sleeps::add, null);
        
        try (LogCapture logs = LogCapture.attach(DelayedDeliverySetup.class)) {
            double next = threeRetries.onRetry(new BrokerConnectionException("amqp://a//", "Connection refused"),
                                               RetryOverTime.intervals(1, 31, 2), 1);
            
            assertEquals(1.0, next);
            String warning = logs.messages(Level.WARN).get(0);
            assertTrue(warning.contains("attempt 2/3"), warning);
            assertTrue(warning.contains("Connection refused"), warning);
            assertTrue(warning.endsWith("Next retry in 1.00s"), warning);
        }
    }
    
    @Test
    void testIncludeIfDelegatesToDetector() {
        DelayedDeliverySetup never = new DelayedDeliverySetup(context -> false, 2, Duration.ofSeconds(1),
                                                              sleeps::add, null);
        
        assertFalse(never.includeIf(context("amqp://a//")));
        assertTrue(setup.includeIf(context("amqp://a//")));
    }
    
    @Test
    void testNegativeMaxRetriesRejected() {
        assertThrows(IllegalArgumentException.class,
                     () -> new DelayedDeliverySetup(context -> true, -1, Duration.ofSeconds(1), sleeps::add, null));
    }
}
