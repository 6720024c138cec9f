package com.enterprise.taskengine.delivery;

import com.enterprise.taskengine.broker.BrokerChannel;
import com.enterprise.taskengine.broker.QueueDefinition;
import com.enterprise.taskengine.broker.QueueType;
import com.enterprise.taskengine.exception.BrokerConnectionException;
import com.enterprise.taskengine.exception.ConfigurationException;
import com.enterprise.taskengine.exception.TopologyException;
import com.enterprise.taskengine.monitoring.Markers;
import com.enterprise.taskengine.monitoring.MetricsCollector;
import com.enterprise.taskengine.retry.RetryOverTime;
import com.enterprise.taskengine.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Worker startup step that declares the delayed delivery topology on every
 * configured broker and binds the application queues to it.
 * <p>
 * Connection errors are retried per broker URL. A URL that still fails, or
 * whose topology cannot be declared or bound, is logged and skipped; the
 * worker keeps running without native delayed delivery on it. Only invalid
 * configuration stops the worker.
 */
public class DelayedDeliverySetup {
    
    private static final Logger logger = LoggerFactory.getLogger(DelayedDeliverySetup.class);
    
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofSeconds(1);
    
    private final DelayedDeliveryTopology topology;
    private final QuorumQueueDetector detector;
    private final int maxRetries;
    private final Duration retryInterval;
    private final Sleeper sleeper;
    private final MetricsCollector metricsCollector;
    
    public DelayedDeliverySetup() {
        this(new AmqpQuorumQueueDetector(), DEFAULT_MAX_RETRIES, DEFAULT_RETRY_INTERVAL, Sleeper.SYSTEM, null);
    }
    
    public DelayedDeliverySetup(QuorumQueueDetector detector, int maxRetries, Duration retryInterval,
                                Sleeper sleeper, MetricsCollector metricsCollector) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative");
        }
        this.topology = new DelayedDeliveryTopology();
        this.detector = detector;
        this.maxRetries = maxRetries;
        this.retryInterval = retryInterval;
        this.sleeper = sleeper;
        this.metricsCollector = metricsCollector;
    }
    
    /**
     * Whether this step applies to the worker
     */
    public boolean includeIf(DelayedDeliveryContext context) {
        return detector.detect(context);
    }
    
    /**
     * Set up delayed delivery on every broker URL
     *
     * @return the URLs on which setup succeeded, possibly none
     * @throws ConfigurationException if the broker URLs or queue type are invalid
     */
    public Set<String> start(DelayedDeliveryContext context) {
        Set<String> brokerUrls;
        QueueType queueType;
        try {
            brokerUrls = validateBrokerUrls(context.getBrokerUrl());
            queueType = validateQueueType(context.getQueueType());
        } catch (ConfigurationException e) {
            logger.error(Markers.CRITICAL, "Configuration validation failed: {}", e.getMessage());
            throw e;
        }
        
        Set<String> configured = new LinkedHashSet<>();
        for (String brokerUrl : brokerUrls) {
            try {
                retrier().call(() -> {
                    setupDelayedDelivery(context, brokerUrl, queueType);
                    return null;
                });
                configured.add(brokerUrl);
                recordSetup(brokerUrl, true);
                logger.info("Delayed delivery set up for {}", brokerUrl);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Failed to setup delayed delivery for {}: interrupted", brokerUrl);
                recordSetup(brokerUrl, false);
                break;
            } catch (Exception e) {
                logger.warn("Failed to setup delayed delivery for {}: {}", brokerUrl, e.getMessage());
                recordSetup(brokerUrl, false);
            }
        }
        
        if (configured.isEmpty()) {
            logger.error(Markers.CRITICAL,
                        "Failed to setup delayed delivery for all broker URLs. "
                        + "Native delayed delivery will not be available.");
        }
        return configured;
    }
    
    /**
     * Declare the topology on one broker and bind the application queues
     */
    void setupDelayedDelivery(DelayedDeliveryContext context, String brokerUrl, QueueType queueType)
            throws BrokerConnectionException, TopologyException {
        try (BrokerChannel channel = context.getConnection().connect(brokerUrl)) {
            try {
                topology.declare(channel, queueType);
            } catch (RuntimeException e) {
                logger.warn("Failed to declare exchanges and queues for {}: {}", brokerUrl, e.getMessage());
                throw new TopologyException(TopologyException.Operation.DECLARE,
                                            "Failed to declare exchanges and queues for " + brokerUrl, e);
            }
            
            try {
                bindQueues(channel, context.getQueues());
            } catch (RuntimeException e) {
                logger.warn("Failed to bind queues for {}: {}", brokerUrl, e.getMessage());
                throw new TopologyException(TopologyException.Operation.BIND,
                                            "Failed to bind queues for " + brokerUrl, e);
            }
        }
    }
    
    private void bindQueues(BrokerChannel channel, List<QueueDefinition> queues) {
        if (queues.isEmpty()) {
            logger.warn("No queues found to bind for delayed delivery");
            return;
        }
        for (QueueDefinition queue : queues) {
            try {
                topology.bindQueue(channel, queue);
            } catch (RuntimeException e) {
                logger.error("Failed to bind queue {}: {}", queue.getName(), e.getMessage());
                throw e;
            }
        }
    }
    
    /**
     * Log a retry of the setup and return the seconds to wait before it
     */
    double onRetry(Exception error, Iterator<Double> intervals, int retries) {
        double next = intervals.next();
        logger.warn("Retrying delayed delivery setup (attempt {}/{}) after error: {}. Next retry in {}s",
                   retries + 1, maxRetries, error.getMessage(), String.format(Locale.ROOT, "%.2f", next));
        return next;
    }
    
    private RetryOverTime retrier() {
        return RetryOverTime.builder()
            .retryOn(BrokerConnectionException.class)
            .maxRetries(maxRetries)
            .intervalStart(retryInterval.toMillis() / 1000.0)
            .errback(this::onRetry)
            .sleeper(sleeper)
            .build();
    }
    
    private void recordSetup(String brokerUrl, boolean success) {
        if (metricsCollector != null) {
            metricsCollector.recordDelayedDeliverySetup(brokerUrl, success);
        }
    }
    
    /**
     * Split and de-duplicate the configured broker URLs, keeping their order
     *
     * @param brokerUrl a {@code ;} separated string or a list of strings
     * @throws ConfigurationException if the value is empty or of the wrong type
     */
    public static Set<String> validateBrokerUrls(Object brokerUrl) {
        if (brokerUrl == null) {
            throw new ConfigurationException("broker URL configuration is empty");
        }
        
        Set<String> urls = new LinkedHashSet<>();
        if (brokerUrl instanceof String) {
            for (String url : ((String) brokerUrl).split(";")) {
                if (!url.trim().isEmpty()) {
                    urls.add(url.trim());
                }
            }
        } else if (brokerUrl instanceof List) {
            for (Object url : (List<?>) brokerUrl) {
                if (!(url instanceof String)) {
                    throw new ConfigurationException("All broker URLs must be strings");
                }
                if (!((String) url).trim().isEmpty()) {
                    urls.add(((String) url).trim());
                }
            }
        } else {
            throw new ConfigurationException("broker URL must be a string or list");
        }
        
        if (urls.isEmpty()) {
            throw new ConfigurationException("broker URL configuration is empty");
        }
        return urls;
    }
    
    /**
     * @throws ConfigurationException if the queue type is missing or unknown
     */
    public static QueueType validateQueueType(String queueType) {
        if (queueType == null || queueType.isEmpty()) {
            throw new ConfigurationException("delayed delivery queue type is not configured");
        }
        return QueueType.fromName(queueType).orElseThrow(() -> new ConfigurationException(
            "Invalid queue type '" + queueType + "'. Must be one of: " + QueueType.validNames()));
    }
}
