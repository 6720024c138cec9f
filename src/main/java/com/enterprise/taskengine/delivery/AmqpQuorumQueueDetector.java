package com.enterprise.taskengine.delivery;

import com.enterprise.taskengine.broker.QueueDefinition;
import com.enterprise.taskengine.broker.QueueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reports quorum queues in use on an AMQP broker: the first broker URL has
 * an AMQP scheme and at least one application queue is declared with
 * {@code x-queue-type=quorum}.
 */
public class AmqpQuorumQueueDetector implements QuorumQueueDetector {
    
    private static final Logger logger = LoggerFactory.getLogger(AmqpQuorumQueueDetector.class);
    
    private static final Set<String> AMQP_SCHEMES = Set.of("amqp", "amqps", "pyamqp");
    
    @Override
    public boolean detect(DelayedDeliveryContext context) {
        if (!isAmqp(firstUrl(context.getBrokerUrl()))) {
            return false;
        }
        for (QueueDefinition queue : context.getQueues()) {
            Object type = queue.getArguments().get("x-queue-type");
            if (QueueType.QUORUM.getName().equals(type)) {
                logger.debug("Queue {} is a quorum queue", queue.getName());
                return true;
            }
        }
        return false;
    }
    
    private static String firstUrl(Object brokerUrl) {
        if (brokerUrl instanceof String) {
            return ((String) brokerUrl).split(";", 2)[0];
        }
        if (brokerUrl instanceof List && !((List<?>) brokerUrl).isEmpty()) {
            Object first = ((List<?>) brokerUrl).get(0);
            return first instanceof String ? (String) first : null;
        }
        return null;
    }
    
    private static boolean isAmqp(String url) {
        if (url == null) {
            return false;
        }
        int separator = url.indexOf("://");
        String scheme = separator >= 0 ? url.substring(0, separator) : url;
        return AMQP_SCHEMES.contains(scheme.trim().toLowerCase(Locale.ROOT));
    }
}
