package com.enterprise.taskengine.delivery;

import com.enterprise.taskengine.broker.BrokerChannel;
import com.enterprise.taskengine.broker.ExchangeDefinition;
import com.enterprise.taskengine.broker.ExchangeType;
import com.enterprise.taskengine.broker.QueueDefinition;
import com.enterprise.taskengine.broker.QueueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Broker topology that emulates delayed delivery with message TTLs.
 * <p>
 * There is one topic exchange and one queue per bit of the delay, from
 * {@code celery_delayed_27} down to {@code celery_delayed_0}. The queue of
 * level {@code n} holds messages for {@code 2^n} seconds and dead-letters
 * them to the next level. A message's routing key spells its delay in
 * binary, one bit per segment, so each level either parks the message in
 * its queue or forwards it straight to the next exchange. Messages leave
 * level 0 through {@code celery_delayed_delivery}, to which the application
 * exchanges are bound.
 */
public class DelayedDeliveryTopology {
    
    private static final Logger logger = LoggerFactory.getLogger(DelayedDeliveryTopology.class);
    
    public static final int MAX_LEVEL = 27;
    public static final int BITS = MAX_LEVEL + 1;
    public static final long MAX_DELAY_SECONDS = (1L << BITS) - 1;
    public static final String LEVEL_PREFIX = "celery_delayed_";
    public static final String DELIVERY_EXCHANGE = "celery_delayed_delivery";
    
    /**
     * Exchange and queue name of a level
     */
    public static String levelName(int level) {
        if (level < 0 || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Level must be between 0 and " + MAX_LEVEL + ": " + level);
        }
        return LEVEL_PREFIX + level;
    }
    
    /**
     * Exchange a delayed message is published to
     */
    public static String entryExchange() {
        return levelName(MAX_LEVEL);
    }
    
    /**
     * Routing key that delivers a message to {@code routingKey} after
     * {@code countdown}, e.g. {@code 0.0. ... .1.0.1.celery} for five seconds.
     * Delays longer than {@link #MAX_DELAY_SECONDS} are capped.
     */
    public static String routingKeyFor(Duration countdown, String routingKey) {
        if (countdown.isNegative()) {
            throw new IllegalArgumentException("Countdown cannot be negative: " + countdown);
        }
        long seconds = Math.min(countdown.getSeconds(), MAX_DELAY_SECONDS);
        StringBuilder key = new StringBuilder(BITS * 2 + routingKey.length());
        for (int bit = MAX_LEVEL; bit >= 0; bit--) {
            key.append((seconds >>> bit) & 1L).append('.');
        }
        return key.append(routingKey).toString();
    }
    
    /**
     * Queue of a level with its TTL and dead letter arguments
     */
    public QueueDefinition levelQueue(int level, QueueType queueType) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("x-queue-type", queueType.getName());
        arguments.put("x-overflow", "reject-publish");
        arguments.put("x-message-ttl", (1L << level) * 1000L);
        arguments.put("x-dead-letter-exchange", level > 0 ? levelName(level - 1) : DELIVERY_EXCHANGE);
        if (queueType == QueueType.QUORUM) {
            arguments.put("x-dead-letter-strategy", "at-least-once");
        }
        ExchangeDefinition exchange = new ExchangeDefinition(levelName(level), ExchangeType.TOPIC);
        return new QueueDefinition(levelName(level), exchange, queueRoutingKey(level), arguments);
    }
    
    /**
     * All level queues, highest level first
     */
    public List<QueueDefinition> levelQueues(QueueType queueType) {
        List<QueueDefinition> queues = new ArrayList<>(BITS);
        for (int level = MAX_LEVEL; level >= 0; level--) {
            queues.add(levelQueue(level, queueType));
        }
        return queues;
    }
    
    /**
     * Declare the exchanges, queues and bindings of every level. Broker
     * errors propagate unchanged.
     */
    public void declare(BrokerChannel channel, QueueType queueType) {
        for (QueueDefinition queue : levelQueues(queueType)) {
            channel.declareExchange(queue.getExchange());
            channel.declareQueue(queue);
            channel.bindQueue(queue.getName(), queue.getExchange().getName(), queue.getRoutingKey());
        }
        
        String routingKey = "0.#";
        for (int level = MAX_LEVEL; level > 0; level--) {
            channel.bindExchange(levelName(level - 1), levelName(level), routingKey);
            routingKey = "*." + routingKey;
        }
        
        channel.declareExchange(new ExchangeDefinition(DELIVERY_EXCHANGE, ExchangeType.TOPIC));
        channel.bindExchange(DELIVERY_EXCHANGE, levelName(0), routingKey);
        
        logger.debug("Declared {} delayed delivery levels ({} queues)", BITS, queueType);
    }
    
    /**
     * Bind an application queue so that delayed messages for it come out of
     * the delivery exchange. Direct and fanout exchanges cannot be routed
     * by key and are skipped.
     *
     * @return whether the queue was bound
     */
    public boolean bindQueue(BrokerChannel channel, QueueDefinition queue) {
        ExchangeDefinition exchange = queue.getExchange();
        if (exchange == null) {
            logger.debug("Queue {} has no exchange, skipping", queue.getName());
            return false;
        }
        if (exchange.getType() == ExchangeType.DIRECT) {
            logger.warn("Exchange {} is a direct exchange and native delayed delivery do not support direct exchanges.\n"
                        + "ETA tasks published to this exchange will block the worker until the ETA arrives.",
                        exchange.getName());
            return false;
        }
        if (exchange.getType() == ExchangeType.FANOUT) {
            return false;
        }
        
        String routingKey = bindingKey(queue.getRoutingKey());
        channel.bindExchange(exchange.getName(), DELIVERY_EXCHANGE, routingKey);
        channel.bindQueue(queue.getName(), exchange.getName(), routingKey);
        logger.debug("Bound queue {} to {} with {}", queue.getName(), DELIVERY_EXCHANGE, routingKey);
        return true;
    }
    
    /**
     * {@code #.key}, or the key itself when it already starts with {@code #}
     */
    static String bindingKey(String routingKey) {
        String key = routingKey == null ? "" : routingKey;
        return key.startsWith("#") ? key : "#." + key;
    }
    
    /**
     * {@code 1.#} for the top level, one more {@code *.} per level below it
     */
    private static String queueRoutingKey(int level) {
        return "*.".repeat(MAX_LEVEL - level) + "1.#";
    }
}
