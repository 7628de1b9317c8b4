package com.intentflow.core.bus;

import java.time.Duration;

/**
 * Topic-based asynchronous transport.
 *
 * Guarantees:
 * - at-least-once delivery to every consumer group subscribed to a topic
 * - messages sharing a partition key are delivered to a group in publish order
 * - each partition is consumed by exactly one member of a group at a time
 */
public interface MessageBus extends AutoCloseable {

    /**
     * Publish a message; it is partitioned by {@link MessageEnvelope#partitionKey()}.
     */
    void publish(String topic, MessageEnvelope envelope);

    /**
     * Publish a message once the delay has elapsed.
     */
    void publishDelayed(String topic, MessageEnvelope envelope, Duration delay);

    /**
     * Join a consumer group on a topic.
     *
     * @param topic Topic name
     * @param consumerGroup Group name; members of one group share the partitions
     * @param handler Callback invoked once per delivery
     * @return Handle to stop the subscription
     */
    Subscription subscribe(String topic, String consumerGroup, MessageHandler handler);

    @Override
    void close();
}
