package com.intentflow.core.bus;

/**
 * Handle of an active subscription. Closing it stops delivery to its handler.
 */
public interface Subscription extends AutoCloseable {

    String topic();

    String consumerGroup();

    @Override
    void close();
}
