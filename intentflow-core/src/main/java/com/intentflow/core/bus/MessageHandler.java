package com.intentflow.core.bus;

/**
 * Consumer callback. Throwing causes the message to be redelivered.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(MessageEnvelope envelope) throws Exception;
}
