package com.intentflow.core.bus;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Wire envelope of every bus message. correlationId is the taskId for all messages
 * of one task and doubles as the partition key.
 */
public record MessageEnvelope(
    UUID messageId,
    String senderId,
    String receiverId,
    MessageType messageType,
    JsonNode payload,
    int priority,
    Instant timestamp,
    String correlationId
) {
    public MessageEnvelope {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(messageType, "messageType");
        Objects.requireNonNull(correlationId, "correlationId");
    }

    public static MessageEnvelope create(String senderId, String receiverId, MessageType type,
                                         JsonNode payload, int priority, String correlationId,
                                         Instant timestamp) {
        return new MessageEnvelope(UUID.randomUUID(), senderId, receiverId, type, payload,
            priority, timestamp, correlationId);
    }

    public String partitionKey() {
        return correlationId;
    }
}
