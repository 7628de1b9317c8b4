package com.intentflow.core.bus;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Converts payload records to and from JSON, and envelopes to and from bytes.
 */
public class MessageCodec {

    private final ObjectMapper objectMapper;

    public MessageCodec() {
        this(defaultObjectMapper());
    }

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public JsonNode toPayload(Object value) {
        return objectMapper.valueToTree(value);
    }

    public <T> T fromPayload(MessageEnvelope envelope, Class<T> type) {
        try {
            return objectMapper.treeToValue(envelope.payload(), type);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                "Cannot read " + envelope.messageType() + " payload as " + type.getSimpleName(), e);
        }
    }

    public byte[] encode(MessageEnvelope envelope) {
        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public MessageEnvelope decode(byte[] bytes) {
        try {
            return objectMapper.readValue(bytes, MessageEnvelope.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed message envelope", e);
        }
    }
}
