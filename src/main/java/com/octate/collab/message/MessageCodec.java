package com.octate.collab.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON encoding of protocol frames, shared by the relay and the client transport.
 * Instants are written as epoch milliseconds.
 */
public final class MessageCodec {

    private static final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .enable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(SerializationFeature.WRITE_DATE_TIMESTAMPS_AS_NANOSECONDS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private MessageCodec() {
    }

    public static ObjectMapper mapper() {
        return mapper;
    }

    public static Envelope decode(String json) {
        if (json == null || json.isBlank()) {
            throw new ProtocolException("Empty frame");
        }
        Envelope envelope;
        try {
            envelope = mapper.readValue(json, Envelope.class);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed frame: " + rootMessage(e), e);
        }
        if (envelope.type() == null) {
            throw new ProtocolException("Frame without type");
        }
        return envelope;
    }

    public static String encode(Envelope envelope) {
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Cannot encode " + envelope.type(), e);
        }
    }

    /** Decodes the {@code data} body; a missing or mistyped body is a protocol error. */
    public static <T> T payload(Envelope envelope, Class<T> type) {
        if (!envelope.hasData()) {
            throw new ProtocolException(envelope.type().wireName() + " requires data");
        }
        try {
            return mapper.treeToValue(envelope.data(), type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException("Invalid " + envelope.type().wireName() + " data: " + rootMessage(e), e);
        }
    }

    /** Like {@link #payload} but tolerates an absent body. */
    public static <T> T optionalPayload(Envelope envelope, Class<T> type) {
        return envelope.hasData() ? payload(envelope, type) : null;
    }

    public static JsonNode toData(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        return mapper.valueToTree(value);
    }

    public static ObjectNode objectNode() {
        return mapper.createObjectNode();
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
