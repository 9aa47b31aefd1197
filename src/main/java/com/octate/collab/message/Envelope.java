package com.octate.collab.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One protocol frame. {@code data} holds the type-specific payload and is
 * decoded lazily with {@link MessageCodec#payload}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Envelope(
    MessageType type,
    String roomId,
    String userId,
    String userName,
    JsonNode data,
    Long timestamp
) {

    public static Envelope of(MessageType type, String roomId, String userId, Object data) {
        return new Envelope(type, roomId, userId, null, MessageCodec.toData(data), System.currentTimeMillis());
    }

    public static Envelope of(MessageType type, Object data) {
        return of(type, null, null, data);
    }

    public static Envelope error(String message) {
        return of(MessageType.ERROR, new Payloads.ErrorData(message));
    }

    public Envelope withUserName(String name) {
        return new Envelope(type, roomId, userId, name, data, timestamp);
    }

    public Envelope withData(JsonNode newData) {
        return new Envelope(type, roomId, userId, userName, newData, timestamp);
    }

    public boolean hasData() {
        return data != null && !data.isNull();
    }
}
