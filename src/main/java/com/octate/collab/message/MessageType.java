package com.octate.collab.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Every frame type of the relay protocol.
 *
 * Client → Server: auth, create-room, join-room, leave-room, operation, cursor,
 * presence, offer, answer, ice, heartbeat, sync-request
 *
 * Server → Client: auth-success, room-created, room-joined, introduce-peers, sync,
 * ack, operation, cursor, presence, user-joined, user-left, offer, answer, ice,
 * heartbeat-ack, error
 */
public enum MessageType {
    AUTH("auth"),
    AUTH_SUCCESS("auth-success"),
    CREATE_ROOM("create-room"),
    ROOM_CREATED("room-created"),
    JOIN_ROOM("join-room"),
    ROOM_JOINED("room-joined"),
    LEAVE_ROOM("leave-room"),
    INTRODUCE_PEERS("introduce-peers"),
    SYNC("sync"),
    SYNC_REQUEST("sync-request"),
    OPERATION("operation"),
    ACK("ack"),
    CURSOR("cursor"),
    PRESENCE("presence"),
    USER_JOINED("user-joined"),
    USER_LEFT("user-left"),
    OFFER("offer"),
    ANSWER("answer"),
    ICE("ice"),
    HEARTBEAT("heartbeat"),
    HEARTBEAT_ACK("heartbeat-ack"),
    ERROR("error");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Point-to-point connection handshake, forwarded to a single target peer. */
    public boolean isSignal() {
        return this == OFFER || this == ANSWER || this == ICE;
    }

    @JsonCreator
    public static MessageType fromWire(String value) {
        for (MessageType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new ProtocolException("Unknown message type: " + value);
    }
}
