package com.octate.collab.room;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.octate.collab.presence.ColorPalette;

public record Peer(
    String userId,
    String userName,
    @JsonProperty("isHost") boolean isHost,
    String color,
    long connectedAt,
    long lastHeartbeat
) {

    static Peer connect(String userId, String userName, boolean host, long now) {
        return new Peer(userId, userName, host, ColorPalette.colorFor(userId), now, now);
    }

    Peer withHeartbeat(long now) {
        return new Peer(userId, userName, isHost, color, connectedAt, now);
    }
}
