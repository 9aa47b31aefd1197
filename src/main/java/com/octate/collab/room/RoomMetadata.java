package com.octate.collab.room;

import com.fasterxml.jackson.annotation.JsonInclude;

/** {@code authority} is {@code "server"} or {@code "peer"}: the kind of replica the room's clients keep. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoomMetadata(
    String roomId,
    String roomName,
    String hostId,
    String hostName,
    long createdAt,
    long lastActivity,
    RoomState state,
    int peerCount,
    String fileId,
    String content,
    long version,
    String authority
) {}
