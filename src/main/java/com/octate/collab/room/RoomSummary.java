package com.octate.collab.room;

/** Listing row for {@code GET /rooms}. */
public record RoomSummary(
    String roomId,
    String roomName,
    String hostId,
    int peerCount,
    RoomState state,
    long createdAt,
    long lastActivity,
    long inactiveDuration
) {}
