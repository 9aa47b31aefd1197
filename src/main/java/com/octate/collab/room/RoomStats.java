package com.octate.collab.room;

public record RoomStats(
    String roomId,
    int peerCount,
    long operationCount,
    long createdAt,
    long lastActivity,
    long inactiveDuration,
    RoomState state,
    Bandwidth bandwidth
) {

    /** Bytes of encoded frames; {@code sent} counts every recipient. */
    public record Bandwidth(long sent, long received) {}
}
