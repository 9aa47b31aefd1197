package com.octate.collab.room;

/**
 * Membership change. {@code evicted} marks removals by the heartbeat sweep rather
 * than an explicit leave.
 */
public record PeerEvent(String roomId, String userId, String userName, boolean evicted) {}
