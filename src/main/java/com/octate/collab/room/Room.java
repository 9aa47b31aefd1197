package com.octate.collab.room;

import com.octate.collab.document.DocumentState.Authority;
import com.octate.collab.scheduling.TaskScheduler.Cancellable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Mutable room record. Only {@link RoomManager} touches it, under its monitor.
 */
class Room {

    final String roomId;
    final String roomName;
    final String hostId;
    final String hostName;
    final String fileId;
    final long createdAt;
    final Authority authority;
    final RoomDocument document;
    final Map<String, Peer> peers = new LinkedHashMap<>();

    long lastActivity;
    RoomState state = RoomState.ACTIVE;
    long operationCount;
    long bytesSent;
    long bytesReceived;
    Cancellable idleCheck;

    Room(String roomId, String roomName, String hostId, String hostName, String fileId,
         Authority authority, RoomDocument document, long now) {
        this.roomId = roomId;
        this.roomName = roomName;
        this.hostId = hostId;
        this.hostName = hostName;
        this.fileId = fileId;
        this.authority = authority;
        this.document = document;
        this.createdAt = now;
        this.lastActivity = now;
    }

    void touch(long now) {
        lastActivity = now;
    }

    void cancelIdleCheck() {
        if (idleCheck != null) {
            idleCheck.cancel();
            idleCheck = null;
        }
    }

    RoomMetadata metadata() {
        return new RoomMetadata(roomId, roomName, hostId, hostName, createdAt, lastActivity, state,
            peers.size(), fileId, document.content(), document.version(),
            authority.name().toLowerCase(Locale.ROOT));
    }

    RoomSummary summary(long now) {
        return new RoomSummary(roomId, roomName, hostId, peers.size(), state, createdAt, lastActivity,
            now - lastActivity);
    }

    RoomStats stats(long now) {
        return new RoomStats(roomId, peers.size(), operationCount, createdAt, lastActivity, now - lastActivity,
            state, new RoomStats.Bandwidth(bytesSent, bytesReceived));
    }

    List<Peer> peerList() {
        return new ArrayList<>(peers.values());
    }
}
