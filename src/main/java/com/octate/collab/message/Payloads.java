package com.octate.collab.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Typed {@code data} bodies of the protocol frames.
 */
public final class Payloads {

    private Payloads() {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AuthData(String token, String userId, String userName, String roomId) {}

    public record AuthSuccessData(String userId, String sessionId) {}

    /**
     * {@code authority} is {@code "server"} (default) or {@code "peer"}, the kind of
     * replica the room's clients keep. The relay orders operations the same way for both.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CreateRoomData(
        String roomId,
        String roomName,
        String fileId,
        String userName,
        String content,
        Long version,
        String authority
    ) {}

    /** Snapshot fields let a join recreate a room the relay no longer knows. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record JoinRoomData(
        String roomId,
        String userName,
        String roomName,
        String fileId,
        String content,
        Long version,
        String authority
    ) {
        public boolean carriesSnapshot() {
            return roomName != null || content != null || version != null;
        }
    }

    /** {@code applied} lists the origin keys of the receiver's own operations already in {@code content}. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SyncData(String content, long version, String sessionId, List<String> applied) {

        public SyncData(String content, long version) {
            this(content, version, null, null);
        }
    }

    public record UserData(String userId, String userName) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PeerData(String userId, String userName, @JsonProperty("isHost") boolean isHost, String color, Long connectedAt) {}

    public record RoomCreatedData(Object metadata) {}

    public record RoomJoinedData(Object metadata, List<PeerData> peers) {}

    public record IntroducePeersData(UserData joinedUser, List<PeerData> otherPeers) {}

    public record HeartbeatData(String roomId) {}

    public record ErrorData(String message) {}
}
