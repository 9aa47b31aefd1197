package com.octate.collab.rest;

import com.octate.collab.room.Peer;
import com.octate.collab.room.RoomManager;
import com.octate.collab.room.RoomMetadata;
import com.octate.collab.room.RoomNotFoundException;
import com.octate.collab.room.RoomStats;
import com.octate.collab.room.RoomSummary;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.List;

/**
 * Read-only view of the rooms the relay currently holds.
 */
@Path("/rooms")
@Produces(MediaType.APPLICATION_JSON)
public class RoomResource {

    public record RoomList(int count, List<RoomSummary> rooms) {}

    public record RoomDetail(RoomMetadata metadata, RoomStats stats, List<Peer> peers) {}

    public record PeerList(String roomId, int peerCount, List<Peer> peers) {}

    private final RoomManager roomManager;

    public RoomResource(RoomManager roomManager) {
        this.roomManager = roomManager;
    }

    @GET
    public RoomList list() {
        List<RoomSummary> rooms = roomManager.listRooms();
        return new RoomList(rooms.size(), rooms);
    }

    @GET
    @Path("/{roomId}")
    public RoomDetail get(@PathParam("roomId") String roomId) {
        RoomMetadata metadata = roomManager.getRoomMetadata(roomId)
            .orElseThrow(() -> new RoomNotFoundException(roomId));
        RoomStats stats = roomManager.getRoomStats(roomId)
            .orElseThrow(() -> new RoomNotFoundException(roomId));
        return new RoomDetail(metadata, stats, roomManager.getPeerList(roomId));
    }

    @GET
    @Path("/{roomId}/stats")
    public RoomStats stats(@PathParam("roomId") String roomId) {
        return roomManager.getRoomStats(roomId)
            .orElseThrow(() -> new RoomNotFoundException(roomId));
    }

    @GET
    @Path("/{roomId}/peers")
    public PeerList peers(@PathParam("roomId") String roomId) {
        if (roomManager.getRoomMetadata(roomId).isEmpty()) {
            throw new RoomNotFoundException(roomId);
        }
        List<Peer> peers = roomManager.getPeerList(roomId);
        return new PeerList(roomId, peers.size(), peers);
    }
}
