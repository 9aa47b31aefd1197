package com.octate.collab.room;

import com.octate.collab.CollaborationException;

public class RoomNotFoundException extends CollaborationException {

    private final String roomId;

    public RoomNotFoundException(String roomId) {
        super("Room not found: " + roomId);
        this.roomId = roomId;
    }

    public String roomId() {
        return roomId;
    }
}
