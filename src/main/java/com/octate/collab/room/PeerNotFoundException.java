package com.octate.collab.room;

import com.octate.collab.CollaborationException;

public class PeerNotFoundException extends CollaborationException {

    public PeerNotFoundException(String roomId, String userId) {
        super("User " + userId + " is not a member of room " + roomId);
    }
}
