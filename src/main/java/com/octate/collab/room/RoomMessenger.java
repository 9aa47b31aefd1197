package com.octate.collab.room;

/**
 * Delivers an encoded frame to one room member. Implemented by the connection
 * registry of the WebSocket endpoint.
 */
public interface RoomMessenger {

    /** @return false when the member has no open connection */
    boolean deliver(String roomId, String userId, String frame);
}
