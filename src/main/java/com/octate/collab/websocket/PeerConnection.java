package com.octate.collab.websocket;

/**
 * One client socket as the relay sees it. Sends never block the caller.
 */
public interface PeerConnection {

    String id();

    void send(String frame);

    void close(int code, String reason);

    boolean isOpen();
}
