package com.octate.collab.websocket;

import io.quarkus.websockets.next.OnClose;
import io.quarkus.websockets.next.OnError;
import io.quarkus.websockets.next.OnOpen;
import io.quarkus.websockets.next.OnTextMessage;
import io.quarkus.websockets.next.WebSocket;
import io.quarkus.websockets.next.WebSocketConnection;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * WebSocket endpoint of the relay. Identity is established by the first
 * {@code auth} frame rather than at handshake time.
 */
@WebSocket(path = "/signaling")
public class SignalingSocket {

    private static final Logger LOG = Logger.getLogger(SignalingSocket.class);

    @Inject
    SignalingRelay relay;

    @OnOpen
    public void onOpen(WebSocketConnection connection) {
        relay.open(new WebSocketPeerConnection(connection));
    }

    @OnTextMessage
    public void onMessage(String message, WebSocketConnection connection) {
        relay.handle(connection.id(), message);
    }

    @OnClose
    public void onClose(WebSocketConnection connection) {
        relay.disconnect(connection.id());
    }

    @OnError
    public void onError(WebSocketConnection connection, Throwable t) {
        LOG.warnf("WebSocket error on %s: %s", connection.id(), t.getMessage());
    }
}
