package com.octate.collab.websocket;

import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.WebSocketConnection;
import org.jboss.logging.Logger;

class WebSocketPeerConnection implements PeerConnection {

    private static final Logger LOG = Logger.getLogger(WebSocketPeerConnection.class);

    private final WebSocketConnection connection;

    WebSocketPeerConnection(WebSocketConnection connection) {
        this.connection = connection;
    }

    @Override
    public String id() {
        return connection.id();
    }

    @Override
    public void send(String frame) {
        connection.sendText(frame).subscribe().with(
            ignored -> { },
            failure -> LOG.debugf("Send to %s failed: %s", connection.id(), failure.getMessage()));
    }

    @Override
    public void close(int code, String reason) {
        connection.close(new CloseReason(code, reason)).subscribe().with(
            ignored -> { },
            failure -> LOG.debugf("Close of %s failed: %s", connection.id(), failure.getMessage()));
    }

    @Override
    public boolean isOpen() {
        return connection.isOpen();
    }
}
