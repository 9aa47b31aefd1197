package com.octate.collab.client;

import io.quarkus.websockets.next.BasicWebSocketConnector;
import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.WebSocketClientConnection;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.net.URI;

/**
 * Channels over the websockets-next client.
 */
public class WebSocketChannelConnector implements ChannelConnector {

    private static final Logger LOG = Logger.getLogger(WebSocketChannelConnector.class);

    @Override
    public Uni<DuplexChannel> open(URI endpoint, ChannelListener listener) {
        return BasicWebSocketConnector.create()
            .baseUri(endpoint.resolve("/"))
            .path(endpoint.getRawPath())
            .onTextMessage((connection, message) -> listener.onText(message))
            .onClose((connection, reason) -> listener.onClosed(reason.getCode(), reason.getMessage()))
            .onError((connection, failure) -> listener.onError(failure))
            .connect()
            .map(WebSocketChannel::new);
    }

    private static final class WebSocketChannel implements DuplexChannel {

        private final WebSocketClientConnection connection;

        private WebSocketChannel(WebSocketClientConnection connection) {
            this.connection = connection;
        }

        @Override
        public void send(String frame) {
            if (!connection.isOpen()) {
                throw new TransportDisconnectedException("Channel " + connection.id() + " is closed");
            }
            connection.sendText(frame).subscribe().with(
                ignored -> { },
                failure -> LOG.debugf("Send on %s failed: %s", connection.id(), failure.getMessage()));
        }

        @Override
        public void close() {
            if (connection.isOpen()) {
                connection.close(CloseReason.NORMAL).subscribe().with(
                    ignored -> { },
                    failure -> LOG.debugf("Close of %s failed: %s", connection.id(), failure.getMessage()));
            }
        }

        @Override
        public boolean isOpen() {
            return connection.isOpen();
        }
    }
}
