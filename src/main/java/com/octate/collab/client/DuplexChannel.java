package com.octate.collab.client;

/**
 * An open, ordered, bidirectional text channel to the relay.
 */
public interface DuplexChannel {

    /** @throws TransportDisconnectedException if the channel is no longer open */
    void send(String frame);

    void close();

    boolean isOpen();
}
