package com.octate.collab.client;

import io.smallrye.mutiny.Uni;

import java.net.URI;

/**
 * Opens channels to a relay endpoint. Inbound traffic and closure are reported
 * to the listener given at open time.
 */
public interface ChannelConnector {

    Uni<DuplexChannel> open(URI endpoint, ChannelListener listener);
}
