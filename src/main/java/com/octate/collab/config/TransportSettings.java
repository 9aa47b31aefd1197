package com.octate.collab.config;

import java.time.Duration;

public record TransportSettings(
    long reconnectBaseMs,
    long reconnectMaxMs,
    int reconnectAttempts,
    Duration heartbeatInterval,
    Duration heartbeatTimeout,
    Duration presenceTimeout,
    int queueCapacity
) {

    public static TransportSettings defaults() {
        return new TransportSettings(1000, 30000, 10,
            Duration.ofSeconds(30), Duration.ofSeconds(10), Duration.ofSeconds(60), 100);
    }

    public static TransportSettings from(CollabConfig.Client client) {
        return new TransportSettings(
            client.reconnectBaseMs(),
            client.reconnectMaxMs(),
            client.reconnectAttempts(),
            client.heartbeatInterval(),
            client.heartbeatTimeout(),
            client.presenceTimeout(),
            client.queueCapacity()
        );
    }
}
