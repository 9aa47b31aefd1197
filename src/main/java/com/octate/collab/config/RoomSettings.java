package com.octate.collab.config;

import java.time.Duration;

/**
 * Room lifecycle timings, detached from the config mapping so the room manager can
 * be built directly in tests.
 */
public record RoomSettings(
    Duration inactivityTimeout,
    Duration heartbeatTimeout,
    Duration cleanupInterval,
    Duration idleCheckDelay,
    int historyLimit
) {

    public static RoomSettings defaults() {
        return new RoomSettings(
            Duration.ofHours(3),
            Duration.ofMinutes(5),
            Duration.ofSeconds(60),
            Duration.ofSeconds(5),
            1000
        );
    }

    public static RoomSettings from(CollabConfig.Rooms rooms) {
        return new RoomSettings(
            rooms.inactivityTimeout(),
            rooms.heartbeatTimeout(),
            rooms.cleanupInterval(),
            rooms.idleCheckDelay(),
            rooms.historyLimit()
        );
    }
}
