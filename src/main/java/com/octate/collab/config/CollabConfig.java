package com.octate.collab.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

@ConfigMapping(prefix = "collab")
public interface CollabConfig {

    Rooms rooms();

    Memory memory();

    Auth auth();

    Client client();

    interface Rooms {

        /** Rooms without activity for this long are deleted by the sweep. */
        @WithDefault("PT3H")
        Duration inactivityTimeout();

        /** Non-host peers silent for this long are evicted. */
        @WithDefault("PT5M")
        Duration heartbeatTimeout();

        @WithDefault("PT60S")
        Duration cleanupInterval();

        @WithDefault("PT5S")
        Duration idleCheckDelay();

        /** Operations kept per room for rebasing late submissions. */
        @WithDefault("1000")
        int historyLimit();
    }

    interface Memory {

        @WithDefault("PT30S")
        Duration checkInterval();

        @WithDefault("200")
        long warningMb();

        @WithDefault("300")
        long criticalMb();
    }

    interface Auth {

        /** Admit {@code auth} frames that carry no token. */
        @WithDefault("true")
        boolean allowAnonymous();
    }

    /** Defaults for {@code SyncTransport} instances created inside the application. */
    interface Client {

        @WithDefault("1000")
        long reconnectBaseMs();

        @WithDefault("30000")
        long reconnectMaxMs();

        @WithDefault("10")
        int reconnectAttempts();

        @WithDefault("PT30S")
        Duration heartbeatInterval();

        @WithDefault("PT10S")
        Duration heartbeatTimeout();

        @WithDefault("PT60S")
        Duration presenceTimeout();

        @WithDefault("100")
        int queueCapacity();
    }
}
