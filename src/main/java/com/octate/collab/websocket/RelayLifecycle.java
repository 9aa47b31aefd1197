package com.octate.collab.websocket;

import com.octate.collab.room.MemoryMonitor;
import com.octate.collab.room.RoomManager;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import org.jboss.logging.Logger;

/**
 * Starts the background sweeps with the application and tears everything down on
 * shutdown: sockets first, then timers, then rooms.
 */
@ApplicationScoped
public class RelayLifecycle {

    private static final Logger LOG = Logger.getLogger(RelayLifecycle.class);

    static final int GOING_AWAY = 1001;

    private final RoomManager roomManager;
    private final MemoryMonitor memoryMonitor;
    private final ConnectionRegistry registry;

    public RelayLifecycle(RoomManager roomManager, MemoryMonitor memoryMonitor, ConnectionRegistry registry) {
        this.roomManager = roomManager;
        this.memoryMonitor = memoryMonitor;
        this.registry = registry;
    }

    void onStart(@Observes StartupEvent event) {
        roomManager.start();
        memoryMonitor.start();
        LOG.info("Collaboration relay started");
    }

    void onStop(@Observes ShutdownEvent event) {
        LOG.info("Collaboration relay stopping");
        registry.closeAll(GOING_AWAY, "Server shutting down");
        memoryMonitor.stop();
        roomManager.shutdown();
    }
}
