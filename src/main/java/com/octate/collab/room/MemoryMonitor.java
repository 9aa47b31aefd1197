package com.octate.collab.room;

import com.octate.collab.config.CollabConfig;
import com.octate.collab.scheduling.TaskScheduler;
import com.octate.collab.scheduling.TaskScheduler.Cancellable;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Periodic heap check. Above the warning threshold the room sweep runs early (at
 * most once per cooldown); above the critical threshold idle rooms are closed.
 */
@ApplicationScoped
public class MemoryMonitor {

    private static final Logger LOG = Logger.getLogger(MemoryMonitor.class);
    private static final long MB = 1024 * 1024;

    public record Thresholds(long warningBytes, long criticalBytes, Duration cooldown) {}

    private final RoomManager roomManager;
    private final TaskScheduler scheduler;
    private final Duration interval;
    private final Thresholds thresholds;
    private final LongSupplier heapUsed;

    private Cancellable monitor;
    private long lastWarning = Long.MIN_VALUE;

    @Inject
    public MemoryMonitor(CollabConfig config, RoomManager roomManager, TaskScheduler scheduler) {
        this(roomManager, scheduler, config.memory().checkInterval(),
            new Thresholds(config.memory().warningMb() * MB, config.memory().criticalMb() * MB, Duration.ofMinutes(1)),
            JvmMetrics::heapUsed);
    }

    public MemoryMonitor(RoomManager roomManager, TaskScheduler scheduler, Duration interval,
                         Thresholds thresholds, LongSupplier heapUsed) {
        this.roomManager = roomManager;
        this.scheduler = scheduler;
        this.interval = interval;
        this.thresholds = thresholds;
        this.heapUsed = heapUsed;
    }

    public synchronized void start() {
        if (monitor == null) {
            monitor = scheduler.scheduleAtFixedRate(interval, this::check);
            LOG.infof("Memory monitor started (every %s)", interval);
        }
    }

    public synchronized void stop() {
        if (monitor != null) {
            monitor.cancel();
            monitor = null;
            LOG.info("Memory monitor stopped");
        }
    }

    public void check() {
        long used = heapUsed.getAsLong();
        if (used > thresholds.warningBytes()) {
            long now = scheduler.currentTimeMillis();
            if (lastWarning == Long.MIN_VALUE || now - lastWarning > thresholds.cooldown().toMillis()) {
                lastWarning = now;
                LOG.warnf("High heap usage: %d MB", used / MB);
                roomManager.cleanup();
                ServerStats stats = roomManager.getStats();
                LOG.infof("After cleanup: %d active rooms, %d connections",
                    stats.activeRooms(), stats.totalConnections());
            }
        }
        if (used > thresholds.criticalBytes()) {
            LOG.errorf("Critical heap usage: %d MB", used / MB);
            closeIdleRooms();
        }
    }

    private void closeIdleRooms() {
        int closed = 0;
        for (RoomMetadata room : roomManager.getAllRooms()) {
            if (room.state() == RoomState.IDLE && roomManager.closeRoom(room.roomId())) {
                closed++;
            }
        }
        LOG.infof("Closed %d idle rooms under memory pressure", closed);
    }

    public Thresholds thresholds() {
        return thresholds;
    }
}
