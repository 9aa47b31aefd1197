package com.octate.collab.scheduling;

import java.time.Duration;

/**
 * The one source of time and timers for sweeps, idle checks, heartbeats and
 * reconnect backoff. Tests substitute a virtual-time implementation.
 */
public interface TaskScheduler {

    long currentTimeMillis();

    Cancellable schedule(Duration delay, Runnable task);

    Cancellable scheduleAtFixedRate(Duration period, Runnable task);

    interface Cancellable {

        void cancel();

        boolean isCancelled();
    }
}
