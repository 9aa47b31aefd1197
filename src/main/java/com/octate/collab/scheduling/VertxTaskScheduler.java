package com.octate.collab.scheduling;

import io.vertx.core.Vertx;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Timers on the Vert.x event loop that Quarkus already runs.
 */
@ApplicationScoped
public class VertxTaskScheduler implements TaskScheduler {

    private static final Logger LOG = Logger.getLogger(VertxTaskScheduler.class);

    private final Vertx vertx;

    public VertxTaskScheduler(Vertx vertx) {
        this.vertx = vertx;
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    @Override
    public Cancellable schedule(Duration delay, Runnable task) {
        long millis = Math.max(1, delay.toMillis());
        TimerHandle handle = new TimerHandle();
        handle.timerId = vertx.setTimer(millis, id -> {
            if (handle.cancelled.compareAndSet(false, true)) {
                run(task);
            }
        });
        return handle;
    }

    @Override
    public Cancellable scheduleAtFixedRate(Duration period, Runnable task) {
        long millis = Math.max(1, period.toMillis());
        TimerHandle handle = new TimerHandle();
        handle.timerId = vertx.setPeriodic(millis, id -> {
            if (!handle.cancelled.get()) {
                run(task);
            }
        });
        return handle;
    }

    private static void run(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            LOG.error("Scheduled task failed", e);
        }
    }

    private final class TimerHandle implements Cancellable {
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private volatile long timerId;

        @Override
        public void cancel() {
            if (cancelled.compareAndSet(false, true)) {
                vertx.cancelTimer(timerId);
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }
    }
}
