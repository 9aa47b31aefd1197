package com.octate.collab.scheduling;

import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class VertxTaskSchedulerTest {

    private Vertx vertx;
    private VertxTaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        scheduler = new VertxTaskScheduler(vertx);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        CountDownLatch closed = new CountDownLatch(1);
        vertx.close().onComplete(ignored -> closed.countDown());
        closed.await(5, TimeUnit.SECONDS);
    }

    @Test
    void oneShotTaskRunsOnce() throws InterruptedException {
        CountDownLatch ran = new CountDownLatch(1);

        TaskScheduler.Cancellable handle = scheduler.schedule(Duration.ofMillis(10), ran::countDown);

        assertTrue(ran.await(5, TimeUnit.SECONDS));
        assertTrue(handle.isCancelled());
    }

    @Test
    void cancelledTaskNeverRuns() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();

        TaskScheduler.Cancellable handle = scheduler.schedule(Duration.ofMillis(50), runs::incrementAndGet);
        handle.cancel();
        Thread.sleep(150);

        assertEquals(0, runs.get());
    }

    @Test
    void periodicTaskSurvivesFailures() throws InterruptedException {
        CountDownLatch ticks = new CountDownLatch(3);

        TaskScheduler.Cancellable handle = scheduler.scheduleAtFixedRate(Duration.ofMillis(10), () -> {
            ticks.countDown();
            throw new IllegalStateException("tick failed");
        });

        assertTrue(ticks.await(5, TimeUnit.SECONDS));
        handle.cancel();
        assertTrue(handle.isCancelled());
    }
}
