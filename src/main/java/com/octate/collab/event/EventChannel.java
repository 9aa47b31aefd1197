package com.octate.collab.event;

import io.smallrye.mutiny.Multi;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Typed fan-out for one category of events. A subscriber that throws is logged
 * and skipped; the remaining subscribers still receive the event.
 */
public final class EventChannel<T> {

    private static final Logger LOG = Logger.getLogger(EventChannel.class);

    private final String name;
    private final List<Consumer<? super T>> subscribers = new CopyOnWriteArrayList<>();
    private volatile boolean disposed;

    public EventChannel(String name) {
        this.name = name;
    }

    public Subscription subscribe(Consumer<? super T> subscriber) {
        if (disposed) {
            return () -> { };
        }
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    public void fire(T event) {
        if (disposed) return;
        for (Consumer<? super T> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Subscriber of %s failed", name);
            }
        }
    }

    /** Hot stream view; cancelling the subscription unsubscribes. */
    public Multi<T> toMulti() {
        return Multi.createFrom().emitter(emitter -> {
            Subscription subscription = subscribe(emitter::emit);
            emitter.onTermination(subscription::close);
        });
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public void dispose() {
        disposed = true;
        subscribers.clear();
    }
}
