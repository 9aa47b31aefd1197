package com.octate.collab.event;

@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
