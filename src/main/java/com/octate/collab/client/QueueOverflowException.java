package com.octate.collab.client;

import com.octate.collab.CollaborationException;

/** Published when the offline queue is full and its oldest frame was dropped. */
public class QueueOverflowException extends CollaborationException {

    private final int capacity;

    public QueueOverflowException(int capacity) {
        super("Outbound queue full (" + capacity + "), dropped oldest message");
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }
}
