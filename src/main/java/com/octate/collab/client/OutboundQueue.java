package com.octate.collab.client;

import org.jboss.logging.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded FIFO of frames written while the channel is down. When full, the
 * oldest frame is dropped to make room.
 */
public class OutboundQueue {

    private static final Logger LOG = Logger.getLogger(OutboundQueue.class);

    private final int capacity;
    private final Deque<String> frames = new ArrayDeque<>();
    private long dropped;

    public OutboundQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /** @return true if an older frame had to be dropped */
    public synchronized boolean offer(String frame) {
        boolean overflow = false;
        if (frames.size() == capacity) {
            frames.removeFirst();
            dropped++;
            overflow = true;
            LOG.warnf("Outbound queue full (%d), dropped oldest message", capacity);
        }
        frames.addLast(frame);
        return overflow;
    }

    public synchronized List<String> drain() {
        List<String> drained = new ArrayList<>(frames);
        frames.clear();
        return drained;
    }

    public synchronized int size() {
        return frames.size();
    }

    public synchronized long droppedCount() {
        return dropped;
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        frames.clear();
    }
}
