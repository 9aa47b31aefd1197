package com.octate.collab.client;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutboundQueueTest {

    @Test
    void drainsInInsertionOrder() {
        OutboundQueue queue = new OutboundQueue(5);
        queue.offer("a");
        queue.offer("b");

        assertEquals(List.of("a", "b"), queue.drain());
        assertEquals(0, queue.size());
    }

    @Test
    void fullQueueDropsOldest() {
        OutboundQueue queue = new OutboundQueue(2);

        assertFalse(queue.offer("1"));
        assertFalse(queue.offer("2"));
        assertTrue(queue.offer("3"));

        assertEquals(1, queue.droppedCount());
        assertEquals(List.of("2", "3"), queue.drain());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new OutboundQueue(0));
    }

    @Test
    void clearEmptiesWithoutCountingDrops() {
        OutboundQueue queue = new OutboundQueue(3);
        queue.offer("x");

        queue.clear();

        assertEquals(0, queue.size());
        assertEquals(0, queue.droppedCount());
    }
}
