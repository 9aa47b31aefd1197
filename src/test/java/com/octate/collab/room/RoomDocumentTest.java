package com.octate.collab.room;

import com.octate.collab.document.StaleOperationException;
import com.octate.collab.ot.Operation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoomDocumentTest {

    @Test
    void sequentialOperationsGetIncreasingVersions() {
        RoomDocument doc = new RoomDocument("", 0, 100);

        RoomDocument.Applied first = doc.submit(Operation.insert("alice", 0, "ab", 1, 1));
        RoomDocument.Applied second = doc.submit(Operation.insert("alice", 2, "c", 2, 2));

        assertEquals(1, first.op().version());
        assertEquals(2, second.op().version());
        assertEquals("abc", doc.content());
        assertFalse(second.duplicate());
    }

    @Test
    void concurrentInsertsAtSamePositionResolveByUserInEitherOrder() {
        RoomDocument aliceFirst = new RoomDocument("", 0, 100);
        aliceFirst.submit(Operation.insert("alice", 0, "X", 1, 1));
        aliceFirst.submit(Operation.insert("bob", 0, "Y", 1, 1));

        RoomDocument bobFirst = new RoomDocument("", 0, 100);
        bobFirst.submit(Operation.insert("bob", 0, "Y", 1, 1));
        bobFirst.submit(Operation.insert("alice", 0, "X", 1, 1));

        assertEquals("XY", aliceFirst.content());
        assertEquals("XY", bobFirst.content());
    }

    @Test
    void insertInsideConcurrentDeleteDisappears() {
        RoomDocument doc = new RoomDocument("0123456789abcdef", 0, 100);

        doc.submit(Operation.delete("alice", 5, 5, 1, 1));
        RoomDocument.Applied insert = doc.submit(Operation.insert("bob", 7, "ZZ", 1, 1));

        assertEquals("01234abcdef", doc.content());
        assertEquals("", insert.op().content());
        assertEquals(2, doc.version());
    }

    @Test
    void ownEarlierOperationsAreNotRebasedAgain() {
        RoomDocument doc = new RoomDocument("", 0, 100);
        doc.submit(Operation.insert("alice", 0, "ab", 1, 1));

        RoomDocument.Applied applied = doc.submit(Operation.insert("alice", 2, "!", 2, 1));

        assertEquals(2, applied.op().position());
        assertEquals("ab!", doc.content());
    }

    @Test
    void duplicateSubmissionIsNotReapplied() {
        RoomDocument doc = new RoomDocument("", 0, 100);
        Operation op = Operation.insert("alice", 0, "x", 42, 1);
        RoomDocument.Applied first = doc.submit(op);

        RoomDocument.Applied again = doc.submit(op.withVersion(5));

        assertTrue(again.duplicate());
        assertEquals(first.op(), again.op());
        assertEquals("x", doc.content());
        assertEquals(1, doc.version());
    }

    @Test
    void baseOlderThanRetainedHistoryIsStale() {
        RoomDocument doc = new RoomDocument("", 0, 2);
        for (int i = 1; i <= 3; i++) {
            doc.submit(Operation.insert("alice", 0, "a", i, i));
        }
        assertEquals(2, doc.retained());

        StaleOperationException stale = assertThrows(StaleOperationException.class,
            () -> doc.submit(Operation.insert("bob", 0, "b", 9, 1)));
        assertEquals(0, stale.baseVersion());
        assertEquals(3, stale.currentVersion());

        doc.submit(Operation.insert("bob", 0, "b", 10, 2));
        assertEquals(4, doc.version());
    }

    @Test
    void baseAheadOfServerIsTreatedAsCurrent() {
        RoomDocument doc = new RoomDocument("abc", 3, 100);

        RoomDocument.Applied applied = doc.submit(Operation.insert("alice", 3, "d", 1, 50));

        assertEquals(4, applied.op().version());
        assertEquals("abcd", doc.content());
    }

    @Test
    void appliedOriginsListsOnlyThatUser() {
        RoomDocument doc = new RoomDocument("", 0, 100);
        Operation a = Operation.insert("alice", 0, "a", 1, 1);
        doc.submit(a);
        doc.submit(Operation.insert("bob", 0, "b", 2, 2));

        assertEquals(List.of(a.originKey()), doc.appliedOrigins("alice"));
        assertTrue(doc.appliedOrigins("carol").isEmpty());
    }
}
