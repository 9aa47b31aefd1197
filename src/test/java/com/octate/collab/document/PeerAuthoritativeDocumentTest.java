package com.octate.collab.document;

import com.octate.collab.ot.Operation;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class PeerAuthoritativeDocumentTest {

    private final AtomicLong clock = new AtomicLong(500);

    @Test
    void everyEditAdvancesLocalVersion() {
        PeerAuthoritativeDocument doc = new PeerAuthoritativeDocument("alice", "", 0, clock::get);

        Operation first = doc.insert(0, "a");
        doc.applyRemote(Operation.insert("bob", 0, "b", 10, 1));
        Operation second = doc.insert(0, "c");

        assertEquals(1, first.version());
        assertEquals(3, second.version());
        assertEquals(3, doc.version());
        assertEquals(DocumentState.Authority.PEER, doc.authority());
    }

    @Test
    void redeliveredOperationIsAppliedOnce() {
        PeerAuthoritativeDocument doc = new PeerAuthoritativeDocument("alice", "xy", 0, clock::get);
        Operation remote = Operation.insert("bob", 1, "-", 10, 1);

        assertTrue(doc.applyRemote(remote));
        assertFalse(doc.applyRemote(remote));
        assertFalse(doc.applyRemote(remote.withVersion(4)));
        assertEquals("x-y", doc.content());
    }

    @Test
    void ownOperationEchoedBackIsIgnored() {
        PeerAuthoritativeDocument doc = new PeerAuthoritativeDocument("alice", "", 0, clock::get);
        Operation mine = doc.insert(0, "hi");

        assertFalse(doc.applyRemote(mine));
        assertEquals("hi", doc.content());
    }

    @Test
    void resetForgetsSeenOperations() {
        PeerAuthoritativeDocument doc = new PeerAuthoritativeDocument("alice", "", 0, clock::get);
        Operation remote = Operation.insert("bob", 0, "b", 10, 1);
        doc.applyRemote(remote);

        doc.reset("", 0);

        assertTrue(doc.applyRemote(remote));
        assertEquals("b", doc.content());
    }

    @Test
    void concurrentEditsConvergeBeforeEitherIsOrdered() {
        PeerAuthoritativeDocument alice = new PeerAuthoritativeDocument("alice", "0123456789", 0, clock::get);
        PeerAuthoritativeDocument bob = new PeerAuthoritativeDocument("bob", "0123456789", 0, clock::get);

        Operation fromAlice = alice.delete(2, 4);
        Operation fromBob = bob.insert(4, "XY");

        alice.applyRemote(fromBob);
        bob.applyRemote(fromAlice);

        assertEquals(alice.content(), bob.content());
        assertEquals("016789", alice.content());
    }

    @Test
    void acknowledgementFollowsRelayVersionNotLocalCounter() {
        PeerAuthoritativeDocument doc = new PeerAuthoritativeDocument("alice", "", 7, clock::get);
        Operation mine = doc.insert(0, "a");

        assertTrue(doc.acknowledge(mine.withVersion(12)));

        assertTrue(doc.pending().isEmpty());
        assertEquals(12, doc.sequence());
        assertEquals(8, doc.version());
    }

    @Test
    void acknowledgedOperationIsStillRecognised() {
        PeerAuthoritativeDocument doc = new PeerAuthoritativeDocument("alice", "", 0, clock::get);
        Operation mine = doc.insert(0, "a");
        doc.acknowledge(mine.withVersion(1));

        assertFalse(doc.applyRemote(mine.withVersion(1)));
        assertEquals("a", doc.content());
    }

    @Test
    void remoteAfterAcknowledgementIsNotShifted() {
        PeerAuthoritativeDocument doc = new PeerAuthoritativeDocument("alice", "ab", 0, clock::get);
        Operation mine = doc.insert(0, "X");
        doc.acknowledge(mine.withVersion(1));

        doc.applyRemote(Operation.insert("bob", 1, "Y", 20, 2));

        assertEquals("XYab", doc.content());
        assertEquals(2, doc.sequence());
    }
}
