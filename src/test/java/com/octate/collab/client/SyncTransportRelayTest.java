package com.octate.collab.client;

import com.octate.collab.document.PeerAuthoritativeDocument;
import com.octate.collab.document.ServerAuthoritativeDocument;
import com.octate.collab.message.Payloads.CreateRoomData;
import io.quarkus.test.common.http.TestHTTPResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two transports editing the same room through the running relay.
 */
@QuarkusTest
class SyncTransportRelayTest {

    @TestHTTPResource("/signaling")
    URI signaling;

    @Inject
    SyncTransportFactory factory;

    private SyncTransport alice;
    private SyncTransport bob;
    private SyncTransport carol;

    @AfterEach
    void tearDown() {
        if (alice != null) {
            alice.dispose();
        }
        if (bob != null) {
            bob.dispose();
        }
        if (carol != null) {
            carol.dispose();
        }
    }

    @Test
    void editsReachTheOtherReplica() throws InterruptedException {
        ServerAuthoritativeDocument aliceDoc = new ServerAuthoritativeDocument("alice");
        ServerAuthoritativeDocument bobDoc = new ServerAuthoritativeDocument("bob");
        alice = factory.create(aliceDoc);
        bob = factory.create(bobDoc);

        alice.createRoom(signaling, new CreateRoomData("e2e-room", "E2E", null, "Alice", "base", 0L, "server"),
            "alice", "Alice", null);
        await(() -> alice.status() == ConnectionStatus.CONNECTED, "alice connected");

        bob.connect(signaling, "e2e-room", "bob", "Bob");
        await(() -> bob.status() == ConnectionStatus.CONNECTED, "bob connected");
        assertEquals("base", bobDoc.content());

        aliceDoc.insert(4, "!");
        bobDoc.insert(0, ">");

        await(() -> aliceDoc.content().equals(">base!") && bobDoc.content().equals(">base!")
            && aliceDoc.pending().isEmpty() && bobDoc.pending().isEmpty(), "replicas converge");
        assertEquals(2, aliceDoc.version());
        assertEquals(2, bobDoc.version());
        await(() -> alice.presence().getUser("bob") != null, "alice sees bob");
    }

    @Test
    void peerReplicasAndRelayAgree() throws InterruptedException {
        PeerAuthoritativeDocument aliceDoc = new PeerAuthoritativeDocument("alice");
        PeerAuthoritativeDocument bobDoc = new PeerAuthoritativeDocument("bob");
        alice = factory.create(aliceDoc);
        bob = factory.create(bobDoc);

        alice.createRoom(signaling, new CreateRoomData("e2e-peer-room", "Peers", null, "Alice", "base", 0L, "peer"),
            "alice", "Alice", null);
        await(() -> alice.status() == ConnectionStatus.CONNECTED, "alice connected");
        bob.connect(signaling, "e2e-peer-room", "bob", "Bob");
        await(() -> bob.status() == ConnectionStatus.CONNECTED, "bob connected");

        aliceDoc.insert(4, "!");
        bobDoc.insert(0, ">");
        aliceDoc.insert(0, "[");

        await(() -> aliceDoc.content().equals("[>base!") && bobDoc.content().equals("[>base!")
            && aliceDoc.pending().isEmpty() && bobDoc.pending().isEmpty(), "replicas converge");
        assertEquals(3, aliceDoc.sequence());
        assertEquals(3, bobDoc.sequence());

        PeerAuthoritativeDocument carolDoc = new PeerAuthoritativeDocument("carol");
        carol = factory.create(carolDoc);
        carol.connect(signaling, "e2e-peer-room", "carol", "Carol");
        await(() -> carol.status() == ConnectionStatus.CONNECTED, "carol connected");
        assertEquals("[>base!", carolDoc.content());
    }

    private static void await(BooleanSupplier condition, String description) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting until " + description);
            }
            Thread.sleep(20);
        }
    }
}
