package com.octate.collab.room;

import com.octate.collab.config.RoomSettings;
import com.octate.collab.document.DocumentState.Authority;
import com.octate.collab.message.Envelope;
import com.octate.collab.message.MessageType;
import com.octate.collab.message.Payloads.SyncData;
import com.octate.collab.ot.Operation;
import com.octate.collab.scheduling.VirtualTimeScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoomManagerTest {

    private final VirtualTimeScheduler scheduler = new VirtualTimeScheduler();
    private final RecordingMessenger messenger = new RecordingMessenger();
    private RoomManager manager;

    @BeforeEach
    void setUp() {
        manager = new RoomManager(RoomSettings.defaults(), scheduler, messenger);
    }

    @Test
    void createRoomIsIdempotent() {
        List<RoomMetadata> created = new ArrayList<>();
        manager.roomCreated().subscribe(created::add);

        RoomMetadata first = manager.createRoom("r1", "Notes", "alice", "Alice");
        RoomMetadata second = manager.createRoom("r1", "Other", "bob", "Bob");

        assertEquals(first, second);
        assertEquals(1, created.size());
        assertEquals("alice", second.hostId());
        assertEquals(1, second.peerCount());
        assertTrue(manager.requirePeer("r1", "alice").isHost());
    }

    @Test
    void createRoomKeepsSnapshot() {
        RoomMetadata metadata = manager.createRoom("r1", null, "alice", "Alice", "file-9", "seed", 12L, Authority.PEER);

        assertEquals("r1", metadata.roomName());
        assertEquals("seed", metadata.content());
        assertEquals(12, metadata.version());
        assertEquals("file-9", metadata.fileId());
        assertEquals(Authority.PEER, manager.authorityOf("r1"));
        assertEquals("peer", metadata.authority());
        assertEquals("server", manager.createRoom("r2", "Other", "bob", "Bob").authority());
    }

    @Test
    void joiningUnknownRoomFails() {
        assertThrows(RoomNotFoundException.class, () -> manager.joinRoom("nope", "bob", "Bob"));
    }

    @Test
    void joinAddsPeerAndFiresEvent() {
        List<PeerEvent> joined = new ArrayList<>();
        manager.peerJoined().subscribe(joined::add);
        manager.createRoom("r1", "Notes", "alice", "Alice");

        RoomMetadata metadata = manager.joinRoom("r1", "bob", "Bob");

        assertEquals(2, metadata.peerCount());
        assertEquals(RoomState.ACTIVE, metadata.state());
        assertEquals(List.of(new PeerEvent("r1", "bob", "Bob", false)), joined);
        assertFalse(manager.requirePeer("r1", "bob").isHost());
    }

    @Test
    void rejoinRefreshesHeartbeatWithoutEvent() {
        List<PeerEvent> joined = new ArrayList<>();
        manager.createRoom("r1", "Notes", "alice", "Alice");
        manager.joinRoom("r1", "bob", "Bob");
        manager.peerJoined().subscribe(joined::add);
        scheduler.advance(Duration.ofSeconds(30));

        manager.joinRoom("r1", "bob", "Bob");

        assertTrue(joined.isEmpty());
        assertEquals(scheduler.currentTimeMillis(), manager.requirePeer("r1", "bob").lastHeartbeat());
        assertEquals(2, manager.getPeerList("r1").size());
    }

    @Test
    void singlePeerRoomGoesIdleAfterDelay() {
        manager.createRoom("r1", "Notes", "alice", "Alice");
        manager.joinRoom("r1", "bob", "Bob");
        manager.leaveRoom("r1", "bob");
        assertEquals(RoomState.ACTIVE, manager.getRoomMetadata("r1").orElseThrow().state());

        scheduler.advance(Duration.ofSeconds(5));

        assertEquals(RoomState.IDLE, manager.getRoomMetadata("r1").orElseThrow().state());
    }

    @Test
    void roomWithTwoPeersStaysActive() {
        manager.createRoom("r1", "Notes", "alice", "Alice");
        manager.joinRoom("r1", "bob", "Bob");

        scheduler.advance(Duration.ofSeconds(10));

        assertEquals(RoomState.ACTIVE, manager.getRoomMetadata("r1").orElseThrow().state());
    }

    @Test
    void lastPeerLeavingMakesRoomIdle() {
        List<PeerEvent> left = new ArrayList<>();
        manager.peerLeft().subscribe(left::add);
        manager.createRoom("r1", "Notes", "alice", "Alice");

        RoomMetadata metadata = manager.leaveRoom("r1", "alice").orElseThrow();

        assertEquals(RoomState.IDLE, metadata.state());
        assertEquals(0, metadata.peerCount());
        assertEquals(List.of(new PeerEvent("r1", "alice", "Alice", false)), left);
        assertTrue(manager.leaveRoom("missing", "alice").isEmpty());
    }

    @Test
    void sweepEvictsSilentGuestsButNotHost() {
        List<PeerEvent> left = new ArrayList<>();
        manager.peerLeft().subscribe(left::add);
        manager.createRoom("r1", "Notes", "alice", "Alice");
        manager.joinRoom("r1", "bob", "Bob");
        manager.joinRoom("r1", "carol", "Carol");
        manager.start();

        scheduler.advance(Duration.ofMinutes(4));
        manager.updatePeerHeartbeat("r1", "carol");
        scheduler.advance(Duration.ofMinutes(2));

        assertEquals(List.of(new PeerEvent("r1", "bob", "Bob", true)), left);
        assertTrue(manager.isMember("r1", "alice"));
        assertTrue(manager.isMember("r1", "carol"));
        assertFalse(manager.isMember("r1", "bob"));
    }

    @Test
    void sweepRemovesEmptyRooms() {
        List<String> closed = new ArrayList<>();
        manager.roomClosed().subscribe(closed::add);
        manager.createRoom("r1", "Notes", "alice", "Alice");
        manager.leaveRoom("r1", "alice");
        manager.start();

        scheduler.advance(Duration.ofSeconds(60));

        assertEquals(List.of("r1"), closed);
        assertTrue(manager.getRoomMetadata("r1").isEmpty());
    }

    @Test
    void sweepRemovesRoomsInactivePastTimeout() {
        manager.createRoom("r1", "Notes", "alice", "Alice");
        manager.start();

        scheduler.advance(Duration.ofHours(3));
        assertTrue(manager.getRoomMetadata("r1").isPresent());

        scheduler.advance(Duration.ofMinutes(1));
        assertTrue(manager.getRoomMetadata("r1").isEmpty());
    }

    @Test
    void broadcastSkipsSenderAndSurvivesFailingPeer() {
        manager.createRoom("r1", "Notes", "alice", "Alice");
        manager.joinRoom("r1", "bob", "Bob");
        manager.joinRoom("r1", "carol", "Carol");
        messenger.failing.add("bob");

        int delivered = manager.broadcastToRoom("r1", Envelope.of(MessageType.PRESENCE, "r1", "alice", null), "alice");

        assertEquals(1, delivered);
        assertEquals(1, messenger.framesFor("carol").size());
        assertTrue(messenger.framesFor("alice").isEmpty());
        assertTrue(manager.getRoomStats("r1").orElseThrow().bandwidth().sent() > 0);
        assertEquals(0, manager.broadcastToRoom("missing", Envelope.of(MessageType.PRESENCE, null), null));
    }

    @Test
    void sendToPeerRequiresMembership() {
        manager.createRoom("r1", "Notes", "alice", "Alice");

        assertFalse(manager.sendToPeer("r1", "bob", Envelope.of(MessageType.OFFER, null)));
        assertTrue(manager.sendToPeer("r1", "alice", Envelope.of(MessageType.OFFER, null)));
        assertThrows(RoomNotFoundException.class,
            () -> manager.sendToPeer("missing", "alice", Envelope.of(MessageType.OFFER, null)));
    }

    @Test
    void appliedOperationsAreCountedAndSynced() {
        manager.createRoom("r1", "Notes", "alice", "Alice");
        Operation op = Operation.insert("alice", 0, "hi", 5, 1);

        manager.applyOperation("r1", op);
        manager.applyOperation("r1", op);

        RoomStats stats = manager.getRoomStats("r1").orElseThrow();
        assertEquals(1, stats.operationCount());
        assertTrue(stats.bandwidth().received() > 0);

        SyncData sync = manager.syncFor("r1", "alice");
        assertEquals("hi", sync.content());
        assertEquals(1, sync.version());
        assertEquals(List.of(op.originKey()), sync.applied());
        assertThrows(RoomNotFoundException.class, () -> manager.syncFor("missing", "alice"));
    }

    @Test
    void peerListIsEmptyForUnknownRoom() {
        assertTrue(manager.getPeerList("missing").isEmpty());
        assertThrows(PeerNotFoundException.class, () -> {
            manager.createRoom("r1", "Notes", "alice", "Alice");
            manager.requirePeer("r1", "bob");
        });
    }

    @Test
    void statsSummarizeAllRooms() {
        manager.createRoom("r1", "Notes", "alice", "Alice");
        manager.joinRoom("r1", "bob", "Bob");
        manager.createRoom("r2", "Draft", "carol", "Carol");
        manager.leaveRoom("r2", "carol");
        scheduler.advance(Duration.ofSeconds(2));

        ServerStats stats = manager.getStats();
        assertEquals(2, stats.totalRooms());
        assertEquals(1, stats.activeRooms());
        assertEquals(2, stats.totalConnections());
        assertEquals(2000, stats.uptime());

        List<RoomSummary> rooms = manager.listRooms();
        assertEquals(2, rooms.size());
        assertEquals(2000, rooms.get(0).inactiveDuration());
    }

    @Test
    void shutdownCancelsTimersAndForgetsRooms() {
        manager.createRoom("r1", "Notes", "alice", "Alice");
        manager.joinRoom("r1", "bob", "Bob");
        manager.start();

        manager.shutdown();

        assertEquals(0, scheduler.pendingTasks());
        assertTrue(manager.getAllRooms().isEmpty());
    }
}
