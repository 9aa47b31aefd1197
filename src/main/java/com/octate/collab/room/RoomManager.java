package com.octate.collab.room;

import com.octate.collab.config.CollabConfig;
import com.octate.collab.config.RoomSettings;
import com.octate.collab.document.DocumentState.Authority;
import com.octate.collab.event.EventChannel;
import com.octate.collab.message.Envelope;
import com.octate.collab.message.MessageCodec;
import com.octate.collab.message.Payloads.SyncData;
import com.octate.collab.ot.Operation;
import com.octate.collab.scheduling.TaskScheduler;
import com.octate.collab.scheduling.TaskScheduler.Cancellable;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns every room: creation, membership, the ACTIVE/IDLE state machine and the
 * periodic sweep that evicts silent peers and expired rooms.
 * <p>
 * All mutations hold this manager's monitor, so handlers for the same room never
 * interleave halfway through a change.
 */
@ApplicationScoped
public class RoomManager {

    private static final Logger LOG = Logger.getLogger(RoomManager.class);

    private final RoomSettings settings;
    private final TaskScheduler scheduler;
    private final RoomMessenger messenger;
    private final Map<String, Room> rooms = new LinkedHashMap<>();
    private final long startedAt;

    private final EventChannel<RoomMetadata> roomCreated = new EventChannel<>("roomCreated");
    private final EventChannel<String> roomClosed = new EventChannel<>("roomClosed");
    private final EventChannel<PeerEvent> peerJoined = new EventChannel<>("peerJoined");
    private final EventChannel<PeerEvent> peerLeft = new EventChannel<>("peerLeft");

    private Cancellable sweep;

    @Inject
    public RoomManager(CollabConfig config, TaskScheduler scheduler, RoomMessenger messenger) {
        this(RoomSettings.from(config.rooms()), scheduler, messenger);
    }

    public RoomManager(RoomSettings settings, TaskScheduler scheduler, RoomMessenger messenger) {
        this.settings = settings;
        this.scheduler = scheduler;
        this.messenger = messenger;
        this.startedAt = scheduler.currentTimeMillis();
    }

    public synchronized void start() {
        if (sweep != null) {
            return;
        }
        sweep = scheduler.scheduleAtFixedRate(settings.cleanupInterval(), this::cleanup);
        LOG.infof("Room sweep started (every %s)", settings.cleanupInterval());
    }

    public RoomMetadata createRoom(String roomId, String roomName, String hostId, String hostName) {
        return createRoom(roomId, roomName, hostId, hostName, null, null, null, Authority.SERVER);
    }

    /** Idempotent: an existing room is returned unchanged. */
    public synchronized RoomMetadata createRoom(String roomId, String roomName, String hostId, String hostName,
                                                String fileId, String content, Long version, Authority authority) {
        Room existing = rooms.get(roomId);
        if (existing != null) {
            LOG.debugf("Room %s already exists", roomId);
            return existing.metadata();
        }
        long now = now();
        RoomDocument document = new RoomDocument(content, version == null ? 0 : version, settings.historyLimit());
        Room room = new Room(roomId, roomName != null ? roomName : roomId, hostId, hostName, fileId,
            authority != null ? authority : Authority.SERVER, document, now);
        room.peers.put(hostId, Peer.connect(hostId, hostName, true, now));
        rooms.put(roomId, room);

        LOG.infof("Room %s created by %s", roomId, hostId);
        RoomMetadata metadata = room.metadata();
        roomCreated.fire(metadata);
        return metadata;
    }

    public synchronized RoomMetadata joinRoom(String roomId, String userId, String userName) {
        Room room = require(roomId);
        long now = now();
        Peer member = room.peers.get(userId);
        if (member != null) {
            room.peers.put(userId, member.withHeartbeat(now));
            room.touch(now);
            LOG.debugf("User %s rejoined room %s", userId, roomId);
            return room.metadata();
        }

        Peer peer = Peer.connect(userId, userName, false, now);
        room.peers.put(userId, peer);
        room.touch(now);
        room.state = RoomState.ACTIVE;
        scheduleIdleCheck(room);

        LOG.infof("User %s joined room %s (%d peers)", userId, roomId, room.peers.size());
        peerJoined.fire(new PeerEvent(roomId, userId, userName, false));
        return room.metadata();
    }

    public synchronized Optional<RoomMetadata> leaveRoom(String roomId, String userId) {
        Room room = rooms.get(roomId);
        if (room == null) {
            return Optional.empty();
        }
        Peer removed = room.peers.remove(userId);
        room.touch(now());
        if (removed != null) {
            LOG.infof("User %s left room %s (%d remaining)", userId, roomId, room.peers.size());
            peerLeft.fire(new PeerEvent(roomId, userId, removed.userName(), false));
        }
        if (room.peers.isEmpty()) {
            room.state = RoomState.IDLE;
            room.cancelIdleCheck();
            LOG.infof("Room %s is idle (no peers)", roomId);
        }
        return Optional.of(room.metadata());
    }

    public synchronized boolean updatePeerHeartbeat(String roomId, String userId) {
        Room room = rooms.get(roomId);
        if (room == null) {
            return false;
        }
        Peer peer = room.peers.get(userId);
        if (peer == null) {
            return false;
        }
        long now = now();
        room.peers.put(userId, peer.withHeartbeat(now));
        room.touch(now);
        return true;
    }

    public synchronized Peer requirePeer(String roomId, String userId) {
        Peer peer = require(roomId).peers.get(userId);
        if (peer == null) {
            throw new PeerNotFoundException(roomId, userId);
        }
        return peer;
    }

    public synchronized boolean isMember(String roomId, String userId) {
        Room room = rooms.get(roomId);
        return room != null && room.peers.containsKey(userId);
    }

    public synchronized void recordOperation(String roomId, Operation op) {
        Room room = rooms.get(roomId);
        if (room == null) {
            return;
        }
        room.operationCount++;
        room.touch(now());
        room.bytesReceived += MessageCodec.toData(op).toString().length();
    }

    /** Orders an operation into the room's document; see {@link RoomDocument#submit}. */
    public synchronized RoomDocument.Applied applyOperation(String roomId, Operation op) {
        Room room = require(roomId);
        RoomDocument.Applied applied = room.document.submit(op);
        if (!applied.duplicate()) {
            recordOperation(roomId, applied.op());
        }
        return applied;
    }

    public synchronized SyncData syncFor(String roomId, String userId) {
        Room room = require(roomId);
        return new SyncData(room.document.content(), room.document.version(), roomId,
            room.document.appliedOrigins(userId));
    }

    public synchronized Authority authorityOf(String roomId) {
        return require(roomId).authority;
    }

    /** @return how many members the frame was handed to */
    public synchronized int broadcastToRoom(String roomId, Envelope message, String exceptUserId) {
        Room room = rooms.get(roomId);
        if (room == null) {
            LOG.warnf("Cannot broadcast %s to missing room %s", message.type().wireName(), roomId);
            return 0;
        }
        String frame = MessageCodec.encode(message);
        int delivered = 0;
        for (String userId : room.peers.keySet()) {
            if (userId.equals(exceptUserId)) {
                continue;
            }
            if (deliver(room, userId, frame)) {
                delivered++;
            }
        }
        LOG.debugf("Broadcast %s to %d peers of %s", message.type().wireName(), delivered, roomId);
        return delivered;
    }

    public synchronized boolean sendToPeer(String roomId, String userId, Envelope message) {
        Room room = require(roomId);
        if (!room.peers.containsKey(userId)) {
            return false;
        }
        return deliver(room, userId, MessageCodec.encode(message));
    }

    private boolean deliver(Room room, String userId, String frame) {
        try {
            if (messenger.deliver(room.roomId, userId, frame)) {
                room.bytesSent += frame.length();
                return true;
            }
        } catch (RuntimeException e) {
            LOG.warnf(e, "Delivery to %s in room %s failed", userId, room.roomId);
        }
        return false;
    }

    /**
     * Deletes rooms idle past the inactivity timeout, evicts non-host peers whose
     * heartbeat is older than the heartbeat timeout and deletes rooms left empty.
     */
    public synchronized void cleanup() {
        long now = now();
        List<String> toDelete = new ArrayList<>();
        for (Room room : rooms.values()) {
            try {
                sweep(room, now, toDelete);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Cleanup of room %s failed", room.roomId);
            }
        }
        for (String roomId : toDelete) {
            closeRoom(roomId);
        }
        if (!toDelete.isEmpty()) {
            LOG.infof("Cleanup removed %d rooms", toDelete.size());
        }
    }

    private void sweep(Room room, long now, List<String> toDelete) {
        if (now - room.lastActivity > settings.inactivityTimeout().toMillis()) {
            LOG.infof("Removing expired room %s", room.roomId);
            toDelete.add(room.roomId);
            return;
        }
        long heartbeatTimeout = settings.heartbeatTimeout().toMillis();
        for (Iterator<Peer> it = room.peers.values().iterator(); it.hasNext(); ) {
            Peer peer = it.next();
            if (!peer.isHost() && now - peer.lastHeartbeat() > heartbeatTimeout) {
                it.remove();
                LOG.infof("Evicted silent peer %s from room %s", peer.userId(), room.roomId);
                peerLeft.fire(new PeerEvent(room.roomId, peer.userId(), peer.userName(), true));
            }
        }
        if (room.peers.isEmpty()) {
            LOG.infof("Removing empty room %s", room.roomId);
            toDelete.add(room.roomId);
        }
    }

    public synchronized boolean closeRoom(String roomId) {
        Room room = rooms.remove(roomId);
        if (room == null) {
            return false;
        }
        room.cancelIdleCheck();
        LOG.infof("Room %s closed", roomId);
        roomClosed.fire(roomId);
        return true;
    }

    private void scheduleIdleCheck(Room room) {
        room.cancelIdleCheck();
        String roomId = room.roomId;
        room.idleCheck = scheduler.schedule(settings.idleCheckDelay(), () -> evaluateIdle(roomId));
    }

    private synchronized void evaluateIdle(String roomId) {
        Room room = rooms.get(roomId);
        if (room == null) {
            return;
        }
        room.idleCheck = null;
        if (room.state == RoomState.ACTIVE && room.peers.size() == 1) {
            room.state = RoomState.IDLE;
            LOG.infof("Room %s is idle (single peer)", roomId);
        }
    }

    public synchronized Optional<RoomMetadata> getRoomMetadata(String roomId) {
        return Optional.ofNullable(rooms.get(roomId)).map(Room::metadata);
    }

    public synchronized List<RoomMetadata> getAllRooms() {
        return rooms.values().stream().map(Room::metadata).toList();
    }

    public synchronized List<RoomSummary> listRooms() {
        long now = now();
        return rooms.values().stream().map(room -> room.summary(now)).toList();
    }

    /** Empty for an unknown room. */
    public synchronized List<Peer> getPeerList(String roomId) {
        Room room = rooms.get(roomId);
        return room == null ? List.of() : room.peerList();
    }

    public synchronized Optional<RoomStats> getRoomStats(String roomId) {
        long now = now();
        return Optional.ofNullable(rooms.get(roomId)).map(room -> room.stats(now));
    }

    public synchronized ServerStats getStats() {
        long now = now();
        int active = (int) rooms.values().stream().filter(r -> r.state == RoomState.ACTIVE).count();
        int connections = rooms.values().stream().mapToInt(r -> r.peers.size()).sum();
        return new ServerStats(now - startedAt, active, rooms.size(), connections,
            JvmMetrics.memory(), JvmMetrics.cpu(), now);
    }

    public EventChannel<RoomMetadata> roomCreated() {
        return roomCreated;
    }

    public EventChannel<String> roomClosed() {
        return roomClosed;
    }

    public EventChannel<PeerEvent> peerJoined() {
        return peerJoined;
    }

    public EventChannel<PeerEvent> peerLeft() {
        return peerLeft;
    }

    public synchronized void shutdown() {
        if (sweep != null) {
            sweep.cancel();
            sweep = null;
        }
        rooms.values().forEach(Room::cancelIdleCheck);
        rooms.clear();
        LOG.info("Room manager shut down");
    }

    private Room require(String roomId) {
        Room room = rooms.get(roomId);
        if (room == null) {
            throw new RoomNotFoundException(roomId);
        }
        return room;
    }

    private long now() {
        return scheduler.currentTimeMillis();
    }
}
