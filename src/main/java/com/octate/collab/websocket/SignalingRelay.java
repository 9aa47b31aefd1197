package com.octate.collab.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.octate.collab.CollaborationException;
import com.octate.collab.document.DocumentState.Authority;
import com.octate.collab.document.StaleOperationException;
import com.octate.collab.message.Envelope;
import com.octate.collab.message.MessageCodec;
import com.octate.collab.message.MessageType;
import com.octate.collab.message.Payloads.AuthData;
import com.octate.collab.message.Payloads.AuthSuccessData;
import com.octate.collab.message.Payloads.CreateRoomData;
import com.octate.collab.message.Payloads.HeartbeatData;
import com.octate.collab.message.Payloads.IntroducePeersData;
import com.octate.collab.message.Payloads.JoinRoomData;
import com.octate.collab.message.Payloads.PeerData;
import com.octate.collab.message.Payloads.RoomCreatedData;
import com.octate.collab.message.Payloads.RoomJoinedData;
import com.octate.collab.message.Payloads.UserData;
import com.octate.collab.message.ProtocolException;
import com.octate.collab.ot.Operation;
import com.octate.collab.room.Peer;
import com.octate.collab.room.PeerEvent;
import com.octate.collab.room.RoomDocument;
import com.octate.collab.room.RoomManager;
import com.octate.collab.room.RoomMetadata;
import com.octate.collab.room.RoomNotFoundException;
import com.octate.collab.security.AuthService;
import com.octate.collab.security.AuthService.AuthResult;
import com.octate.collab.websocket.ConnectionRegistry.Binding;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.UUID;

/**
 * Routes protocol frames between admitted peers. Independent of the socket
 * technology: {@link SignalingSocket} feeds it connection ids and raw frames.
 * <p>
 * The user id of every forwarded frame is the one the connection authenticated
 * as, never what the frame claims.
 */
@Startup
@ApplicationScoped
public class SignalingRelay {

    private static final Logger LOG = Logger.getLogger(SignalingRelay.class);

    static final int POLICY_VIOLATION = 1008;

    private final RoomManager roomManager;
    private final ConnectionRegistry registry;
    private final AuthService authService;

    public SignalingRelay(RoomManager roomManager, ConnectionRegistry registry, AuthService authService) {
        this.roomManager = roomManager;
        this.registry = registry;
        this.authService = authService;
        roomManager.peerLeft().subscribe(this::onPeerLeft);
        roomManager.roomClosed().subscribe(registry::unbindRoom);
    }

    public void open(PeerConnection connection) {
        registry.register(connection);
        LOG.debugf("Connection opened: %s", connection.id());
    }

    public void handle(String connectionId, String frame) {
        Binding binding = registry.binding(connectionId);
        if (binding == null) {
            LOG.warnf("Frame on unknown connection %s", connectionId);
            return;
        }
        PeerConnection connection = binding.connection();
        try {
            Envelope msg = MessageCodec.decode(frame);
            LOG.debugf("Received %s from %s", msg.type().wireName(), binding.userId());
            dispatch(binding, msg);
        } catch (ProtocolException e) {
            LOG.debugf("Protocol error on %s: %s", connectionId, e.getMessage());
            reply(connection, Envelope.error(e.getMessage()));
        } catch (CollaborationException e) {
            LOG.warnf("Rejected frame from %s: %s", binding.userId(), e.getMessage());
            reply(connection, Envelope.error(e.getMessage()));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Handler failed for connection %s", connectionId);
            reply(connection, Envelope.error("Internal error"));
        }
    }

    /** The room slot survives until the heartbeat sweep; only the socket binding goes. */
    public void disconnect(String connectionId) {
        Binding binding = registry.remove(connectionId);
        if (binding != null) {
            LOG.infof("Connection %s closed (user %s, room %s)", connectionId, binding.userId(), binding.roomId());
        }
    }

    private void dispatch(Binding binding, Envelope msg) {
        if (msg.type() != MessageType.AUTH && !binding.isAuthenticated()) {
            throw new ProtocolException("Not authenticated");
        }
        switch (msg.type()) {
            case AUTH -> handleAuth(binding, msg);
            case CREATE_ROOM -> handleCreateRoom(binding, msg);
            case JOIN_ROOM -> handleJoinRoom(binding, msg);
            case LEAVE_ROOM -> handleLeaveRoom(binding);
            case OPERATION -> handleOperation(binding, msg);
            case CURSOR, PRESENCE -> handlePresence(binding, msg);
            case OFFER, ANSWER, ICE -> handleSignal(binding, msg);
            case HEARTBEAT -> handleHeartbeat(binding, msg);
            case SYNC_REQUEST -> handleSyncRequest(binding);
            case AUTH_SUCCESS, ROOM_CREATED, ROOM_JOINED, INTRODUCE_PEERS, SYNC, ACK,
                 USER_JOINED, USER_LEFT, HEARTBEAT_ACK, ERROR ->
                throw new ProtocolException("Unexpected message type from client: " + msg.type().wireName());
        }
    }

    private void handleAuth(Binding binding, Envelope msg) {
        AuthData data = MessageCodec.optionalPayload(msg, AuthData.class);
        String userId = data != null && data.userId() != null ? data.userId() : msg.userId();
        String userName = data != null && data.userName() != null ? data.userName() : msg.userName();
        String token = data != null ? data.token() : null;

        AuthResult result = authService.authenticate(userId, token);
        PeerConnection connection = binding.connection();
        if (!result.authenticated()) {
            LOG.warnf("Authentication failed on %s: %s", connection.id(), result.reason());
            reply(connection, Envelope.error(result.reason()));
            connection.close(POLICY_VIOLATION, result.reason());
            return;
        }
        registry.authenticate(connection.id(), userId, userName != null ? userName : userId);
        reply(connection, Envelope.of(MessageType.AUTH_SUCCESS, null, userId,
            new AuthSuccessData(userId, connection.id())));
        LOG.infof("Client authenticated: %s", userId);
    }

    private void handleCreateRoom(Binding binding, Envelope msg) {
        CreateRoomData data = MessageCodec.optionalPayload(msg, CreateRoomData.class);
        String roomId = firstNonNull(msg.roomId(), data != null ? data.roomId() : null, UUID.randomUUID().toString());
        String userId = binding.userId();
        String userName = firstNonNull(data != null ? data.userName() : null, msg.userName(), binding.userName());
        Authority authority = parseAuthority(data != null ? data.authority() : null);

        RoomMetadata metadata = roomManager.createRoom(roomId,
            data != null ? data.roomName() : null, userId, userName,
            data != null ? data.fileId() : null,
            data != null ? data.content() : null,
            data != null ? data.version() : null,
            authority);
        if (!roomManager.isMember(roomId, userId)) {
            metadata = roomManager.joinRoom(roomId, userId, userName);
        }
        registry.bind(binding.connection().id(), roomId);

        reply(binding.connection(), Envelope.of(MessageType.ROOM_CREATED, roomId, userId, new RoomCreatedData(metadata)));
        reply(binding.connection(), Envelope.of(MessageType.SYNC, roomId, userId, roomManager.syncFor(roomId, userId)));
    }

    private void handleJoinRoom(Binding binding, Envelope msg) {
        JoinRoomData data = MessageCodec.optionalPayload(msg, JoinRoomData.class);
        String roomId = firstNonNull(msg.roomId(), data != null ? data.roomId() : null);
        if (roomId == null) {
            throw new ProtocolException("join-room requires roomId");
        }
        String userId = binding.userId();
        String userName = firstNonNull(data != null ? data.userName() : null, msg.userName(), binding.userName());
        Authority authority = parseAuthority(data != null ? data.authority() : null);

        RoomMetadata metadata;
        try {
            metadata = roomManager.joinRoom(roomId, userId, userName);
        } catch (RoomNotFoundException e) {
            if (data == null || !data.carriesSnapshot()) {
                throw e;
            }
            LOG.infof("Recreating room %s from the snapshot sent by %s", roomId, userId);
            metadata = roomManager.createRoom(roomId, data.roomName(), userId, userName,
                data.fileId(), data.content(), data.version(), authority);
        }
        registry.bind(binding.connection().id(), roomId);

        List<PeerData> peers = roomManager.getPeerList(roomId).stream().map(SignalingRelay::toPeerData).toList();
        reply(binding.connection(), Envelope.of(MessageType.ROOM_JOINED, roomId, userId, new RoomJoinedData(metadata, peers)));
        reply(binding.connection(), Envelope.of(MessageType.SYNC, roomId, userId, roomManager.syncFor(roomId, userId)));

        UserData joined = new UserData(userId, userName);
        roomManager.broadcastToRoom(roomId, Envelope.of(MessageType.USER_JOINED, roomId, userId, joined), userId);
        List<PeerData> others = peers.stream().filter(p -> !p.userId().equals(userId)).toList();
        roomManager.broadcastToRoom(roomId,
            Envelope.of(MessageType.INTRODUCE_PEERS, roomId, "server", new IntroducePeersData(joined, others)), null);
    }

    private void handleLeaveRoom(Binding binding) {
        String roomId = binding.roomId();
        if (roomId == null) {
            return;
        }
        String userId = binding.userId();
        registry.unbind(binding.connection().id());
        roomManager.leaveRoom(roomId, userId).ifPresent(room ->
            roomManager.broadcastToRoom(roomId,
                Envelope.of(MessageType.USER_LEFT, roomId, userId, new UserData(userId, binding.userName())), userId));
    }

    private void handleOperation(Binding binding, Envelope msg) {
        String roomId = requireRoom(binding);
        String userId = binding.userId();
        Operation op = MessageCodec.payload(msg, Operation.class);
        if (!userId.equals(op.userId())) {
            throw new ProtocolException("Operation author does not match connection");
        }

        RoomDocument.Applied applied;
        try {
            applied = roomManager.applyOperation(roomId, op);
        } catch (StaleOperationException e) {
            LOG.warnf("Stale operation from %s in %s: %s", userId, roomId, e.getMessage());
            reply(binding.connection(), Envelope.error(e.getMessage()));
            reply(binding.connection(), Envelope.of(MessageType.SYNC, roomId, userId, roomManager.syncFor(roomId, userId)));
            return;
        }
        roomManager.updatePeerHeartbeat(roomId, userId);

        reply(binding.connection(), Envelope.of(MessageType.ACK, roomId, userId, applied.op()));
        if (!applied.duplicate()) {
            roomManager.broadcastToRoom(roomId, Envelope.of(MessageType.OPERATION, roomId, userId, applied.op()), userId);
        }
    }

    private void handlePresence(Binding binding, Envelope msg) {
        String roomId = requireRoom(binding);
        String userId = binding.userId();
        roomManager.updatePeerHeartbeat(roomId, userId);
        Envelope forwarded = new Envelope(msg.type(), roomId, userId, binding.userName(), msg.data(),
            msg.timestamp() != null ? msg.timestamp() : System.currentTimeMillis());
        roomManager.broadcastToRoom(roomId, forwarded, userId);
    }

    private void handleSignal(Binding binding, Envelope msg) {
        String roomId = requireRoom(binding);
        if (!msg.hasData() || !msg.data().isObject()) {
            throw new ProtocolException(msg.type().wireName() + " requires data");
        }
        JsonNode to = msg.data().get("to");
        if (to == null || !to.isTextual()) {
            throw new ProtocolException(msg.type().wireName() + " requires data.to");
        }
        String target = to.asText();
        ObjectNode payload = ((ObjectNode) msg.data()).deepCopy();
        payload.put("from", binding.userId());

        Envelope forwarded = new Envelope(msg.type(), roomId, binding.userId(), binding.userName(), payload,
            System.currentTimeMillis());
        if (!roomManager.sendToPeer(roomId, target, forwarded)) {
            throw new TargetPeerUnreachableException(target);
        }
        LOG.debugf("Forwarded %s from %s to %s", msg.type().wireName(), binding.userId(), target);
    }

    private void handleHeartbeat(Binding binding, Envelope msg) {
        HeartbeatData data = MessageCodec.optionalPayload(msg, HeartbeatData.class);
        String roomId = firstNonNull(binding.roomId(), msg.roomId(), data != null ? data.roomId() : null);
        if (roomId != null) {
            roomManager.updatePeerHeartbeat(roomId, binding.userId());
        }
        reply(binding.connection(), Envelope.of(MessageType.HEARTBEAT_ACK, roomId, binding.userId(),
            new HeartbeatData(roomId)));
    }

    private void handleSyncRequest(Binding binding) {
        String roomId = requireRoom(binding);
        reply(binding.connection(), Envelope.of(MessageType.SYNC, roomId, binding.userId(),
            roomManager.syncFor(roomId, binding.userId())));
    }

    private void onPeerLeft(PeerEvent event) {
        if (event.evicted()) {
            registry.unbindMember(event.roomId(), event.userId());
            roomManager.broadcastToRoom(event.roomId(), Envelope.of(MessageType.USER_LEFT, event.roomId(),
                event.userId(), new UserData(event.userId(), event.userName())), event.userId());
        }
    }

    private String requireRoom(Binding binding) {
        String roomId = binding.roomId();
        if (roomId == null) {
            throw new ProtocolException("Not in a room");
        }
        return roomId;
    }

    private void reply(PeerConnection connection, Envelope message) {
        if (connection.isOpen()) {
            connection.send(MessageCodec.encode(message));
        }
    }

    private static Authority parseAuthority(String value) {
        return "peer".equalsIgnoreCase(value) ? Authority.PEER : Authority.SERVER;
    }

    private static PeerData toPeerData(Peer peer) {
        return new PeerData(peer.userId(), peer.userName(), peer.isHost(), peer.color(), peer.connectedAt());
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
