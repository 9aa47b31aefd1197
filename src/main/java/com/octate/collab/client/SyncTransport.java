package com.octate.collab.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.octate.collab.CollaborationException;
import com.octate.collab.config.TransportSettings;
import com.octate.collab.document.DocumentState;
import com.octate.collab.document.DocumentState.Authority;
import com.octate.collab.event.EventChannel;
import com.octate.collab.event.Subscription;
import com.octate.collab.message.Envelope;
import com.octate.collab.message.MessageCodec;
import com.octate.collab.message.MessageType;
import com.octate.collab.message.Payloads.AuthData;
import com.octate.collab.message.Payloads.CreateRoomData;
import com.octate.collab.message.Payloads.HeartbeatData;
import com.octate.collab.message.Payloads.IntroducePeersData;
import com.octate.collab.message.Payloads.JoinRoomData;
import com.octate.collab.message.Payloads.PeerData;
import com.octate.collab.message.Payloads.RoomJoinedData;
import com.octate.collab.message.Payloads.SyncData;
import com.octate.collab.message.Payloads.UserData;
import com.octate.collab.message.ProtocolException;
import com.octate.collab.ot.Operation;
import com.octate.collab.presence.PresenceTracker;
import com.octate.collab.presence.PresenceUpdate;
import com.octate.collab.scheduling.TaskScheduler;
import com.octate.collab.scheduling.TaskScheduler.Cancellable;
import io.smallrye.mutiny.Multi;
import org.jboss.logging.Logger;

import java.net.URI;
import java.util.List;

/**
 * Client session with the relay: authenticates, joins or creates a room, keeps
 * the document and presence in step with inbound traffic and reconnects with
 * backoff when the channel drops.
 * <p>
 * Exactly one local operation is in flight. The next pending one is sent when the
 * previous is acknowledged, stamped with the relay version after the document's
 * {@link DocumentState#sequence() sequence}, so the relay can rebase it over exactly
 * the operations its author had not seen. This holds for both kinds of document;
 * a peer-authoritative one only keeps its own counter as its version.
 * Operations wait in the document while disconnected; every other outbound
 * frame waits in the bounded {@link OutboundQueue}.
 * <p>
 * All state is guarded by the document's monitor, the same lock the document
 * holds while publishing its events.
 */
public class SyncTransport {

    private static final Logger LOG = Logger.getLogger(SyncTransport.class);

    static final int POLICY_VIOLATION = 1008;

    private final ChannelConnector connector;
    private final TaskScheduler scheduler;
    private final TransportSettings settings;
    private final ReconnectPolicy policy;
    private final DocumentState document;
    private final PresenceTracker presence;
    private final OutboundQueue queue;
    private final Object lock;

    private final EventChannel<ConnectionStatus> statusChanged = new EventChannel<>("statusChanged");
    private final EventChannel<CollaborationException> errors = new EventChannel<>("transportErrors");
    private final EventChannel<Envelope> membership = new EventChannel<>("membership");
    private final EventChannel<Envelope> signals = new EventChannel<>("signals");
    private final List<Subscription> documentSubscriptions;

    private URI endpoint;
    private String roomId;
    private String userId;
    private String userName;
    private String token;
    private CreateRoomData createRequest;

    private DuplexChannel channel;
    private long generation;
    private boolean authenticated;
    private boolean manualDisconnect;
    private boolean disposed;
    private int attempts;
    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;

    private Operation inFlight;

    private Cancellable reconnectTimer;
    private Cancellable heartbeatTimer;
    private Cancellable heartbeatTimeout;

    public SyncTransport(ChannelConnector connector, TaskScheduler scheduler, TransportSettings settings,
                         DocumentState document, PresenceTracker presence) {
        this.connector = connector;
        this.scheduler = scheduler;
        this.settings = settings;
        this.policy = new ReconnectPolicy(settings.reconnectBaseMs(), settings.reconnectMaxMs(),
            settings.reconnectAttempts());
        this.document = document;
        this.presence = presence;
        this.queue = new OutboundQueue(settings.queueCapacity());
        this.lock = document;
        this.documentSubscriptions = List.of(
            document.operationApplied().subscribe(this::onDocumentOperation),
            document.syncRequired().subscribe(version -> requestSync()));
    }

    public void connect(URI endpoint, String roomId, String userId, String userName) {
        connect(endpoint, roomId, userId, userName, null);
    }

    /** Joins {@code roomId}; a non-null token is sent as the bearer credential. */
    public void connect(URI endpoint, String roomId, String userId, String userName, String token) {
        synchronized (lock) {
            start(endpoint, roomId, userId, userName, token, null);
        }
    }

    /** Like {@link #connect} but sends {@code create-room} with the given data after authenticating. */
    public void createRoom(URI endpoint, CreateRoomData room, String userId, String userName, String token) {
        synchronized (lock) {
            start(endpoint, room.roomId(), userId, userName, token, room);
        }
    }

    private void start(URI endpoint, String roomId, String userId, String userName, String token,
                       CreateRoomData createRequest) {
        if (disposed) {
            throw new IllegalStateException("Transport disposed");
        }
        this.endpoint = endpoint;
        this.roomId = roomId;
        this.userId = userId;
        this.userName = userName;
        this.token = token;
        this.createRequest = createRequest;
        this.manualDisconnect = false;
        this.attempts = 0;
        cancelReconnect();
        openChannel();
    }

    private void openChannel() {
        long gen = ++generation;
        closeChannel();
        authenticated = false;
        setStatus(ConnectionStatus.CONNECTING);
        LOG.debugf("Connecting to %s (attempt %d)", endpoint, attempts);
        connector.open(endpoint, new Listener(gen)).subscribe().with(
            opened -> onOpened(gen, opened),
            failure -> onChannelLost(gen, "connect failed: " + failure.getMessage()));
    }

    private void onOpened(long gen, DuplexChannel opened) {
        synchronized (lock) {
            if (gen != generation || manualDisconnect) {
                opened.close();
                return;
            }
            channel = opened;
            write(Envelope.of(MessageType.AUTH, roomId, userId, new AuthData(token, userId, userName, roomId))
                .withUserName(userName));
        }
    }

    private final class Listener implements ChannelListener {
        private final long gen;

        private Listener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onText(String frame) {
            receive(gen, frame);
        }

        @Override
        public void onClosed(int code, String reason) {
            if (code == POLICY_VIOLATION) {
                onRejected(gen, reason);
            } else {
                onChannelLost(gen, "closed (" + code + ")");
            }
        }

        @Override
        public void onError(Throwable failure) {
            LOG.warnf("Channel error: %s", failure.getMessage());
        }
    }

    void receive(long gen, String frame) {
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            Envelope msg;
            try {
                msg = MessageCodec.decode(frame);
            } catch (ProtocolException e) {
                LOG.warnf("Dropping undecodable frame: %s", e.getMessage());
                return;
            }
            try {
                dispatch(msg);
            } catch (CollaborationException e) {
                LOG.warnf("Failed to handle %s: %s", msg.type().wireName(), e.getMessage());
            }
        }
    }

    private void dispatch(Envelope msg) {
        switch (msg.type()) {
            case AUTH_SUCCESS -> onAuthenticated();
            case SYNC -> onSync(MessageCodec.payload(msg, SyncData.class));
            case OPERATION -> onRemoteOperation(MessageCodec.payload(msg, Operation.class));
            case ACK -> onAck(MessageCodec.payload(msg, Operation.class));
            case CURSOR, PRESENCE -> onPresence(msg);
            case USER_JOINED, USER_LEFT, INTRODUCE_PEERS, ROOM_CREATED, ROOM_JOINED, ERROR -> onMembership(msg);
            case OFFER, ANSWER, ICE -> signals.fire(msg);
            case HEARTBEAT_ACK -> onHeartbeatAck();
            case AUTH, CREATE_ROOM, JOIN_ROOM, LEAVE_ROOM, SYNC_REQUEST, HEARTBEAT ->
                LOG.debugf("Ignoring client-bound %s", msg.type().wireName());
        }
    }

    private void onAuthenticated() {
        authenticated = true;
        attempts = 0;
        setStatus(ConnectionStatus.SYNCING);
        if (createRequest != null) {
            write(Envelope.of(MessageType.CREATE_ROOM, roomId, userId, createRequest).withUserName(userName));
        } else {
            write(Envelope.of(MessageType.JOIN_ROOM, roomId, userId, new JoinRoomData(roomId, userName,
                null, null, null, null, authorityName())).withUserName(userName));
        }
        for (String frame : queue.drain()) {
            writeQueued(frame);
        }
        startHeartbeat();
        LOG.infof("Authenticated as %s", userId);
    }

    private void onSync(SyncData sync) {
        if (document.pending().isEmpty()) {
            document.reset(sync.content(), sync.version());
        } else {
            document.rebase(sync.content(), sync.version(),
                sync.applied() != null ? sync.applied() : List.of());
        }
        inFlight = null;
        setStatus(ConnectionStatus.CONNECTED);
        flushPending();
    }

    private void onRemoteOperation(Operation op) {
        if (status == ConnectionStatus.SYNCING) {
            return;
        }
        if (op.version() > document.sequence() + 1) {
            LOG.warnf("Missed operations before version %d (at %d), resynchronizing", op.version(), document.sequence());
            requestSync();
            return;
        }
        if (document.applyRemote(op)) {
            presence.transformCursors(op);
        }
    }

    private void onAck(Operation op) {
        if (status == ConnectionStatus.SYNCING) {
            return;
        }
        if (op.version() > document.sequence() + 1) {
            LOG.warnf("Acknowledgement skips to version %d (at %d), resynchronizing", op.version(), document.sequence());
            requestSync();
            return;
        }
        document.acknowledge(op);
        if (op.sameOrigin(inFlight)) {
            inFlight = null;
        }
        flushPending();
    }

    private void onPresence(Envelope msg) {
        if (!msg.hasData()) {
            return;
        }
        PresenceUpdate update = MessageCodec.payload(msg, PresenceUpdate.class).withIdentity(msg.userId(), msg.userName());
        if (!userId.equals(update.userId())) {
            presence.updatePresence(update);
        }
    }

    private void onMembership(Envelope msg) {
        switch (msg.type()) {
            case USER_JOINED -> {
                UserData user = MessageCodec.payload(msg, UserData.class);
                trackPeer(user.userId(), user.userName());
            }
            case USER_LEFT -> presence.removeUser(msg.userId());
            case INTRODUCE_PEERS -> {
                IntroducePeersData intro = MessageCodec.payload(msg, IntroducePeersData.class);
                trackPeer(intro.joinedUser().userId(), intro.joinedUser().userName());
                intro.otherPeers().forEach(peer -> trackPeer(peer.userId(), peer.userName()));
            }
            case ROOM_JOINED -> {
                RoomJoinedData joined = MessageCodec.payload(msg, RoomJoinedData.class);
                for (PeerData peer : joined.peers()) {
                    trackPeer(peer.userId(), peer.userName());
                }
            }
            case ERROR -> {
                JsonNode message = msg.hasData() ? msg.data().get("message") : null;
                LOG.warnf("Relay reported: %s", message != null ? message.asText() : "unknown error");
            }
            default -> {
            }
        }
        membership.fire(msg);
    }

    private void trackPeer(String peerId, String peerName) {
        if (peerId != null && !peerId.equals(userId)) {
            presence.updateUser(peerId, peerName);
        }
    }

    private void onDocumentOperation(Operation op) {
        synchronized (lock) {
            if (op.userId().equals(document.ownerId())) {
                flushPending();
            }
        }
    }

    /** Sends whichever pending local operations the ordering rules allow right now. */
    private void flushPending() {
        if (!canSend() || status != ConnectionStatus.CONNECTED) {
            return;
        }
        List<Operation> pending = document.pending();
        if (inFlight == null && !pending.isEmpty()) {
            inFlight = pending.get(0).withVersion(document.sequence() + 1);
            write(Envelope.of(MessageType.OPERATION, roomId, userId, inFlight));
        }
    }

    /**
     * Sends an operation. One that is pending in the bound document goes out under
     * the ordering rules; any other is sent as is, or queued while disconnected.
     */
    public void sendOperation(Operation op) {
        synchronized (lock) {
            boolean pendingLocally = document.pending().stream().anyMatch(op::sameOrigin);
            if (pendingLocally) {
                flushPending();
            } else {
                sendMessage(Envelope.of(MessageType.OPERATION, roomId, userId, op));
            }
        }
    }

    public void sendCursor(String fileUri, int line, int character) {
        sendMessage(Envelope.of(MessageType.CURSOR, roomId, userId,
            PresenceUpdate.cursor(userId, userName, fileUri, line, character)));
    }

    public void sendSelection(String fileUri, int cursorPosition, Integer selectionStart, Integer selectionEnd) {
        sendMessage(Envelope.of(MessageType.CURSOR, roomId, userId,
            PresenceUpdate.selection(userId, userName, fileUri, cursorPosition, selectionStart, selectionEnd)));
    }

    public void sendPresence(boolean active) {
        sendMessage(Envelope.of(MessageType.PRESENCE, roomId, userId,
            PresenceUpdate.activity(userId, userName, active)));
    }

    /** Point-to-point handshake frame for {@code to}; the relay fills in {@code from}. */
    public void sendSignal(MessageType type, String to, ObjectNode payload) {
        if (!type.isSignal()) {
            throw new IllegalArgumentException(type.wireName() + " is not a signal type");
        }
        ObjectNode data = payload != null ? payload.deepCopy() : MessageCodec.objectNode();
        data.put("to", to);
        sendMessage(Envelope.of(type, roomId, userId, data));
    }

    public void leaveRoom() {
        sendMessage(Envelope.of(MessageType.LEAVE_ROOM, roomId, userId, null));
    }

    public void requestSync() {
        synchronized (lock) {
            if (canSend()) {
                setStatus(ConnectionStatus.SYNCING);
                write(Envelope.of(MessageType.SYNC_REQUEST, roomId, userId, null));
            }
        }
    }

    /** Writes now when authenticated, otherwise queues. */
    public void sendMessage(Envelope message) {
        synchronized (lock) {
            if (canSend()) {
                write(message);
            } else {
                enqueue(message);
            }
        }
    }

    private void write(Envelope message) {
        DuplexChannel current = channel;
        if (current == null) {
            enqueue(message);
            return;
        }
        try {
            current.send(MessageCodec.encode(message));
        } catch (TransportDisconnectedException e) {
            enqueue(message);
            onChannelLost(generation, e.getMessage());
        }
    }

    private void writeQueued(String frame) {
        DuplexChannel current = channel;
        try {
            if (current == null) {
                throw new TransportDisconnectedException("No channel");
            }
            current.send(frame);
        } catch (TransportDisconnectedException e) {
            offer(frame);
            onChannelLost(generation, e.getMessage());
        }
    }

    private void enqueue(Envelope message) {
        switch (message.type()) {
            // operations stay pending in the document, auth is sent on every connect
            case OPERATION, AUTH -> LOG.debugf("Not queueing %s while disconnected", message.type().wireName());
            default -> offer(MessageCodec.encode(message));
        }
    }

    private void offer(String frame) {
        if (queue.offer(frame)) {
            errors.fire(new QueueOverflowException(queue.capacity()));
        }
    }

    private boolean canSend() {
        return channel != null && authenticated && !manualDisconnect;
    }

    private void startHeartbeat() {
        stopHeartbeat();
        long gen = generation;
        heartbeatTimer = scheduler.scheduleAtFixedRate(settings.heartbeatInterval(), () -> heartbeatTick(gen));
    }

    private void heartbeatTick(long gen) {
        synchronized (lock) {
            if (gen != generation || !canSend()) {
                return;
            }
            presence.sweepStale();
            write(Envelope.of(MessageType.HEARTBEAT, roomId, userId, new HeartbeatData(roomId)));
            if (heartbeatTimeout == null) {
                heartbeatTimeout = scheduler.schedule(settings.heartbeatTimeout(), () -> {
                    LOG.warnf("No heartbeat-ack within %s", settings.heartbeatTimeout());
                    onChannelLost(gen, "heartbeat timeout");
                });
            }
        }
    }

    private void onHeartbeatAck() {
        if (heartbeatTimeout != null) {
            heartbeatTimeout.cancel();
            heartbeatTimeout = null;
        }
    }

    private void stopHeartbeat() {
        if (heartbeatTimer != null) {
            heartbeatTimer.cancel();
            heartbeatTimer = null;
        }
        onHeartbeatAck();
    }

    private void onRejected(long gen, String reason) {
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            generation++;
            stopHeartbeat();
            closeChannel();
            LOG.errorf("Relay rejected the session: %s", reason);
            setStatus(ConnectionStatus.ERROR);
            errors.fire(new TransportDisconnectedException("Rejected by relay: " + reason));
        }
    }

    private void onChannelLost(long gen, String reason) {
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            generation++;
            stopHeartbeat();
            closeChannel();
            if (manualDisconnect || disposed) {
                return;
            }
            LOG.warnf("Connection lost: %s", reason);
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        if (!policy.canRetry(attempts)) {
            LOG.errorf("Giving up after %d reconnect attempts", attempts);
            setStatus(ConnectionStatus.ERROR);
            errors.fire(new ReconnectExhaustedException(attempts));
            return;
        }
        var delay = policy.delay(attempts);
        attempts++;
        setStatus(ConnectionStatus.DISCONNECTED);
        LOG.infof("Reconnecting in %d ms (attempt %d/%d)", delay.toMillis(), attempts, policy.maxAttempts());
        reconnectTimer = scheduler.schedule(delay, () -> {
            synchronized (lock) {
                reconnectTimer = null;
                if (!manualDisconnect && !disposed) {
                    openChannel();
                }
            }
        });
    }

    private void cancelReconnect() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
    }

    private void closeChannel() {
        DuplexChannel current = channel;
        channel = null;
        authenticated = false;
        inFlight = null;
        if (current != null) {
            current.close();
        }
    }

    private void setStatus(ConnectionStatus next) {
        if (status != next) {
            status = next;
            statusChanged.fire(next);
        }
    }

    private String authorityName() {
        return document.authority() == Authority.PEER ? "peer" : "server";
    }

    public void disconnect() {
        synchronized (lock) {
            manualDisconnect = true;
            generation++;
            cancelReconnect();
            stopHeartbeat();
            closeChannel();
            setStatus(ConnectionStatus.DISCONNECTED);
        }
    }

    public void dispose() {
        disconnect();
        synchronized (lock) {
            disposed = true;
            queue.clear();
            documentSubscriptions.forEach(Subscription::close);
            statusChanged.dispose();
            errors.dispose();
            membership.dispose();
            signals.dispose();
        }
    }

    public ConnectionStatus status() {
        synchronized (lock) {
            return status;
        }
    }

    public EventChannel<ConnectionStatus> statusChanged() {
        return statusChanged;
    }

    public Multi<ConnectionStatus> statusStream() {
        return statusChanged.toMulti();
    }

    public EventChannel<CollaborationException> errors() {
        return errors;
    }

    public EventChannel<Envelope> membership() {
        return membership;
    }

    public EventChannel<Envelope> signals() {
        return signals;
    }

    public DocumentState document() {
        return document;
    }

    public PresenceTracker presence() {
        return presence;
    }

    public int queuedMessages() {
        return queue.size();
    }

    public int reconnectAttempts() {
        synchronized (lock) {
            return attempts;
        }
    }
}
