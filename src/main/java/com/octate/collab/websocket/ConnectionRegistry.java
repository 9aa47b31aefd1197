package com.octate.collab.websocket;

import com.octate.collab.room.RoomMessenger;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open sockets and what each one is bound to. A user that reconnects replaces
 * its old socket as the delivery target for the room.
 */
@ApplicationScoped
public class ConnectionRegistry implements RoomMessenger {

    private static final Logger LOG = Logger.getLogger(ConnectionRegistry.class);

    /** Identity and room membership of one socket, filled in by auth and join. */
    public static final class Binding {
        private final PeerConnection connection;
        private volatile String userId;
        private volatile String userName;
        private volatile String roomId;

        Binding(PeerConnection connection) {
            this.connection = connection;
        }

        public PeerConnection connection() {
            return connection;
        }

        public String userId() {
            return userId;
        }

        public String userName() {
            return userName;
        }

        public String roomId() {
            return roomId;
        }

        public boolean isAuthenticated() {
            return userId != null;
        }
    }

    private record MemberKey(String roomId, String userId) {}

    private final Map<String, Binding> bindings = new ConcurrentHashMap<>();
    private final Map<MemberKey, PeerConnection> members = new ConcurrentHashMap<>();

    public void register(PeerConnection connection) {
        bindings.put(connection.id(), new Binding(connection));
    }

    public Binding binding(String connectionId) {
        return bindings.get(connectionId);
    }

    public void authenticate(String connectionId, String userId, String userName) {
        Binding binding = bindings.get(connectionId);
        if (binding != null) {
            binding.userId = userId;
            binding.userName = userName;
        }
    }

    public void bind(String connectionId, String roomId) {
        Binding binding = bindings.get(connectionId);
        if (binding == null || binding.userId == null) {
            return;
        }
        if (binding.roomId != null && !binding.roomId.equals(roomId)) {
            members.remove(new MemberKey(binding.roomId, binding.userId), binding.connection);
        }
        binding.roomId = roomId;
        members.put(new MemberKey(roomId, binding.userId), binding.connection);
    }

    public void unbind(String connectionId) {
        Binding binding = bindings.get(connectionId);
        if (binding != null && binding.roomId != null) {
            members.remove(new MemberKey(binding.roomId, binding.userId), binding.connection);
            binding.roomId = null;
        }
    }

    /** Detaches whichever socket of {@code userId} is bound to {@code roomId}. */
    public void unbindMember(String roomId, String userId) {
        members.remove(new MemberKey(roomId, userId));
        for (Binding binding : bindings.values()) {
            if (roomId.equals(binding.roomId) && userId.equals(binding.userId)) {
                binding.roomId = null;
            }
        }
    }

    /** Drops every binding to a room that no longer exists. */
    public void unbindRoom(String roomId) {
        members.keySet().removeIf(key -> key.roomId().equals(roomId));
        for (Binding binding : bindings.values()) {
            if (roomId.equals(binding.roomId)) {
                binding.roomId = null;
            }
        }
    }

    public Binding remove(String connectionId) {
        Binding binding = bindings.remove(connectionId);
        if (binding != null && binding.roomId != null) {
            // only if a newer socket has not taken over
            members.remove(new MemberKey(binding.roomId, binding.userId), binding.connection);
        }
        return binding;
    }

    @Override
    public boolean deliver(String roomId, String userId, String frame) {
        PeerConnection connection = members.get(new MemberKey(roomId, userId));
        if (connection == null || !connection.isOpen()) {
            return false;
        }
        connection.send(frame);
        return true;
    }

    public int openCount() {
        return bindings.size();
    }

    public void closeAll(int code, String reason) {
        List<Binding> open = List.copyOf(bindings.values());
        for (Binding binding : open) {
            try {
                binding.connection.close(code, reason);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Closing %s failed", binding.connection.id());
            }
        }
        bindings.clear();
        members.clear();
        LOG.infof("Closed %d connections", open.size());
    }
}
