package com.octate.collab.presence;

import com.octate.collab.event.EventChannel;
import com.octate.collab.ot.Operation;
import com.octate.collab.ot.OperationalTransform;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Ephemeral cursor/selection/activity state of the other participants.
 * A user that has not been heard from within the staleness timeout is shown as
 * offline, even before the room evicts it.
 */
public class PresenceTracker {

    private static final Logger LOG = Logger.getLogger(PresenceTracker.class);

    public record StatusCounts(int online, int idle, int offline) {}

    private final ConcurrentHashMap<String, UserPresence> users = new ConcurrentHashMap<>();
    private final Duration staleAfter;
    private final LongSupplier clock;

    private final EventChannel<UserPresence> userAdded = new EventChannel<>("userAdded");
    private final EventChannel<UserPresence> presenceUpdated = new EventChannel<>("presenceUpdated");
    private final EventChannel<UserPresence> statusChanged = new EventChannel<>("statusChanged");
    private final EventChannel<String> userRemoved = new EventChannel<>("userRemoved");

    public PresenceTracker(Duration staleAfter, LongSupplier clock) {
        this.staleAfter = staleAfter;
        this.clock = clock;
    }

    public UserPresence updateUser(String userId, String userName) {
        long now = clock.getAsLong();
        UserPresence existing = users.get(userId);
        if (existing == null) {
            UserPresence added = UserPresence.joined(userId, userName != null ? userName : userId, now);
            users.put(userId, added);
            userAdded.fire(added);
            return added;
        }
        UserPresence refreshed = existing.seen(now);
        users.put(userId, refreshed);
        if (existing.status() != refreshed.status()) {
            statusChanged.fire(refreshed);
        }
        return refreshed;
    }

    public UserPresence updatePresence(PresenceUpdate update) {
        if (update.userId() == null) {
            LOG.debug("Ignoring presence update without userId");
            return null;
        }
        UserPresence previous = users.containsKey(update.userId())
            ? users.get(update.userId())
            : updateUser(update.userId(), update.userName());
        UserPresence merged = previous.merge(update, clock.getAsLong());
        users.put(update.userId(), merged);
        if (previous.status() != merged.status()) {
            statusChanged.fire(merged);
        }
        presenceUpdated.fire(merged);
        return merged;
    }

    public void markEditing(String userId, String fileUri) {
        users.computeIfPresent(userId, (id, user) -> user.withEditing(true, fileUri, clock.getAsLong()));
    }

    public void markIdle(String userId) {
        UserPresence user = users.computeIfPresent(userId, (id, u) -> u.withEditing(false, null, clock.getAsLong()));
        if (user != null && user.status() == PresenceStatus.ONLINE) {
            UserPresence idle = user.withStatus(PresenceStatus.IDLE);
            users.put(userId, idle);
            statusChanged.fire(idle);
        }
    }

    public void removeUser(String userId) {
        if (users.remove(userId) != null) {
            userRemoved.fire(userId);
        }
    }

    /** Marks everyone not heard from within the timeout as offline; returns who changed. */
    public List<String> sweepStale() {
        long now = clock.getAsLong();
        List<String> wentOffline = new ArrayList<>();
        for (Map.Entry<String, UserPresence> entry : users.entrySet()) {
            UserPresence user = entry.getValue();
            if (user.status() != PresenceStatus.OFFLINE && now - user.lastSeen() > staleAfter.toMillis()) {
                UserPresence offline = user.withStatus(PresenceStatus.OFFLINE);
                users.put(entry.getKey(), offline);
                wentOffline.add(entry.getKey());
                statusChanged.fire(offline);
            }
        }
        if (!wentOffline.isEmpty()) {
            LOG.debugf("Presence timed out for %s", wentOffline);
        }
        return wentOffline;
    }

    /** Keeps remote cursors anchored to the same text after an edit is applied. */
    public void transformCursors(Operation op) {
        users.replaceAll((id, user) -> {
            if (id.equals(op.userId())) {
                return user;
            }
            int cursor = OperationalTransform.transformCursor(user.cursorPosition(), op);
            Integer start = user.selectionStart() == null ? null
                : OperationalTransform.transformCursor(user.selectionStart(), op);
            Integer end = user.selectionEnd() == null ? null
                : OperationalTransform.transformCursor(user.selectionEnd(), op);
            return user.withCursor(cursor, start, end);
        });
    }

    public UserPresence getUser(String userId) {
        return users.get(userId);
    }

    public Collection<UserPresence> getAllUsers() {
        return List.copyOf(users.values());
    }

    public List<UserPresence> getOnlineUsers() {
        return users.values().stream()
            .filter(u -> u.status() == PresenceStatus.ONLINE)
            .toList();
    }

    public List<UserPresence> getActiveUsers() {
        return users.values().stream()
            .filter(u -> u.status() != PresenceStatus.OFFLINE)
            .toList();
    }

    public String colorFor(String userId) {
        UserPresence user = users.get(userId);
        return user != null ? user.color() : ColorPalette.colorFor(userId);
    }

    public StatusCounts counts() {
        int online = 0, idle = 0, offline = 0;
        for (UserPresence user : users.values()) {
            switch (user.status()) {
                case ONLINE -> online++;
                case IDLE -> idle++;
                case OFFLINE -> offline++;
            }
        }
        return new StatusCounts(online, idle, offline);
    }

    public void clear() {
        for (String userId : List.copyOf(users.keySet())) {
            removeUser(userId);
        }
    }

    public EventChannel<UserPresence> userAdded() {
        return userAdded;
    }

    public EventChannel<UserPresence> presenceUpdated() {
        return presenceUpdated;
    }

    public EventChannel<UserPresence> statusChanged() {
        return statusChanged;
    }

    public EventChannel<String> userRemoved() {
        return userRemoved;
    }

    public void dispose() {
        users.clear();
        userAdded.dispose();
        presenceUpdated.dispose();
        statusChanged.dispose();
        userRemoved.dispose();
    }
}
