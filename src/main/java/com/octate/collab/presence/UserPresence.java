package com.octate.collab.presence;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UserPresence(
    String userId,
    String userName,
    String color,
    String fileUri,
    int line,
    int character,
    int cursorPosition,
    Integer selectionStart,
    Integer selectionEnd,
    @JsonProperty("isActive") boolean isActive,
    boolean editing,
    PresenceStatus status,
    long lastSeen
) {

    static UserPresence joined(String userId, String userName, long now) {
        return new UserPresence(userId, userName, ColorPalette.colorFor(userId), null, 0, 0, 0,
            null, null, true, false, PresenceStatus.ONLINE, now);
    }

    UserPresence merge(PresenceUpdate update, long now) {
        boolean active = update.isActive() == null || update.isActive();
        return new UserPresence(
            userId,
            update.userName() != null ? update.userName() : userName,
            color,
            update.fileUri() != null ? update.fileUri() : fileUri,
            update.line() != null ? update.line() : line,
            update.character() != null ? update.character() : character,
            update.cursorPosition() != null ? update.cursorPosition() : cursorPosition,
            update.selectionStart(),
            update.selectionEnd(),
            active,
            editing,
            active ? PresenceStatus.ONLINE : PresenceStatus.IDLE,
            now
        );
    }

    UserPresence withCursor(int position, Integer start, Integer end) {
        return new UserPresence(userId, userName, color, fileUri, line, character, position,
            start, end, isActive, editing, status, lastSeen);
    }

    UserPresence withEditing(boolean nowEditing, String file, long now) {
        return new UserPresence(userId, userName, color, file != null ? file : fileUri, line, character,
            cursorPosition, selectionStart, selectionEnd, isActive, nowEditing, status, now);
    }

    UserPresence withStatus(PresenceStatus newStatus) {
        return new UserPresence(userId, userName, color, fileUri, line, character, cursorPosition,
            selectionStart, selectionEnd, newStatus != PresenceStatus.OFFLINE && isActive, editing, newStatus, lastSeen);
    }

    UserPresence seen(long now) {
        return new UserPresence(userId, userName, color, fileUri, line, character, cursorPosition,
            selectionStart, selectionEnd, true, editing, PresenceStatus.ONLINE, now);
    }
}
