package com.octate.collab.presence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cursor, selection and activity of one user, as sent in {@code cursor} and
 * {@code presence} messages. Absent fields leave the tracked value unchanged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PresenceUpdate(
    String userId,
    String userName,
    String fileUri,
    Integer line,
    Integer character,
    Integer cursorPosition,
    Integer selectionStart,
    Integer selectionEnd,
    @JsonProperty("isActive") Boolean isActive,
    Long timestamp
) {

    public static PresenceUpdate cursor(String userId, String userName, String fileUri, int line, int character) {
        return new PresenceUpdate(userId, userName, fileUri, line, character, null, null, null, true, null);
    }

    public static PresenceUpdate selection(String userId, String userName, String fileUri,
                                           int cursorPosition, Integer selectionStart, Integer selectionEnd) {
        return new PresenceUpdate(userId, userName, fileUri, null, null, cursorPosition, selectionStart, selectionEnd,
            true, null);
    }

    public static PresenceUpdate activity(String userId, String userName, boolean active) {
        return new PresenceUpdate(userId, userName, null, null, null, null, null, null, active, null);
    }

    /** Identity as established by the relay wins over what the payload claims. */
    public PresenceUpdate withIdentity(String newUserId, String newUserName) {
        return new PresenceUpdate(newUserId != null ? newUserId : userId,
            newUserName != null ? newUserName : userName,
            fileUri, line, character, cursorPosition, selectionStart, selectionEnd, isActive, timestamp);
    }
}
