package com.octate.collab.presence;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PresenceStatus {
    ONLINE,
    IDLE,
    OFFLINE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
