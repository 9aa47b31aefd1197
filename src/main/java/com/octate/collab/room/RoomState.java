package com.octate.collab.room;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RoomState {
    ACTIVE,
    IDLE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
