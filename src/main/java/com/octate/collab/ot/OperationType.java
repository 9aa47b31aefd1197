package com.octate.collab.ot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OperationType {
    INSERT("insert"),
    DELETE("delete");

    private final String wireName;

    OperationType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static OperationType fromWire(String value) {
        for (OperationType type : values()) {
            if (type.wireName.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new InvalidOperationException("Unknown operation type: " + value);
    }
}
