package com.octate.collab.ot;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

/**
 * A single text edit. Inserts carry {@code content}, deletes carry {@code length};
 * the other field is ignored for the given type.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Operation(
    String id,
    String userId,
    OperationType type,
    int position,
    String content,     // insert only
    Integer length,     // delete only
    long timestamp,
    long version
) {

    public Operation {
        if (type == null) {
            throw new InvalidOperationException("Operation type required");
        }
        if (userId == null || userId.isBlank()) {
            throw new InvalidOperationException("Operation userId required");
        }
        if (position < 0) {
            throw new InvalidOperationException("Negative position: " + position);
        }
        if (type == OperationType.INSERT && content == null) {
            throw new InvalidOperationException("Insert requires content");
        }
        if (type == OperationType.DELETE && (length == null || length < 0)) {
            throw new InvalidOperationException("Delete requires a non-negative length");
        }
        if (id == null || id.isBlank()) {
            id = UUID.randomUUID().toString();
        }
    }

    public static Operation insert(String userId, int position, String content, long timestamp, long version) {
        return new Operation(null, userId, OperationType.INSERT, position, content, null, timestamp, version);
    }

    public static Operation delete(String userId, int position, int length, long timestamp, long version) {
        return new Operation(null, userId, OperationType.DELETE, position, null, length, timestamp, version);
    }

    @JsonIgnore
    public boolean isInsert() {
        return type == OperationType.INSERT;
    }

    /** Characters added by an insert or removed by a delete. */
    @JsonIgnore
    public int span() {
        return isInsert() ? content.length() : length;
    }

    @JsonIgnore
    public int end() {
        return position + span();
    }

    /** Identity that survives transformation: transformed copies keep author and timestamp. */
    @JsonIgnore
    public String originKey() {
        return userId + "-" + timestamp;
    }

    public boolean sameOrigin(Operation other) {
        return other != null && userId.equals(other.userId) && timestamp == other.timestamp;
    }

    public Operation withPosition(int newPosition) {
        return new Operation(id, userId, type, newPosition, content, length, timestamp, version);
    }

    public Operation withLength(int newLength) {
        return new Operation(id, userId, type, position, content, newLength, timestamp, version);
    }

    public Operation withContent(String newContent) {
        return new Operation(id, userId, type, position, newContent, length, timestamp, version);
    }

    public Operation withVersion(long newVersion) {
        return new Operation(id, userId, type, position, content, length, timestamp, newVersion);
    }
}
