package com.octate.collab.document;

import com.octate.collab.event.EventChannel;
import com.octate.collab.ot.Operation;
import com.octate.collab.ot.OperationType;

import java.util.Collection;
import java.util.List;

/**
 * Mutable state of one shared document as seen by one participant.
 * Implementations differ in who orders operations: a server that assigns a
 * single increasing version, or each peer with its own clock.
 */
public interface DocumentState {

    enum Authority {
        SERVER,
        PEER
    }

    Authority authority();

    String ownerId();

    /**
     * Applies a local edit optimistically and records it as pending.
     * {@code content} is used by inserts, {@code length} by deletes.
     */
    Operation applyLocal(OperationType type, int position, String content, int length);

    default Operation insert(int position, String text) {
        return applyLocal(OperationType.INSERT, position, text, 0);
    }

    default Operation delete(int position, int length) {
        return applyLocal(OperationType.DELETE, position, null, length);
    }

    /** @return false when the operation was stale or already applied */
    boolean applyRemote(Operation op);

    /** Removes the pending entry with the same author and timestamp once the relay has ordered it. */
    boolean acknowledge(Operation op);

    /** Full resynchronization; pending and history are discarded. */
    void reset(String content, long version);

    /**
     * Resynchronizes to a server snapshot but keeps local pending edits,
     * replaying them on top of the snapshot so they can be sent again.
     * Pending edits whose origin key is in {@code alreadyApplied} are part of the
     * snapshot and are dropped instead.
     */
    void rebase(String content, long version, Collection<String> alreadyApplied);

    void requestSync();

    String content();

    long version();

    /**
     * Last relay-assigned version this replica has incorporated, through remote
     * operations, acknowledgements or a snapshot. Outgoing operations are based on
     * it. Equal to {@link #version()} for a server-authoritative replica.
     */
    long sequence();

    List<Operation> history();

    List<Operation> pending();

    DocumentStats stats();

    EventChannel<DocumentChange> documentChanged();

    EventChannel<Operation> operationApplied();

    EventChannel<Long> syncRequired();

    void dispose();
}
