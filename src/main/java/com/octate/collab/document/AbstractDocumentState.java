package com.octate.collab.document;

import com.octate.collab.event.EventChannel;
import com.octate.collab.ot.InvalidOperationException;
import com.octate.collab.ot.Operation;
import com.octate.collab.ot.OperationType;
import com.octate.collab.ot.OperationalTransform;
import com.octate.collab.ot.OperationalTransform.TransformedPair;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.ListIterator;
import java.util.function.LongSupplier;

/**
 * Shared apply/transform machinery. Subclasses decide how versions are assigned
 * and which remote operations are admitted.
 * <p>
 * Remote operations are rebased over every pending local operation, and each
 * pending operation is rebased over the remote one in turn, so later remote
 * operations still transform against the right context.
 */
public abstract class AbstractDocumentState implements DocumentState {

    protected final String ownerId;
    private final LongSupplier clock;

    protected String content;
    protected long version;
    protected long sequence;
    protected final List<Operation> history = new ArrayList<>();
    protected final List<Operation> pending = new ArrayList<>();

    private long lastTimestamp;

    private final EventChannel<DocumentChange> documentChanged = new EventChannel<>("documentChanged");
    private final EventChannel<Operation> operationApplied = new EventChannel<>("operationApplied");
    private final EventChannel<Long> syncRequired = new EventChannel<>("syncRequired");

    protected AbstractDocumentState(String ownerId, String content, long version, LongSupplier clock) {
        this.ownerId = ownerId;
        this.content = content == null ? "" : content;
        this.version = version;
        this.sequence = version;
        this.clock = clock;
    }

    /** Version stamped on the next local operation; may advance the local clock. */
    protected abstract long nextLocalVersion();

    /** Whether a remote operation should be applied at all. */
    protected abstract boolean admitRemote(Operation op);

    protected abstract void afterRemoteApplied(Operation received);

    protected void afterLocalApplied(Operation op) {
    }

    protected void afterAcknowledged(Operation ack) {
    }

    @Override
    public String ownerId() {
        return ownerId;
    }

    @Override
    public synchronized Operation applyLocal(OperationType type, int position, String text, int length) {
        if (position < 0 || length < 0) {
            throw new InvalidOperationException("Negative position or length: " + position + ", " + length);
        }
        int at = Math.min(position, content.length());
        long timestamp = nextTimestamp();
        long stamp = nextLocalVersion();
        Operation op = switch (type) {
            case INSERT -> Operation.insert(ownerId, at, text, timestamp, stamp);
            case DELETE -> Operation.delete(ownerId, at, Math.min(length, content.length() - at), timestamp, stamp);
        };

        content = OperationalTransform.apply(content, op);
        history.add(op);
        pending.add(op);
        afterLocalApplied(op);

        publish(op);
        return op;
    }

    @Override
    public synchronized boolean applyRemote(Operation op) {
        if (!admitRemote(op)) {
            return false;
        }
        Operation incoming = op;
        for (ListIterator<Operation> it = pending.listIterator(); it.hasNext(); ) {
            TransformedPair pair = OperationalTransform.transformPair(incoming, it.next());
            incoming = pair.first();
            it.set(pair.second());
        }

        content = OperationalTransform.apply(content, incoming);
        history.add(incoming);
        sequence = Math.max(sequence, op.version());
        afterRemoteApplied(op);

        publish(incoming);
        return true;
    }

    @Override
    public synchronized boolean acknowledge(Operation ack) {
        boolean removed = false;
        for (ListIterator<Operation> it = pending.listIterator(); it.hasNext(); ) {
            if (it.next().sameOrigin(ack)) {
                it.remove();
                removed = true;
                break;
            }
        }
        sequence = Math.max(sequence, ack.version());
        afterAcknowledged(ack);
        return removed;
    }

    @Override
    public synchronized void reset(String newContent, long newVersion) {
        content = newContent == null ? "" : newContent;
        version = newVersion;
        sequence = newVersion;
        history.clear();
        pending.clear();
        documentChanged.fire(new DocumentChange(content, version));
    }

    @Override
    public synchronized void rebase(String snapshot, long snapshotVersion, Collection<String> alreadyApplied) {
        List<Operation> replay = new ArrayList<>(pending);
        replay.removeIf(op -> alreadyApplied.contains(op.originKey()));
        content = snapshot == null ? "" : snapshot;
        version = snapshotVersion;
        sequence = snapshotVersion;
        history.clear();
        pending.clear();
        for (Operation op : replay) {
            Operation clamped = clampToContent(op);
            content = OperationalTransform.apply(content, clamped);
            history.add(clamped);
            pending.add(clamped);
        }
        documentChanged.fire(new DocumentChange(content, version));
    }

    private Operation clampToContent(Operation op) {
        int at = Math.min(op.position(), content.length());
        Operation moved = at == op.position() ? op : op.withPosition(at);
        if (!moved.isInsert() && moved.end() > content.length()) {
            return moved.withLength(content.length() - at);
        }
        return moved;
    }

    @Override
    public void requestSync() {
        syncRequired.fire(version());
    }

    private void publish(Operation applied) {
        operationApplied.fire(applied);
        documentChanged.fire(new DocumentChange(content, version));
    }

    private long nextTimestamp() {
        // strictly increasing so (userId, timestamp) stays unique per author
        lastTimestamp = Math.max(clock.getAsLong(), lastTimestamp + 1);
        return lastTimestamp;
    }

    @Override
    public synchronized String content() {
        return content;
    }

    @Override
    public synchronized long version() {
        return version;
    }

    @Override
    public synchronized long sequence() {
        return sequence;
    }

    @Override
    public synchronized List<Operation> history() {
        return List.copyOf(history);
    }

    @Override
    public synchronized List<Operation> pending() {
        return List.copyOf(pending);
    }

    @Override
    public synchronized DocumentStats stats() {
        return new DocumentStats(content.length(), history.size(), pending.size(), version);
    }

    @Override
    public EventChannel<DocumentChange> documentChanged() {
        return documentChanged;
    }

    @Override
    public EventChannel<Operation> operationApplied() {
        return operationApplied;
    }

    @Override
    public EventChannel<Long> syncRequired() {
        return syncRequired;
    }

    @Override
    public void dispose() {
        documentChanged.dispose();
        operationApplied.dispose();
        syncRequired.dispose();
    }
}
