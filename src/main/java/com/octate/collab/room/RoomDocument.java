package com.octate.collab.room;

import com.octate.collab.document.StaleOperationException;
import com.octate.collab.ot.Operation;
import com.octate.collab.ot.OperationalTransform;
import org.jboss.logging.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The relay's copy of a room's text. Assigns the single increasing version every
 * client orders by, whichever kind of replica it keeps.
 * <p>
 * A submitted operation was generated against version {@code op.version - 1}.
 * It is rebased over every retained operation from another user that is newer
 * than that base, stamped with the next version and applied. Retained history is
 * bounded; a base older than the oldest retained operation cannot be rebased.
 */
public class RoomDocument {

    private static final Logger LOG = Logger.getLogger(RoomDocument.class);

    /** Outcome of a submission; a duplicate carries the operation stored the first time. */
    public record Applied(Operation op, boolean duplicate) {}

    private final int historyLimit;
    private final Deque<Operation> history = new ArrayDeque<>();
    private final Map<String, Operation> byOrigin = new HashMap<>();

    private String content;
    private long version;

    public RoomDocument(String content, long version, int historyLimit) {
        this.content = content == null ? "" : content;
        this.version = version;
        this.historyLimit = Math.max(1, historyLimit);
    }

    public synchronized Applied submit(Operation op) {
        Operation existing = byOrigin.get(op.originKey());
        if (existing != null) {
            LOG.debugf("Duplicate submission %s, re-acknowledging version %d", op.originKey(), existing.version());
            return new Applied(existing, true);
        }

        long base = op.version() - 1;
        if (base > version) {
            LOG.warnf("Operation %s claims base %d ahead of %d", op.originKey(), base, version);
            base = version;
        }
        if (base < version - history.size()) {
            throw new StaleOperationException(base, version);
        }

        Operation rebased = op;
        for (Operation prior : history) {
            if (prior.version() > base && !prior.userId().equals(op.userId())) {
                rebased = OperationalTransform.transform(rebased, prior);
            }
        }
        return new Applied(store(rebased), false);
    }

    private Operation store(Operation op) {
        Operation stored = op.withVersion(++version);
        content = OperationalTransform.apply(content, stored);
        history.addLast(stored);
        byOrigin.put(stored.originKey(), stored);
        while (history.size() > historyLimit) {
            byOrigin.remove(history.removeFirst().originKey());
        }
        return stored;
    }

    /** Origin keys of a user's operations that are part of the current content. */
    public synchronized List<String> appliedOrigins(String userId) {
        return history.stream()
            .filter(op -> op.userId().equals(userId))
            .map(Operation::originKey)
            .toList();
    }

    public synchronized String content() {
        return content;
    }

    public synchronized long version() {
        return version;
    }

    public synchronized int retained() {
        return history.size();
    }
}
