package com.octate.collab.ot;

import org.jboss.logging.Logger;

import java.util.List;

/**
 * Stateless transform functions for insert/delete operations on plain text.
 * <p>
 * {@code transform(a, b)} rebases {@code a} onto a document that already has
 * {@code b} applied. For any two concurrent operations from different users,
 * {@code apply(apply(s, a), transform(b, a))} equals
 * {@code apply(apply(s, b), transform(a, b))}.
 * <p>
 * Same-position inserts are ordered by user id; the lexicographically smaller id
 * keeps the position. An insert that lands strictly inside a concurrently deleted
 * range is absorbed by that delete: it collapses to the delete's start with empty
 * content, and the delete on the other side grows to cover the inserted text.
 */
public final class OperationalTransform {

    private static final Logger LOG = Logger.getLogger(OperationalTransform.class);

    public record TransformedPair(Operation first, Operation second) {}

    public record Selection(int start, int end) {}

    private OperationalTransform() {
    }

    public static Operation transform(Operation op, Operation against) {
        if (op.id().equals(against.id())) {
            return op;
        }
        return switch (op.type()) {
            case INSERT -> against.isInsert() ? insertInsert(op, against) : insertDelete(op, against);
            case DELETE -> against.isInsert() ? deleteInsert(op, against) : deleteDelete(op, against);
        };
    }

    /** Rebases both operations over each other in one call. */
    public static TransformedPair transformPair(Operation a, Operation b) {
        return new TransformedPair(transform(a, b), transform(b, a));
    }

    /** Rebases {@code op} over every entry of {@code history} in order, skipping itself. */
    public static Operation transformAgainst(Operation op, Iterable<Operation> history) {
        Operation result = op;
        for (Operation prior : history) {
            if (prior.id().equals(op.id())) continue;
            result = transform(result, prior);
        }
        return result;
    }

    private static Operation insertInsert(Operation op, Operation against) {
        if (op.position() < against.position()) {
            return op;
        }
        if (op.position() > against.position() || !precedes(op, against)) {
            return op.withPosition(op.position() + against.span());
        }
        return op;
    }

    private static Operation insertDelete(Operation op, Operation against) {
        if (op.position() <= against.position()) {
            return op;
        }
        if (op.position() >= against.end()) {
            return op.withPosition(op.position() - against.span());
        }
        // inside the deleted range: the text it targeted is gone
        return op.withPosition(against.position()).withContent("");
    }

    private static Operation deleteInsert(Operation op, Operation against) {
        if (against.position() <= op.position()) {
            return op.withPosition(op.position() + against.span());
        }
        if (against.position() >= op.end()) {
            return op;
        }
        return op.withLength(op.span() + against.span());
    }

    private static Operation deleteDelete(Operation op, Operation against) {
        if (op.end() <= against.position()) {
            return op;
        }
        if (op.position() >= against.end()) {
            return op.withPosition(op.position() - against.span());
        }
        int overlap = Math.min(op.end(), against.end()) - Math.max(op.position(), against.position());
        return op.withPosition(Math.min(op.position(), against.position()))
            .withLength(op.span() - overlap);
    }

    private static boolean precedes(Operation a, Operation b) {
        int byUser = a.userId().compareTo(b.userId());
        return byUser != 0 ? byUser < 0 : a.id().compareTo(b.id()) < 0;
    }

    public static String apply(String content, Operation op) {
        int position = Math.min(op.position(), content.length());
        return switch (op.type()) {
            case INSERT -> content.substring(0, position) + op.content() + content.substring(position);
            case DELETE -> {
                int end = position + Math.min(op.span(), content.length() - position);
                yield content.substring(0, position) + content.substring(end);
            }
        };
    }

    public static int transformCursor(int cursor, Operation op) {
        if (op.isInsert()) {
            return cursor >= op.position() ? cursor + op.span() : cursor;
        }
        if (cursor >= op.end()) {
            return cursor - op.span();
        }
        return cursor >= op.position() ? op.position() : cursor;
    }

    public static Selection transformSelection(int start, int end, Operation op) {
        return new Selection(transformCursor(start, op), transformCursor(end, op));
    }

    /**
     * Checks that versions never go backwards and that every entry is a real edit
     * (non-empty insert, positive delete).
     */
    public static boolean validateSequence(List<Operation> history) {
        for (int i = 0; i < history.size(); i++) {
            Operation current = history.get(i);
            if (i > 0 && current.version() < history.get(i - 1).version()) {
                LOG.warnf("Version went backwards: %d after %d", current.version(), history.get(i - 1).version());
                return false;
            }
            if (current.isInsert() && current.content().isEmpty()) {
                LOG.warnf("Empty insert in history: %s", current.id());
                return false;
            }
            if (!current.isInsert() && current.length() == 0) {
                LOG.warnf("Zero-length delete in history: %s", current.id());
                return false;
            }
        }
        return true;
    }
}
