package com.octate.collab.document;

import com.octate.collab.CollaborationException;

/**
 * An operation whose base version is older than the history still retained,
 * so it can no longer be rebased. The sender has to resynchronize.
 */
public class StaleOperationException extends CollaborationException {

    private final long baseVersion;
    private final long currentVersion;

    public StaleOperationException(long baseVersion, long currentVersion) {
        super("Operation based on version " + baseVersion + " is too old; current version is " + currentVersion);
        this.baseVersion = baseVersion;
        this.currentVersion = currentVersion;
    }

    public long baseVersion() {
        return baseVersion;
    }

    public long currentVersion() {
        return currentVersion;
    }
}
