package com.octate.collab.client;

import com.octate.collab.CollaborationException;

/** Terminal: no further automatic reconnect happens after this is published. */
public class ReconnectExhaustedException extends CollaborationException {

    private final int attempts;

    public ReconnectExhaustedException(int attempts) {
        super("Gave up reconnecting after " + attempts + " attempts");
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
