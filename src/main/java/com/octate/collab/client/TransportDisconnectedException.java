package com.octate.collab.client;

import com.octate.collab.CollaborationException;

public class TransportDisconnectedException extends CollaborationException {

    public TransportDisconnectedException(String message) {
        super(message);
    }

    public TransportDisconnectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
