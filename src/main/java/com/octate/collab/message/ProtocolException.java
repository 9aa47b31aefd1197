package com.octate.collab.message;

import com.octate.collab.CollaborationException;

public class ProtocolException extends CollaborationException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
