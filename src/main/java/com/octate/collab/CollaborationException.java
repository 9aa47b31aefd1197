package com.octate.collab;

/**
 * Base of the relay's failure taxonomy. Instances reach clients as {@code error}
 * messages or HTTP error bodies; none of them is allowed to stop the relay.
 */
public abstract class CollaborationException extends RuntimeException {

    protected CollaborationException(String message) {
        super(message);
    }

    protected CollaborationException(String message, Throwable cause) {
        super(message, cause);
    }
}
