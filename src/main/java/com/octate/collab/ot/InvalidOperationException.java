package com.octate.collab.ot;

import com.octate.collab.CollaborationException;

public class InvalidOperationException extends CollaborationException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
