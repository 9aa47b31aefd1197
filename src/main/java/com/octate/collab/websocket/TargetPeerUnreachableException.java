package com.octate.collab.websocket;

import com.octate.collab.CollaborationException;

public class TargetPeerUnreachableException extends CollaborationException {

    public TargetPeerUnreachableException(String targetUserId) {
        super("Target peer unreachable: " + targetUserId);
    }
}
