/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.model;

/**
 * A peer message that the protocol does not allow in the current state,
 * such as a duplicate reply or a message from an unknown peer.
 */
public class ProtocolViolationException extends MutexException {

    private final int senderId;

    public ProtocolViolationException(int senderId, String message) {
        super(message);
        this.senderId = senderId;
    }

    public int getSenderId() {
        return senderId;
    }
}
