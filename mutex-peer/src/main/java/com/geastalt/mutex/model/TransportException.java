/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.model;

/**
 * A peer could not be reached or did not answer before the call deadline.
 */
public class TransportException extends MutexException {

    private final int peerId;

    public TransportException(int peerId, String message, Throwable cause) {
        super(message, cause);
        this.peerId = peerId;
    }

    public int getPeerId() {
        return peerId;
    }
}
