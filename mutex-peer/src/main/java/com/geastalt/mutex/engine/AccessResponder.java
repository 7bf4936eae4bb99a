/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.engine;

import com.geastalt.mutex.model.AccessReply;
import com.geastalt.mutex.model.AccessRequest;
import com.geastalt.mutex.model.ProtocolViolationException;
import com.geastalt.mutex.model.ReleaseNotice;

/**
 * Responder side of the protocol: handlers for messages arriving from other peers.
 * Handlers never wait on the local peer's own request.
 */
public interface AccessResponder {

    /**
     * Grants or defers an incoming request.
     *
     * @throws ProtocolViolationException if the requester is not a known peer
     */
    AccessReply handleAccessRequest(AccessRequest request);

    /**
     * Counts an immediate answer to the local request.
     *
     * @return false if the reply was ignored
     */
    boolean handleAccessReply(AccessReply reply);

    /**
     * Counts a deferred grant delivered after the sender released.
     *
     * @return false if the notice was ignored
     */
    boolean handleReleaseNotice(ReleaseNotice notice);

    long clockValue();
}
