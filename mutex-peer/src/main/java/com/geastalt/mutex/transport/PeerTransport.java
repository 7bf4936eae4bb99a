/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.transport;

import com.geastalt.mutex.model.AccessReply;
import com.geastalt.mutex.model.AccessRequest;
import com.geastalt.mutex.model.PeerRecord;
import com.geastalt.mutex.model.ReleaseNotice;
import com.geastalt.mutex.model.TransportException;

/**
 * Point-to-point delivery of protocol messages to other peers.
 * Each call targets exactly one peer and is independent of calls to other peers.
 */
public interface PeerTransport {

    /**
     * Delivers an access request and returns the peer's immediate answer,
     * which is either a grant or a deferral.
     *
     * @throws TransportException if the peer cannot be reached or does not answer in time
     */
    AccessReply requestAccess(PeerRecord peer, AccessRequest request);

    /**
     * Delivers a deferred grant.
     *
     * @return whether the peer accepted the notice
     * @throws TransportException if the peer cannot be reached or does not answer in time
     */
    boolean releaseAccess(PeerRecord peer, ReleaseNotice notice);
}
