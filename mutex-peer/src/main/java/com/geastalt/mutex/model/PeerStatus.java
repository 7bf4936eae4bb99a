/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.model;

import java.util.List;

/**
 * Point-in-time view of a peer's mutual exclusion bookkeeping.
 */
public record PeerStatus(
        int peerId,
        MutexState state,
        long clock,
        long requestTimestamp,
        int pendingReplyCount,
        List<Integer> deferredPeerIds,
        long completedJobs
) {
    public PeerStatus {
        deferredPeerIds = List.copyOf(deferredPeerIds);
    }
}
