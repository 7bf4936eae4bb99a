/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.engine;

import com.geastalt.mutex.model.AccessResult;
import com.geastalt.mutex.model.PeerStatus;
import com.geastalt.mutex.model.WorkReceipt;

import java.time.Duration;

/**
 * Initiator side of the protocol: what the local process uses to enter and
 * leave the critical section.
 */
public interface MutualExclusion {

    /**
     * Broadcasts a request and blocks until every other peer has granted it.
     *
     * @param timeout how long to wait for replies; null, zero or negative waits forever
     * @return the request timestamp on success
     */
    AccessResult<Long> acquire(Duration timeout);

    /**
     * Leaves the critical section and answers every deferred requester.
     */
    AccessResult<Void> release();

    /**
     * Runs one protected job: acquire, submit to the resource, release.
     * The critical section is released even when the resource fails.
     */
    AccessResult<WorkReceipt> execute(String payload);

    PeerStatus status();
}
