/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.model;

/**
 * Deferred grant, sent by a peer leaving the critical section to every
 * requester it held back.
 *
 * @param releaserId       peer that released
 * @param requestTimestamp timestamp of the deferred request this notice answers
 * @param clock            releaser's Lamport clock when the notice was sent
 */
public record ReleaseNotice(
        int releaserId,
        long requestTimestamp,
        long clock
) {
}
