/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.model;

/**
 * Answer to one {@link AccessRequest}.
 *
 * @param granterId        peer that answered
 * @param granted          false when the answer was deferred until the granter releases
 * @param requestTimestamp timestamp of the request being answered
 * @param clock            granter's Lamport clock when the answer was sent
 */
public record AccessReply(
        int granterId,
        boolean granted,
        long requestTimestamp,
        long clock
) {

    public static AccessReply grant(int granterId, long requestTimestamp, long clock) {
        return new AccessReply(granterId, true, requestTimestamp, clock);
    }

    public static AccessReply deferred(int granterId, long requestTimestamp, long clock) {
        return new AccessReply(granterId, false, requestTimestamp, clock);
    }
}
