/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.model;

/**
 * A peer's request to enter the critical section.
 *
 * <p>Requests are totally ordered: the lower timestamp wins, and on equal
 * timestamps the lower requester id wins.
 */
public record AccessRequest(
        int requesterId,
        long timestamp
) implements Comparable<AccessRequest> {

    public AccessRequest {
        if (requesterId <= 0) {
            throw new IllegalArgumentException("requesterId must be positive");
        }
        if (timestamp < 0) {
            throw new IllegalArgumentException("timestamp must be non-negative");
        }
    }

    /**
     * Checks if this request must be served before the other one.
     */
    public boolean hasPriorityOver(AccessRequest other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(AccessRequest other) {
        int byTimestamp = Long.compare(this.timestamp, other.timestamp);
        if (byTimestamp != 0) {
            return byTimestamp;
        }
        return Integer.compare(this.requesterId, other.requesterId);
    }
}
