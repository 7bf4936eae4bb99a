/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.model;

import java.util.Objects;

/**
 * Represents an error reported to the originator of a mutual exclusion operation.
 */
public record AccessError(
        AccessStatus status,
        String message
) {
    public AccessError {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static AccessError resourceFailed(String reason) {
        return new AccessError(AccessStatus.RESOURCE_FAILED, "Resource call failed: " + reason);
    }

    public static AccessError timeout(int pendingReplies, long waitedMs) {
        return new AccessError(
                AccessStatus.TIMEOUT,
                String.format("Gave up after %d ms with %d repl%s outstanding",
                        waitedMs, pendingReplies, pendingReplies == 1 ? "y" : "ies")
        );
    }

    public static AccessError interrupted() {
        return new AccessError(AccessStatus.INTERRUPTED, "Interrupted while waiting for replies");
    }

    public static AccessError invalidState(MutexState current, MutexState expected) {
        return new AccessError(
                AccessStatus.INVALID_STATE,
                "Expected state " + expected + " but was " + current
        );
    }

    public static AccessError transportFailed(String reason) {
        return new AccessError(AccessStatus.TRANSPORT_FAILED, reason);
    }
}
