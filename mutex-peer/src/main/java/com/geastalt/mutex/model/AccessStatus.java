/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.model;

/**
 * Outcome of a mutual exclusion operation as seen by the local caller.
 */
public enum AccessStatus {
    /**
     * Operation completed successfully.
     */
    OK,

    /**
     * The protected resource reported a failure. The critical section was still released.
     */
    RESOURCE_FAILED,

    /**
     * Not every peer replied before the caller's deadline. The request was abandoned.
     */
    TIMEOUT,

    /**
     * The waiting thread was interrupted. The request was abandoned.
     */
    INTERRUPTED,

    /**
     * The operation does not apply to the current mutual exclusion state.
     */
    INVALID_STATE,

    /**
     * A peer or the resource could not be reached.
     */
    TRANSPORT_FAILED;

    /**
     * Checks if this status represents a successful operation.
     */
    public boolean isSuccess() {
        return this == OK;
    }

    /**
     * Checks if the caller may simply try again.
     */
    public boolean isRetryable() {
        return this == TIMEOUT || this == TRANSPORT_FAILED || this == RESOURCE_FAILED;
    }
}
