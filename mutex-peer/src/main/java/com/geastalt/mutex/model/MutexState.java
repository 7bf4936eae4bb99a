/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.model;

/**
 * Mutual exclusion state of a single peer.
 */
public enum MutexState {
    /**
     * Not interested in the critical section. Initial state.
     */
    RELEASED,

    /**
     * Request broadcast, waiting for replies from every other peer.
     */
    WANTED,

    /**
     * Inside the critical section.
     */
    HELD
}
