/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.model;

/**
 * Base class of the mutual exclusion failures.
 */
public class MutexException extends RuntimeException {

    public MutexException(String message) {
        super(message);
    }

    public MutexException(String message, Throwable cause) {
        super(message, cause);
    }
}
