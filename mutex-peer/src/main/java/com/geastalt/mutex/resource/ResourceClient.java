/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.resource;

import com.geastalt.mutex.model.ResourceException;
import com.geastalt.mutex.model.WorkItem;
import com.geastalt.mutex.model.WorkReceipt;

/**
 * Synchronous access to the protected resource. Only called while holding the critical section.
 */
public interface ResourceClient {

    /**
     * Submits one unit of work and blocks until the resource reports completion.
     *
     * @throws ResourceException if the resource fails or cannot be reached
     */
    WorkReceipt submitWork(WorkItem item);
}
