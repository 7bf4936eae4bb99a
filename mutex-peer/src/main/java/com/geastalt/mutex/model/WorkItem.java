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
 * Protected work submitted while holding the critical section.
 */
public record WorkItem(
        int clientId,
        String payload,
        long requestNumber,
        long timestamp
) {
    public WorkItem {
        Objects.requireNonNull(payload, "payload must not be null");
    }
}
