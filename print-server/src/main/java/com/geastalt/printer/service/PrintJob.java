/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.printer.service;

import java.util.Objects;

/**
 * One document sent to the printer by a peer.
 */
public record PrintJob(
        int clientId,
        String content,
        long lamportTimestamp,
        long requestNumber
) {
    public PrintJob {
        Objects.requireNonNull(content, "content must not be null");
    }
}
