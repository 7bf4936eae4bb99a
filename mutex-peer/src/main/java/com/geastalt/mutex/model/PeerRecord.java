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
 * Identity and endpoint of a peer. Fixed for the lifetime of the process.
 */
public record PeerRecord(
        int peerId,
        String host,
        int port
) {
    public PeerRecord {
        Objects.requireNonNull(host, "host must not be null");
        if (peerId <= 0) {
            throw new IllegalArgumentException("peerId must be positive");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    public String address() {
        return host + ":" + port;
    }
}
