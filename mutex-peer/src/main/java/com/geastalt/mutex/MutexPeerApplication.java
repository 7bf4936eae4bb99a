/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main application class for a mutual exclusion peer.
 *
 * <p>Every peer is both a gRPC server, answering access requests from the
 * other peers, and a gRPC client, asking them for permission before it sends
 * a job to the shared print server. Coordination uses:
 * <ul>
 *   <li>the Ricart-Agrawala request/grant/release protocol, with no central arbiter</li>
 *   <li>Lamport logical clocks to totally order competing requests</li>
 *   <li>gRPC for peer-to-peer and peer-to-printer calls</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties
public class MutexPeerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MutexPeerApplication.class, args);
    }
}
