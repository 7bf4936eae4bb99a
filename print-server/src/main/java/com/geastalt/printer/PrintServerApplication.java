/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.printer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main application class for the print server.
 *
 * <p>The print server is the shared resource. It takes no part in mutual
 * exclusion: it prints whatever it receives and confirms completion. Jobs that
 * overlap in time are reported, since they mean the peers' protocol failed.
 */
@SpringBootApplication
@EnableConfigurationProperties
public class PrintServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrintServerApplication.class, args);
    }
}
