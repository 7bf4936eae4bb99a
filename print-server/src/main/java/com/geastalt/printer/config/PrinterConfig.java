/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.printer.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the simulated printer.
 */
@Configuration
@ConfigurationProperties(prefix = "printer")
@Getter
@Setter
public class PrinterConfig {

    private long minDelayMs = 2000;
    private long maxDelayMs = 3000;

    /**
     * Picks a print duration within the configured bounds.
     */
    public long pickDelayMs(double fraction) {
        long min = Math.max(0, minDelayMs);
        long max = Math.max(min, maxDelayMs);
        return min + Math.round((max - min) * Math.min(1.0, Math.max(0.0, fraction)));
    }
}
