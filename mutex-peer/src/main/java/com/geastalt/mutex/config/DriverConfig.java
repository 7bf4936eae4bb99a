/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the automatic print request generator.
 */
@Configuration
@ConfigurationProperties(prefix = "mutex.driver")
@Getter
@Setter
public class DriverConfig {

    private boolean enabled = false;
    private long startupDelayMs = 2000;
    private long minIntervalMs = 5000;
    private long maxIntervalMs = 15000;
    private List<String> documents = new ArrayList<>(List.of(
            "Monthly financial report",
            "Project requirements document",
            "Team meeting minutes",
            "Service agreement",
            "Pending task list",
            "Operating cost spreadsheet",
            "Instruction manual",
            "Sales proposal",
            "Completion certificate",
            "Statement of responsibility"
    ));

    /**
     * Clamps the configured interval bounds into a usable range.
     */
    public long[] normalizedInterval() {
        long min = Math.max(0, minIntervalMs);
        long max = Math.max(min, maxIntervalMs);
        return new long[] { min, max };
    }
}
