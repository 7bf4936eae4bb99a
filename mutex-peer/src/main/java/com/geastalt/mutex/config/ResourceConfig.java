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

/**
 * Location of the protected print server.
 */
@Configuration
@ConfigurationProperties(prefix = "mutex.resource")
@Getter
@Setter
public class ResourceConfig {

    private String host = "localhost";
    private int port = 50051;
    private long callTimeoutMs = 10000;

    public String getAddress() {
        return host + ":" + port;
    }
}
