/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.printer.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PrinterConfig.
 */
class PrinterConfigTest {

    @Test
    @DisplayName("Should pick delays within the default two to three second window")
    void shouldPickDelayWithinDefaultWindow() {
        var config = new PrinterConfig();

        assertEquals(2000, config.pickDelayMs(0.0));
        assertEquals(2500, config.pickDelayMs(0.5));
        assertEquals(3000, config.pickDelayMs(1.0));
    }

    @Test
    @DisplayName("Should clamp out-of-range fractions and inverted bounds")
    void shouldClampOutOfRangeInput() {
        var config = new PrinterConfig();
        config.setMinDelayMs(400);
        config.setMaxDelayMs(100);

        assertEquals(400, config.pickDelayMs(-3.0));
        assertEquals(400, config.pickDelayMs(7.0));
    }
}
