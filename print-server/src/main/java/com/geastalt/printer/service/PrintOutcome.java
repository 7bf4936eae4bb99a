/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.printer.service;

/**
 * Result of printing one job.
 *
 * @param success      whether the job was printed completely
 * @param confirmation message returned to the peer
 * @param clock        printer's Lamport clock when the job finished
 * @param overlapped   whether another job was printing at the same time
 */
public record PrintOutcome(
        boolean success,
        String confirmation,
        long clock,
        boolean overlapped
) {
}
