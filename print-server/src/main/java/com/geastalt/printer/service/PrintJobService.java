/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.printer.service;

import com.geastalt.mutex.clock.LogicalClock;
import com.geastalt.printer.config.PrinterConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated printer. Prints one job at a time when the peers behave, and
 * counts the jobs that arrive while another one is still printing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PrintJobService {

    private final PrinterConfig config;

    private final LogicalClock clock = new LogicalClock();
    private final AtomicInteger activeJobs = new AtomicInteger(0);
    private final AtomicLong printCount = new AtomicLong(0);
    private final AtomicLong overlapCount = new AtomicLong(0);

    /**
     * Prints a job, blocking for the simulated print duration.
     */
    public PrintOutcome print(PrintJob job) {
        clock.observe(job.lamportTimestamp());

        boolean overlapped = activeJobs.incrementAndGet() > 1;
        if (overlapped) {
            overlapCount.incrementAndGet();
            log.error("OVERLAP: job #{} from client {} arrived while another job is printing",
                    job.requestNumber(), job.clientId());
        }

        try {
            long delayMs = config.pickDelayMs(ThreadLocalRandom.current().nextDouble());
            log.info("[TS: {}] CLIENT {} (request #{}): {} - printing for {} ms",
                    job.lamportTimestamp(), job.clientId(), job.requestNumber(), job.content(), delayMs);

            Thread.sleep(delayMs);

            long total = printCount.incrementAndGet();
            long finishedAt = clock.tick();
            log.info("Print completed for client {}. Total prints: {}", job.clientId(), total);
            return new PrintOutcome(true, "Print completed for client " + job.clientId(), finishedAt, overlapped);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Print of job #{} from client {} interrupted", job.requestNumber(), job.clientId());
            return new PrintOutcome(false, "Print interrupted for client " + job.clientId(), clock.tick(), overlapped);
        } finally {
            activeJobs.decrementAndGet();
        }
    }

    public long getPrintCount() {
        return printCount.get();
    }

    public long getOverlapCount() {
        return overlapCount.get();
    }

    public long clockValue() {
        return clock.current();
    }
}
