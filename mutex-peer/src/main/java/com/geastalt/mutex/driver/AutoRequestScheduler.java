/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.driver;

import com.geastalt.mutex.config.DriverConfig;
import com.geastalt.mutex.engine.MutualExclusion;
import com.geastalt.mutex.model.AccessResult;
import com.geastalt.mutex.model.WorkReceipt;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates print jobs at random intervals, each one run through the mutual exclusion protocol.
 * Disabled unless {@code mutex.driver.enabled=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutoRequestScheduler {

    private final DriverConfig driverConfig;
    private final MutualExclusion mutualExclusion;

    private final AtomicLong confirmedPrints = new AtomicLong(0);
    private ScheduledExecutorService scheduler;

    @PostConstruct
    public void start() {
        if (!driverConfig.isEnabled()) {
            log.info("Automatic print requests disabled");
            return;
        }
        if (driverConfig.getDocuments().isEmpty()) {
            log.warn("Automatic print requests enabled but no documents configured");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            var thread = new Thread(runnable, "print-driver");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.schedule(this::runAndReschedule, driverConfig.getStartupDelayMs(), TimeUnit.MILLISECONDS);
        log.info("Automatic print requests start in {} ms", driverConfig.getStartupDelayMs());
    }

    @PreDestroy
    public void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    /**
     * Prints one randomly chosen document.
     */
    public AccessResult<WorkReceipt> runOnce() {
        var documents = driverConfig.getDocuments();
        var document = documents.get(ThreadLocalRandom.current().nextInt(documents.size()));

        log.info("=== Initiating print request: '{}' ===", document);
        var result = mutualExclusion.execute(document)
                .onSuccess(receipt -> confirmedPrints.incrementAndGet())
                .onFailure(error -> log.warn("Print request failed ({}): {}", error.status(), error.message()));
        log.info("=== Print request completed (total confirmed: {}) ===", confirmedPrints.get());
        return result;
    }

    public long getConfirmedPrints() {
        return confirmedPrints.get();
    }

    private void runAndReschedule() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.error("Unexpected error in print driver: {}", e.getMessage(), e);
        }

        long[] interval = driverConfig.normalizedInterval();
        long delay = interval[0] == interval[1]
                ? interval[0]
                : ThreadLocalRandom.current().nextLong(interval[0], interval[1] + 1);
        log.info("Next request in {} ms", delay);
        if (!scheduler.isShutdown()) {
            scheduler.schedule(this::runAndReschedule, delay, TimeUnit.MILLISECONDS);
        }
    }
}
