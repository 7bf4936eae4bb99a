/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.clock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Lamport logical clock.
 * Every operation that advances the clock returns a value strictly greater
 * than any value this clock has returned before, even under concurrent use.
 */
public class LogicalClock {

    private final AtomicLong time;

    public LogicalClock() {
        this(0);
    }

    public LogicalClock(long initialTime) {
        if (initialTime < 0) {
            throw new IllegalArgumentException("initialTime must be non-negative");
        }
        this.time = new AtomicLong(initialTime);
    }

    /**
     * Records a local event.
     *
     * @return the new clock value
     */
    public long tick() {
        return time.incrementAndGet();
    }

    /**
     * Stamps an outbound message. Same rule as {@link #tick()}.
     */
    public long stamp() {
        return tick();
    }

    /**
     * Merges a timestamp carried by a received message:
     * {@code local = max(local, remote) + 1}.
     *
     * @param remoteTime timestamp from the received message; negative values count as zero
     * @return the new clock value
     */
    public long observe(long remoteTime) {
        long remote = Math.max(0, remoteTime);
        return time.updateAndGet(current -> Math.max(current, remote) + 1);
    }

    /**
     * Returns the current value without advancing the clock.
     */
    public long current() {
        return time.get();
    }

    @Override
    public String toString() {
        return "LogicalClock{time=" + time.get() + "}";
    }
}
