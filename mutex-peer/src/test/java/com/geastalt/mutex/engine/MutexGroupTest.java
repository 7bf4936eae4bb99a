/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.engine;

import com.geastalt.mutex.config.PeerConfig;
import com.geastalt.mutex.model.AccessResult;
import com.geastalt.mutex.model.AccessStatus;
import com.geastalt.mutex.model.MutexState;
import com.geastalt.mutex.model.WorkReceipt;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests a group of three engines talking to each other over an in-memory network.
 */
@Timeout(60)
class MutexGroupTest {

    private static final String PEERS = "1:localhost:50052,2:localhost:50053,3:localhost:50054";

    private InMemoryPeerNetwork network;
    private RecordingResource printer;
    private List<MutexEngine> engines;
    private ExecutorService callers;

    @BeforeEach
    void setUp() {
        network = new InMemoryPeerNetwork();
        printer = new RecordingResource(5);
        engines = new ArrayList<>();
        for (int id = 1; id <= 3; id++) {
            var config = new PeerConfig();
            config.setPeerId(id);
            config.setPeers(PEERS);
            var engine = new MutexEngine(config, network, printer);
            engine.init();
            network.register(id, engine);
            engines.add(engine);
        }
        callers = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
        engines.forEach(MutexEngine::stop);
    }

    private MutexEngine peer(int id) {
        return engines.get(id - 1);
    }

    @Test
    @DisplayName("Should never let two peers use the resource at once")
    void shouldNeverOverlapResourceUse() throws Exception {
        int jobsPerPeer = 5;
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<List<AccessResult<WorkReceipt>>>>();

        for (var engine : engines) {
            futures.add(callers.submit(() -> {
                start.await();
                var results = new ArrayList<AccessResult<WorkReceipt>>();
                for (int i = 0; i < jobsPerPeer; i++) {
                    results.add(engine.execute("Instruction manual"));
                }
                return results;
            }));
        }
        start.countDown();

        for (var future : futures) {
            for (var result : future.get(50, TimeUnit.SECONDS)) {
                assertTrue(result.isSuccess(), () -> "execute failed: " + result.getError());
            }
        }

        assertEquals(1, printer.getMaxConcurrent(), "critical sections overlapped");
        assertEquals(3 * jobsPerPeer, printer.getReceived().size());
        for (var engine : engines) {
            var status = engine.status();
            assertEquals(MutexState.RELEASED, status.state());
            assertEquals(jobsPerPeer, status.completedJobs());
            assertTrue(status.deferredPeerIds().isEmpty());
        }
    }

    @Test
    @DisplayName("Should let every contending peer in exactly once")
    void shouldLetEveryContendingPeerIn() throws Exception {
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<AccessResult<WorkReceipt>>>();

        for (var engine : engines) {
            futures.add(callers.submit(() -> {
                start.await();
                return engine.execute("Pending task list");
            }));
        }
        start.countDown();

        for (var future : futures) {
            assertTrue(future.get(30, TimeUnit.SECONDS).isSuccess());
        }

        var clients = new HashSet<Integer>();
        printer.getReceived().forEach(item -> clients.add(item.clientId()));
        assertEquals(3, printer.getReceived().size());
        assertEquals(3, clients.size());
    }

    @Test
    @DisplayName("Should keep the group live after a resource failure")
    void shouldStayLiveAfterResourceFailure() {
        printer.setFailing(true);
        assertEquals(AccessStatus.RESOURCE_FAILED, peer(1).execute("Service agreement").status());
        printer.setFailing(false);

        assertTrue(peer(2).execute("Service agreement").isSuccess());
        assertTrue(peer(3).execute("Service agreement").isSuccess());
        assertTrue(peer(1).execute("Service agreement").isSuccess());
    }

    @Test
    @DisplayName("Should time out and stay RELEASED when a peer is unreachable")
    void shouldTimeOutWhenPeerUnreachable() {
        network.disconnect(3);

        var result = peer(1).acquire(Duration.ofMillis(300));

        assertEquals(AccessStatus.TIMEOUT, result.status());
        assertEquals(MutexState.RELEASED, peer(1).status().state());
        assertEquals(0, peer(1).status().pendingReplyCount());
        assertEquals(MutexState.RELEASED, peer(2).status().state());
    }

    @Test
    @DisplayName("Should stamp later work with larger clocks on the same peer")
    void shouldStampLaterWorkWithLargerClocks() {
        peer(1).execute("Monthly financial report");
        peer(2).execute("Monthly financial report");
        peer(1).execute("Monthly financial report");

        var fromPeer1 = printer.getReceived().stream()
                .filter(item -> item.clientId() == 1)
                .toList();
        assertEquals(2, fromPeer1.size());
        assertTrue(fromPeer1.get(1).timestamp() > fromPeer1.get(0).timestamp());
        assertEquals(List.of(1L, 2L), fromPeer1.stream().map(item -> item.requestNumber()).toList());
    }
}
