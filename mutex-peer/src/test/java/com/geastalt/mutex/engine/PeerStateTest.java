/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.engine;

import com.geastalt.mutex.model.AccessRequest;
import com.geastalt.mutex.model.MutexState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PeerState.
 */
class PeerStateTest {

    private PeerState state;

    @BeforeEach
    void setUp() {
        state = new PeerState();
    }

    @Test
    @DisplayName("Should start RELEASED with nothing outstanding")
    void shouldStartReleased() {
        assertEquals(MutexState.RELEASED, state.getState());
        assertEquals(-1, state.getRequestTimestamp());
        assertEquals(0, state.getPendingReplyCount());
        assertTrue(state.getDeferredPeerIds().isEmpty());
    }

    @Test
    @DisplayName("Should move through WANTED to HELD once every reply arrives")
    void shouldMoveThroughWantedToHeld() {
        var future = state.beginRequest(4, List.of(2, 3));

        assertEquals(MutexState.WANTED, state.getState());
        assertEquals(2, state.getPendingReplyCount());
        assertTrue(state.isAwaiting(2, 4));
        assertFalse(state.isAwaiting(2, 3), "reply for another request must not count");

        state.recordReply(2);
        assertThrows(IllegalStateException.class, state::enterHeld);
        state.recordReply(3);
        state.enterHeld();

        assertEquals(MutexState.HELD, state.getState());
        assertTrue(future.isDone());
        assertFalse(state.isAwaiting(3, 4));
    }

    @Test
    @DisplayName("Should reject a duplicate reply")
    void shouldRejectDuplicateReply() {
        state.beginRequest(1, List.of(2));
        state.recordReply(2);

        assertThrows(IllegalStateException.class, () -> state.recordReply(2));
    }

    @Test
    @DisplayName("Should not begin a request unless RELEASED")
    void shouldNotBeginRequestUnlessReleased() {
        state.beginRequest(1, List.of(2));

        assertThrows(IllegalStateException.class, () -> state.beginRequest(2, List.of(2)));
    }

    @Test
    @DisplayName("Should not defer while RELEASED")
    void shouldNotDeferWhileReleased() {
        assertThrows(IllegalStateException.class, () -> state.defer(new AccessRequest(2, 3)));
    }

    @Test
    @DisplayName("Should drain deferred requests in arrival order and keep the newest per peer")
    void shouldDrainDeferredInArrivalOrder() {
        state.beginRequest(1, List.of());
        state.enterHeld();

        state.defer(new AccessRequest(3, 5));
        state.defer(new AccessRequest(2, 6));
        state.defer(new AccessRequest(3, 8));

        assertEquals(List.of(3, 2), state.getDeferredPeerIds());
        var drained = state.drainDeferred();
        assertEquals(List.of(new AccessRequest(3, 8), new AccessRequest(2, 6)), drained);
        assertTrue(state.getDeferredPeerIds().isEmpty());
    }

    @Test
    @DisplayName("Should refuse to reset with unanswered deferred requesters")
    void shouldRefuseResetWithDeferredRequesters() {
        state.beginRequest(1, List.of(2));
        state.defer(new AccessRequest(2, 3));

        assertThrows(IllegalStateException.class, state::reset);

        state.drainDeferred();
        state.reset();
        assertEquals(MutexState.RELEASED, state.getState());
        assertEquals(-1, state.getRequestTimestamp());
    }

    @Test
    @DisplayName("Should expose the outstanding request for priority comparison")
    void shouldExposeOutstandingRequest() {
        assertThrows(IllegalStateException.class, () -> state.outstandingRequest(1));

        state.beginRequest(9, List.of(2));

        assertEquals(new AccessRequest(1, 9), state.outstandingRequest(1));
    }

    @Test
    @DisplayName("Should fail the waiting future")
    void shouldFailWaitingFuture() {
        var future = state.beginRequest(1, List.of(2));

        state.failPending(new IllegalStateException("stopping"));

        var e = assertThrows(ExecutionException.class, future::get);
        assertEquals("stopping", e.getCause().getMessage());
    }
}
