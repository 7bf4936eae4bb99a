/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AccessRequest.
 */
class AccessRequestTest {

    @Test
    @DisplayName("Lower timestamp should win")
    void lowerTimestampShouldWin() {
        var early = new AccessRequest(3, 2);
        var late = new AccessRequest(1, 4);

        assertTrue(early.hasPriorityOver(late));
        assertFalse(late.hasPriorityOver(early));
    }

    @Test
    @DisplayName("Equal timestamps should be broken by lower id")
    void equalTimestampsShouldBeBrokenByLowerId() {
        var peer1 = new AccessRequest(1, 5);
        var peer2 = new AccessRequest(2, 5);

        assertTrue(peer1.hasPriorityOver(peer2));
        assertFalse(peer2.hasPriorityOver(peer1));
    }

    @Test
    @DisplayName("A request should not have priority over itself")
    void requestShouldNotHavePriorityOverItself() {
        var request = new AccessRequest(2, 7);

        assertFalse(request.hasPriorityOver(new AccessRequest(2, 7)));
        assertEquals(0, request.compareTo(new AccessRequest(2, 7)));
    }

    @Test
    @DisplayName("Sorting should give a total order")
    void sortingShouldGiveTotalOrder() {
        var requests = new ArrayList<>(List.of(
                new AccessRequest(3, 5),
                new AccessRequest(2, 1),
                new AccessRequest(1, 5),
                new AccessRequest(2, 9)
        ));
        Collections.sort(requests);

        assertEquals(List.of(
                new AccessRequest(2, 1),
                new AccessRequest(1, 5),
                new AccessRequest(3, 5),
                new AccessRequest(2, 9)
        ), requests);
    }

    @Test
    @DisplayName("Should reject invalid fields")
    void shouldRejectInvalidFields() {
        assertThrows(IllegalArgumentException.class, () -> new AccessRequest(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new AccessRequest(1, -1));
    }
}
