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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Mutual exclusion bookkeeping of one peer.
 *
 * <p>Not thread-safe. The owning {@link MutexEngine} only touches it while
 * holding its state lock, one lock acquisition per transition.
 */
public class PeerState {

    private static final long NO_REQUEST = -1;

    private MutexState state = MutexState.RELEASED;
    private long requestTimestamp = NO_REQUEST;
    private final Set<Integer> awaitedPeers = new HashSet<>();
    private final Map<Integer, AccessRequest> deferred = new LinkedHashMap<>();
    private CompletableFuture<Void> allReplies;

    /**
     * RELEASED -> WANTED. Every peer in {@code peerIds} now owes a reply.
     *
     * @return future completed when the last reply arrives
     */
    public CompletableFuture<Void> beginRequest(long timestamp, Collection<Integer> peerIds) {
        requireState(MutexState.RELEASED);
        state = MutexState.WANTED;
        requestTimestamp = timestamp;
        awaitedPeers.clear();
        awaitedPeers.addAll(peerIds);
        allReplies = new CompletableFuture<>();
        return allReplies;
    }

    /**
     * Checks whether a reply from this peer for this request is still owed.
     */
    public boolean isAwaiting(int peerId, long forRequestTimestamp) {
        return state == MutexState.WANTED
                && forRequestTimestamp == requestTimestamp
                && awaitedPeers.contains(peerId);
    }

    /**
     * Marks the peer's reply as received. Callers check {@link #isAwaiting} first.
     */
    public void recordReply(int peerId) {
        if (!awaitedPeers.remove(peerId)) {
            throw new IllegalStateException("No reply outstanding from peer " + peerId);
        }
    }

    /**
     * WANTED -> HELD, once no reply is outstanding. Wakes the waiting initiator.
     */
    public void enterHeld() {
        requireState(MutexState.WANTED);
        if (!awaitedPeers.isEmpty()) {
            throw new IllegalStateException(awaitedPeers.size() + " replies still outstanding");
        }
        state = MutexState.HELD;
        allReplies.complete(null);
    }

    public void defer(AccessRequest request) {
        if (state == MutexState.RELEASED) {
            throw new IllegalStateException("Cannot defer while RELEASED");
        }
        deferred.put(request.requesterId(), request);
    }

    /**
     * Drops a deferral that a newer request from the same peer supersedes.
     */
    public void forgetDeferred(int peerId) {
        deferred.remove(peerId);
    }

    /**
     * Removes and returns every deferred request, oldest deferral first.
     */
    public List<AccessRequest> drainDeferred() {
        var drained = new ArrayList<>(deferred.values());
        deferred.clear();
        return drained;
    }

    /**
     * Back to RELEASED, forgetting the outstanding request. Deferred
     * requesters must have been drained by the caller.
     */
    public void reset() {
        if (!deferred.isEmpty()) {
            throw new IllegalStateException(deferred.size() + " deferred requesters not answered");
        }
        state = MutexState.RELEASED;
        requestTimestamp = NO_REQUEST;
        awaitedPeers.clear();
        allReplies = null;
    }

    /**
     * Fails the waiting initiator, if any. Used on shutdown.
     */
    public void failPending(Throwable cause) {
        if (allReplies != null) {
            allReplies.completeExceptionally(cause);
        }
    }

    /**
     * The local outstanding request, for priority comparison while WANTED or HELD.
     */
    public AccessRequest outstandingRequest(int selfId) {
        if (state == MutexState.RELEASED) {
            throw new IllegalStateException("No outstanding request while RELEASED");
        }
        return new AccessRequest(selfId, requestTimestamp);
    }

    public MutexState getState() {
        return state;
    }

    public long getRequestTimestamp() {
        return requestTimestamp;
    }

    public int getPendingReplyCount() {
        return awaitedPeers.size();
    }

    public List<Integer> getDeferredPeerIds() {
        return List.copyOf(deferred.keySet());
    }

    private void requireState(MutexState expected) {
        if (state != expected) {
            throw new IllegalStateException("Expected " + expected + " but was " + state);
        }
    }
}
