/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.engine;

import com.geastalt.mutex.clock.LogicalClock;
import com.geastalt.mutex.config.PeerConfig;
import com.geastalt.mutex.model.*;
import com.geastalt.mutex.resource.ResourceClient;
import com.geastalt.mutex.transport.PeerTransport;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ricart-Agrawala mutual exclusion engine of one peer.
 *
 * <p>The engine is both initiator and responder. A single state lock spans
 * every transition; outbound calls are issued only after it is released, and
 * a local request waits on a future so inbound handlers are never blocked by it.
 */
@Slf4j
@Service
public class MutexEngine implements MutualExclusion, AccessResponder {

    private final PeerConfig config;
    private final PeerTransport transport;
    private final ResourceClient resourceClient;

    private final int selfId;
    private final Map<Integer, PeerRecord> otherPeers;

    private final LogicalClock clock = new LogicalClock();
    private final PeerState state = new PeerState();
    private final ReentrantLock stateLock = new ReentrantLock();

    // Serializes local callers so a peer has at most one outstanding request
    private final ReentrantLock initiatorLock = new ReentrantLock(true);

    private final AtomicLong requestNumber = new AtomicLong(0);
    private final AtomicLong completedJobs = new AtomicLong(0);

    private ExecutorService outbound;

    public MutexEngine(PeerConfig config, PeerTransport transport, ResourceClient resourceClient) {
        config.validate();
        this.config = config;
        this.transport = transport;
        this.resourceClient = resourceClient;
        this.selfId = config.getPeerId();

        var peers = new LinkedHashMap<Integer, PeerRecord>();
        for (var peer : config.getOtherPeers()) {
            peers.put(peer.peerId(), peer);
        }
        this.otherPeers = Map.copyOf(peers);
    }

    @PostConstruct
    public void init() {
        var threadCount = new AtomicInteger();
        outbound = Executors.newFixedThreadPool(config.getOutboundThreads(), runnable -> {
            var thread = new Thread(runnable, "mutex-outbound-" + selfId + "-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.info("Peer {} initialized as RELEASED with {} other peer(s): {}",
                selfId, otherPeers.size(), otherPeers.keySet());
    }

    @PreDestroy
    public void stop() {
        stateLock.lock();
        try {
            state.failPending(new MutexException("Peer " + selfId + " is shutting down"));
        } finally {
            stateLock.unlock();
        }
        if (outbound != null) {
            outbound.shutdown();
            try {
                if (!outbound.awaitTermination(5, TimeUnit.SECONDS)) {
                    outbound.shutdownNow();
                }
            } catch (InterruptedException e) {
                outbound.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Peer {} stopped", selfId);
    }

    // ---------------------------------------------------------------- initiator

    @Override
    public AccessResult<Long> acquire(Duration timeout) {
        CompletableFuture<Void> allReplies;
        AccessRequest request;

        stateLock.lock();
        try {
            if (state.getState() != MutexState.RELEASED) {
                return AccessResult.failure(AccessError.invalidState(state.getState(), MutexState.RELEASED));
            }
            request = new AccessRequest(selfId, clock.stamp());
            allReplies = state.beginRequest(request.timestamp(), otherPeers.keySet());
            log.info("Peer {} [LT: {}] requesting critical section (ts={}) from {} peer(s)",
                    selfId, clock.current(), request.timestamp(), otherPeers.size());
            if (state.getPendingReplyCount() == 0) {
                state.enterHeld();
                log.info("Peer {} is alone, entering critical section", selfId);
            }
        } finally {
            stateLock.unlock();
        }

        for (var peer : otherPeers.values()) {
            submitOutbound(() -> sendAccessRequest(peer, request));
        }

        return awaitReplies(request.timestamp(), allReplies, timeout);
    }

    @Override
    public AccessResult<Void> release() {
        List<OutboundRelease> releases;

        stateLock.lock();
        try {
            if (state.getState() != MutexState.HELD) {
                return AccessResult.failure(AccessError.invalidState(state.getState(), MutexState.HELD));
            }
            releases = drainAndReset();
            log.info("Peer {} [LT: {}] releasing critical section, answering {} deferred peer(s)",
                    selfId, clock.current(), releases.size());
        } finally {
            stateLock.unlock();
        }

        sendReleases(releases);
        return AccessResult.success(null);
    }

    @Override
    public AccessResult<WorkReceipt> execute(String payload) {
        initiatorLock.lock();
        try {
            long number = requestNumber.incrementAndGet();
            var acquired = acquire(acquireTimeout());
            if (!acquired.isSuccess()) {
                log.warn("Peer {} could not enter critical section for request #{}: {}",
                        selfId, number, acquired.getError().message());
                return AccessResult.failure(acquired.getError());
            }

            try {
                var item = new WorkItem(selfId, payload, number, stampClock());
                log.info("Peer {} sending to resource: '{}'", selfId, payload);
                var receipt = resourceClient.submitWork(item);
                observeClock(receipt.clock());
                long total = completedJobs.incrementAndGet();
                log.info("Peer {} [LT: {}] work confirmed ({} total): {}",
                        selfId, clock.current(), total, receipt.confirmation());
                return AccessResult.success(receipt);
            } catch (ResourceException e) {
                log.error("Peer {} resource failure for request #{}: {}", selfId, number, e.getMessage());
                return AccessResult.failure(AccessError.resourceFailed(e.getMessage()));
            } finally {
                release();
            }
        } finally {
            initiatorLock.unlock();
        }
    }

    @Override
    public PeerStatus status() {
        stateLock.lock();
        try {
            return new PeerStatus(
                    selfId,
                    state.getState(),
                    clock.current(),
                    state.getRequestTimestamp(),
                    state.getPendingReplyCount(),
                    state.getDeferredPeerIds(),
                    completedJobs.get()
            );
        } finally {
            stateLock.unlock();
        }
    }

    // ---------------------------------------------------------------- responder

    @Override
    public AccessReply handleAccessRequest(AccessRequest request) {
        int requesterId = request.requesterId();
        if (!otherPeers.containsKey(requesterId)) {
            log.warn("Peer {} rejecting access request from unknown peer {}", selfId, requesterId);
            throw new ProtocolViolationException(requesterId, "Unknown requester " + requesterId);
        }

        stateLock.lock();
        try {
            clock.observe(request.timestamp());

            boolean grant = state.getState() == MutexState.RELEASED
                    || request.hasPriorityOver(state.outstandingRequest(selfId));

            if (grant) {
                state.forgetDeferred(requesterId);
                log.info("Peer {} [LT: {}] GRANTED access to peer {} (ts={})",
                        selfId, clock.current(), requesterId, request.timestamp());
                return AccessReply.grant(selfId, request.timestamp(), clock.stamp());
            }

            state.defer(request);
            log.info("Peer {} [LT: {}] DEFERRED access for peer {} (ts={}, own ts={}, state={})",
                    selfId, clock.current(), requesterId, request.timestamp(),
                    state.getRequestTimestamp(), state.getState());
            return AccessReply.deferred(selfId, request.timestamp(), clock.stamp());
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public boolean handleAccessReply(AccessReply reply) {
        if (!reply.granted()) {
            noteDeferral(reply);
            return false;
        }
        return acceptReply(reply.granterId(), reply.requestTimestamp(), reply.clock(), "grant");
    }

    @Override
    public boolean handleReleaseNotice(ReleaseNotice notice) {
        return acceptReply(notice.releaserId(), notice.requestTimestamp(), notice.clock(), "release");
    }

    @Override
    public long clockValue() {
        return clock.current();
    }

    // ---------------------------------------------------------------- internals

    // A deferral only carries the granter's clock; the grant itself arrives as a release
    private void noteDeferral(AccessReply reply) {
        int granterId = reply.granterId();
        if (!otherPeers.containsKey(granterId)) {
            log.warn("Peer {} ignoring deferral from unknown peer {}", selfId, granterId);
            return;
        }

        stateLock.lock();
        try {
            if (!state.isAwaiting(granterId, reply.requestTimestamp())) {
                log.warn("Peer {} ignoring deferral from peer {} for ts={} (state={}, own ts={})",
                        selfId, granterId, reply.requestTimestamp(), state.getState(), state.getRequestTimestamp());
                return;
            }
            clock.observe(reply.clock());
            log.debug("Peer {} request deferred by peer {}, waiting for its release", selfId, granterId);
        } finally {
            stateLock.unlock();
        }
    }

    private long stampClock() {
        stateLock.lock();
        try {
            return clock.stamp();
        } finally {
            stateLock.unlock();
        }
    }

    private void observeClock(long remoteClock) {
        stateLock.lock();
        try {
            clock.observe(remoteClock);
        } finally {
            stateLock.unlock();
        }
    }

    private boolean acceptReply(int senderId, long requestTimestamp, long remoteClock, String kind) {
        if (!otherPeers.containsKey(senderId)) {
            log.warn("Peer {} ignoring {} from unknown peer {}", selfId, kind, senderId);
            return false;
        }

        stateLock.lock();
        try {
            if (!state.isAwaiting(senderId, requestTimestamp)) {
                log.warn("Peer {} ignoring {} from peer {} for ts={} (state={}, own ts={})",
                        selfId, kind, senderId, requestTimestamp, state.getState(), state.getRequestTimestamp());
                return false;
            }

            clock.observe(remoteClock);
            state.recordReply(senderId);
            int received = otherPeers.size() - state.getPendingReplyCount();
            log.info("Peer {} [LT: {}] received {} from peer {} ({}/{})",
                    selfId, clock.current(), kind, senderId, received, otherPeers.size());

            if (state.getPendingReplyCount() == 0) {
                state.enterHeld();
                log.info("Peer {} received all replies, entering critical section (ts={})",
                        selfId, requestTimestamp);
            }
            return true;
        } finally {
            stateLock.unlock();
        }
    }

    private AccessResult<Long> awaitReplies(long timestamp, CompletableFuture<Void> allReplies, Duration timeout) {
        try {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                allReplies.get();
            } else {
                allReplies.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            return AccessResult.success(timestamp);
        } catch (TimeoutException e) {
            int pending = pendingReplies();
            if (!abandonRequest(timestamp)) {
                return AccessResult.success(timestamp);
            }
            return AccessResult.failure(AccessError.timeout(pending, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!abandonRequest(timestamp)) {
                release();
            }
            return AccessResult.failure(AccessError.interrupted());
        } catch (ExecutionException e) {
            if (!abandonRequest(timestamp)) {
                release();
            }
            return AccessResult.failure(AccessError.transportFailed(e.getCause().getMessage()));
        }
    }

    /**
     * Gives up the outstanding request and answers everyone it held back.
     *
     * @return false if the request reached HELD before it could be abandoned
     */
    private boolean abandonRequest(long timestamp) {
        List<OutboundRelease> releases;

        stateLock.lock();
        try {
            if (state.getRequestTimestamp() != timestamp) {
                return true;
            }
            if (state.getState() == MutexState.HELD) {
                return false;
            }
            log.warn("Peer {} abandoning request ts={} with {} reply(ies) outstanding",
                    selfId, timestamp, state.getPendingReplyCount());
            releases = drainAndReset();
        } finally {
            stateLock.unlock();
        }

        sendReleases(releases);
        return true;
    }

    private int pendingReplies() {
        stateLock.lock();
        try {
            return state.getPendingReplyCount();
        } finally {
            stateLock.unlock();
        }
    }

    // Caller holds stateLock
    private List<OutboundRelease> drainAndReset() {
        var releases = new ArrayList<OutboundRelease>();
        for (var deferred : state.drainDeferred()) {
            var peer = otherPeers.get(deferred.requesterId());
            releases.add(new OutboundRelease(peer,
                    new ReleaseNotice(selfId, deferred.timestamp(), clock.stamp())));
        }
        state.reset();
        return releases;
    }

    private void sendAccessRequest(PeerRecord peer, AccessRequest request) {
        try {
            var reply = transport.requestAccess(peer, request);
            handleAccessReply(reply);
        } catch (TransportException e) {
            log.error("Peer {} access request to peer {} failed, reply stays outstanding: {}",
                    selfId, peer.peerId(), e.getMessage());
        }
    }

    private void sendReleases(List<OutboundRelease> releases) {
        for (var release : releases) {
            submitOutbound(() -> deliverRelease(release));
        }
    }

    private void deliverRelease(OutboundRelease release) {
        try {
            if (!transport.releaseAccess(release.peer(), release.notice())) {
                log.warn("Peer {} release to peer {} was not acknowledged", selfId, release.peer().peerId());
            }
        } catch (TransportException e) {
            log.error("Peer {} release to peer {} failed: {}", selfId, release.peer().peerId(), e.getMessage());
        }
    }

    private void submitOutbound(Runnable task) {
        try {
            outbound.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Peer {} dropping outbound message during shutdown", selfId);
        }
    }

    private Duration acquireTimeout() {
        long timeoutMs = config.getAcquireTimeoutMs();
        return timeoutMs > 0 ? Duration.ofMillis(timeoutMs) : null;
    }

    private record OutboundRelease(PeerRecord peer, ReleaseNotice notice) {
    }
}
