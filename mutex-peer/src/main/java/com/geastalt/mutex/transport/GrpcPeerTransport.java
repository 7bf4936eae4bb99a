/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.transport;

import com.geastalt.mutex.config.PeerConfig;
import com.geastalt.mutex.grpc.generated.AccessRequestMessage;
import com.geastalt.mutex.grpc.generated.MutualExclusionServiceGrpc;
import com.geastalt.mutex.grpc.generated.ReleaseMessage;
import com.geastalt.mutex.model.AccessReply;
import com.geastalt.mutex.model.AccessRequest;
import com.geastalt.mutex.model.PeerRecord;
import com.geastalt.mutex.model.ReleaseNotice;
import com.geastalt.mutex.model.TransportException;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * gRPC implementation of {@link PeerTransport}.
 * Keeps one channel per peer, created on first use, and applies a fresh deadline to every call.
 */
@Slf4j
@Component
public class GrpcPeerTransport implements PeerTransport {

    private final long callTimeoutMs;
    private final Function<PeerRecord, ManagedChannel> channelFactory;
    private final Map<Integer, ManagedChannel> channels = new ConcurrentHashMap<>();

    @Autowired
    public GrpcPeerTransport(PeerConfig config) {
        this(config.getCallTimeoutMs(), peer -> ManagedChannelBuilder.forAddress(peer.host(), peer.port())
                .usePlaintext()
                .keepAliveTime(30, TimeUnit.SECONDS)
                .keepAliveTimeout(10, TimeUnit.SECONDS)
                .build());
    }

    public GrpcPeerTransport(long callTimeoutMs, Function<PeerRecord, ManagedChannel> channelFactory) {
        this.callTimeoutMs = callTimeoutMs;
        this.channelFactory = channelFactory;
    }

    @Override
    public AccessReply requestAccess(PeerRecord peer, AccessRequest request) {
        try {
            var protoRequest = AccessRequestMessage.newBuilder()
                    .setRequesterId(request.requesterId())
                    .setLamportTimestamp(request.timestamp())
                    .build();

            var response = stub(peer)
                    .withDeadlineAfter(callTimeoutMs, TimeUnit.MILLISECONDS)
                    .requestAccess(protoRequest);

            return new AccessReply(
                    response.getGranterId(),
                    response.getAccessGranted(),
                    response.getRequestTimestamp(),
                    response.getLamportTimestamp()
            );
        } catch (StatusRuntimeException e) {
            log.warn("Failed to request access from peer {}: {}", peer.peerId(), e.getStatus());
            throw new TransportException(peer.peerId(),
                    "Access request to peer " + peer.peerId() + " failed: " + e.getStatus(), e);
        }
    }

    @Override
    public boolean releaseAccess(PeerRecord peer, ReleaseNotice notice) {
        try {
            var protoRelease = ReleaseMessage.newBuilder()
                    .setReleaserId(notice.releaserId())
                    .setRequestTimestamp(notice.requestTimestamp())
                    .setLamportTimestamp(notice.clock())
                    .build();

            return stub(peer)
                    .withDeadlineAfter(callTimeoutMs, TimeUnit.MILLISECONDS)
                    .releaseAccess(protoRelease)
                    .getAcknowledged();
        } catch (StatusRuntimeException e) {
            log.warn("Failed to send release to peer {}: {}", peer.peerId(), e.getStatus());
            throw new TransportException(peer.peerId(),
                    "Release to peer " + peer.peerId() + " failed: " + e.getStatus(), e);
        }
    }

    private MutualExclusionServiceGrpc.MutualExclusionServiceBlockingStub stub(PeerRecord peer) {
        var channel = channels.computeIfAbsent(peer.peerId(), id -> {
            log.info("Creating peer channel to {} at {}", peer.peerId(), peer.address());
            return channelFactory.apply(peer);
        });
        return MutualExclusionServiceGrpc.newBlockingStub(channel);
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down {} peer channel(s)", channels.size());
        for (var entry : channels.entrySet()) {
            try {
                entry.getValue().shutdown().awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                entry.getValue().shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        channels.clear();
    }
}
