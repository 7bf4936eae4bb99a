/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.grpc;

import com.geastalt.mutex.engine.AccessResponder;
import com.geastalt.mutex.engine.MutualExclusion;
import com.geastalt.mutex.grpc.generated.*;
import com.geastalt.mutex.model.AccessRequest;
import com.geastalt.mutex.model.MutexState;
import com.geastalt.mutex.model.ProtocolViolationException;
import com.geastalt.mutex.model.ReleaseNotice;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.devh.boot.grpc.server.service.GrpcService;

/**
 * gRPC service receiving protocol messages from other peers.
 */
@Slf4j
@GrpcService
@RequiredArgsConstructor
public class PeerGrpcService extends MutualExclusionServiceGrpc.MutualExclusionServiceImplBase {

    private final AccessResponder responder;
    private final MutualExclusion mutualExclusion;

    @Override
    public void requestAccess(AccessRequestMessage request, StreamObserver<AccessResponse> responseObserver) {
        log.debug("Received access request from peer {} with ts {}",
                request.getRequesterId(), request.getLamportTimestamp());

        AccessRequest internalRequest;
        try {
            internalRequest = new AccessRequest(request.getRequesterId(), request.getLamportTimestamp());
        } catch (IllegalArgumentException e) {
            responseObserver.onError(Status.INVALID_ARGUMENT
                    .withDescription(e.getMessage())
                    .asRuntimeException());
            return;
        }

        try {
            var reply = responder.handleAccessRequest(internalRequest);
            responseObserver.onNext(AccessResponse.newBuilder()
                    .setGranterId(reply.granterId())
                    .setAccessGranted(reply.granted())
                    .setRequestTimestamp(reply.requestTimestamp())
                    .setLamportTimestamp(reply.clock())
                    .build());
            responseObserver.onCompleted();
        } catch (ProtocolViolationException e) {
            responseObserver.onError(Status.FAILED_PRECONDITION
                    .withDescription(e.getMessage())
                    .asRuntimeException());
        }
    }

    @Override
    public void releaseAccess(ReleaseMessage request, StreamObserver<ReleaseResponse> responseObserver) {
        log.debug("Received release from peer {} for request ts {}",
                request.getReleaserId(), request.getRequestTimestamp());

        boolean acknowledged = responder.handleReleaseNotice(new ReleaseNotice(
                request.getReleaserId(),
                request.getRequestTimestamp(),
                request.getLamportTimestamp()
        ));

        responseObserver.onNext(ReleaseResponse.newBuilder()
                .setAcknowledged(acknowledged)
                .setLamportTimestamp(responder.clockValue())
                .build());
        responseObserver.onCompleted();
    }

    @Override
    public void getStatus(StatusRequest request, StreamObserver<StatusResponse> responseObserver) {
        var status = mutualExclusion.status();

        responseObserver.onNext(StatusResponse.newBuilder()
                .setPeerId(status.peerId())
                .setState(mapState(status.state()))
                .setLamportClock(status.clock())
                .setRequestTimestamp(status.requestTimestamp())
                .setPendingReplyCount(status.pendingReplyCount())
                .addAllDeferredPeerIds(status.deferredPeerIds())
                .setCompletedJobs(status.completedJobs())
                .build());
        responseObserver.onCompleted();
    }

    private MutexStateProto mapState(MutexState state) {
        return switch (state) {
            case RELEASED -> MutexStateProto.MUTEX_STATE_RELEASED;
            case WANTED -> MutexStateProto.MUTEX_STATE_WANTED;
            case HELD -> MutexStateProto.MUTEX_STATE_HELD;
        };
    }
}
