/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.printer.grpc;

import com.geastalt.mutex.grpc.generated.PrintRequest;
import com.geastalt.mutex.grpc.generated.PrintResponse;
import com.geastalt.mutex.grpc.generated.PrintingServiceGrpc;
import com.geastalt.printer.service.PrintJob;
import com.geastalt.printer.service.PrintJobService;
import io.grpc.stub.StreamObserver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.devh.boot.grpc.server.service.GrpcService;

/**
 * gRPC service accepting print jobs from the peers.
 */
@Slf4j
@GrpcService
@RequiredArgsConstructor
public class PrintingGrpcService extends PrintingServiceGrpc.PrintingServiceImplBase {

    private final PrintJobService printJobService;

    @Override
    public void sendToPrinter(PrintRequest request, StreamObserver<PrintResponse> responseObserver) {
        log.debug("gRPC SendToPrinter: clientId={}, request={}, ts={}",
                request.getClientId(), request.getRequestNumber(), request.getLamportTimestamp());

        var outcome = printJobService.print(new PrintJob(
                request.getClientId(),
                request.getMessageContent(),
                request.getLamportTimestamp(),
                request.getRequestNumber()
        ));

        responseObserver.onNext(PrintResponse.newBuilder()
                .setSuccess(outcome.success())
                .setConfirmationMessage(outcome.confirmation())
                .setLamportTimestamp(outcome.clock())
                .build());
        responseObserver.onCompleted();
    }
}
