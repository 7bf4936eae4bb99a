/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.resource;

import com.geastalt.mutex.config.ResourceConfig;
import com.geastalt.mutex.grpc.generated.PrintRequest;
import com.geastalt.mutex.grpc.generated.PrintingServiceGrpc;
import com.geastalt.mutex.model.ResourceException;
import com.geastalt.mutex.model.WorkItem;
import com.geastalt.mutex.model.WorkReceipt;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * gRPC client for the print server, the resource guarded by the mutual exclusion protocol.
 */
@Slf4j
@Component
public class GrpcPrintClient implements ResourceClient {

    private final ManagedChannel channel;
    private final PrintingServiceGrpc.PrintingServiceBlockingStub stub;
    private final long callTimeoutMs;

    @Autowired
    public GrpcPrintClient(ResourceConfig config) {
        this(ManagedChannelBuilder.forAddress(config.getHost(), config.getPort())
                .usePlaintext()
                .keepAliveTime(30, TimeUnit.SECONDS)
                .build(), config.getCallTimeoutMs());
        log.info("Created print client for {}", config.getAddress());
    }

    public GrpcPrintClient(ManagedChannel channel, long callTimeoutMs) {
        this.channel = channel;
        this.stub = PrintingServiceGrpc.newBlockingStub(channel);
        this.callTimeoutMs = callTimeoutMs;
    }

    @Override
    public WorkReceipt submitWork(WorkItem item) {
        try {
            var request = PrintRequest.newBuilder()
                    .setClientId(item.clientId())
                    .setMessageContent(item.payload())
                    .setLamportTimestamp(item.timestamp())
                    .setRequestNumber(item.requestNumber())
                    .build();

            var response = stub
                    .withDeadlineAfter(callTimeoutMs, TimeUnit.MILLISECONDS)
                    .sendToPrinter(request);

            if (!response.getSuccess()) {
                throw new ResourceException("Print server rejected job #" + item.requestNumber()
                        + ": " + response.getConfirmationMessage());
            }
            return new WorkReceipt(response.getConfirmationMessage(), response.getLamportTimestamp());
        } catch (StatusRuntimeException e) {
            log.error("gRPC error sending job #{} to print server: {}", item.requestNumber(), e.getStatus());
            throw new ResourceException("Print server call failed: " + e.getStatus(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        try {
            channel.shutdown().awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            channel.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
