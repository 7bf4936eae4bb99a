/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.resource;

import com.geastalt.mutex.grpc.generated.PrintRequest;
import com.geastalt.mutex.grpc.generated.PrintResponse;
import com.geastalt.mutex.grpc.generated.PrintingServiceGrpc;
import com.geastalt.mutex.model.ResourceException;
import com.geastalt.mutex.model.WorkItem;
import io.grpc.Server;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.StreamObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GrpcPrintClient against an in-process print server.
 */
class GrpcPrintClientTest {

    private final List<PrintRequest> printed = new CopyOnWriteArrayList<>();
    private volatile boolean jammed;
    private Server server;
    private GrpcPrintClient client;

    @BeforeEach
    void setUp() throws Exception {
        var serverName = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(serverName)
                .directExecutor()
                .addService(new PrintingServiceGrpc.PrintingServiceImplBase() {
                    @Override
                    public void sendToPrinter(PrintRequest request, StreamObserver<PrintResponse> observer) {
                        printed.add(request);
                        observer.onNext(PrintResponse.newBuilder()
                                .setSuccess(!jammed)
                                .setConfirmationMessage(jammed
                                        ? "Paper jam"
                                        : "Print completed for client " + request.getClientId())
                                .setLamportTimestamp(request.getLamportTimestamp() + 1)
                                .build());
                        observer.onCompleted();
                    }
                })
                .build()
                .start();
        client = new GrpcPrintClient(InProcessChannelBuilder.forName(serverName).directExecutor().build(), 2000);
    }

    @AfterEach
    void tearDown() throws Exception {
        client.shutdown();
        server.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Should send the job and return the server's confirmation")
    void shouldSendJobAndReturnConfirmation() {
        var receipt = client.submitWork(new WorkItem(2, "Sales proposal", 3, 17));

        assertEquals("Print completed for client 2", receipt.confirmation());
        assertEquals(18, receipt.clock());
        assertEquals(1, printed.size());
        var request = printed.get(0);
        assertEquals(2, request.getClientId());
        assertEquals("Sales proposal", request.getMessageContent());
        assertEquals(17, request.getLamportTimestamp());
        assertEquals(3, request.getRequestNumber());
    }

    @Test
    @DisplayName("Should fail when the server reports an unsuccessful print")
    void shouldFailOnUnsuccessfulPrint() {
        jammed = true;

        var e = assertThrows(ResourceException.class,
                () -> client.submitWork(new WorkItem(1, "Instruction manual", 1, 4)));
        assertTrue(e.getMessage().contains("Paper jam"));
    }

    @Test
    @DisplayName("Should fail when the server cannot be reached")
    void shouldFailWhenServerUnreachable() {
        var unreachable = new GrpcPrintClient(
                InProcessChannelBuilder.forName("no-printer-here").directExecutor().build(), 500);
        try {
            var e = assertThrows(ResourceException.class,
                    () -> unreachable.submitWork(new WorkItem(1, "Instruction manual", 1, 4)));
            assertNotNull(e.getCause());
        } finally {
            unreachable.shutdown();
        }
    }
}
