/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.config;

import com.geastalt.mutex.model.PeerRecord;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration of the peer group taking part in mutual exclusion.
 */
@Slf4j
@Configuration
@ConfigurationProperties(prefix = "mutex.peer")
@Getter
@Setter
public class PeerConfig {

    private int peerId;

    /**
     * Deadline for a single peer-to-peer call.
     */
    private long callTimeoutMs = 5000;

    /**
     * How long a local caller waits for all replies. Zero or less waits forever.
     */
    private long acquireTimeoutMs = 0;

    private int outboundThreads = 4;

    /**
     * Comma-separated list of every peer, this one included, in format: peerId:host:port,...
     * Example: 1:localhost:50052,2:localhost:50053,3:localhost:50054
     */
    private String peers;

    /**
     * Returns every configured peer, self included, ordered by id.
     */
    public List<PeerRecord> getAllPeers() {
        Map<Integer, PeerRecord> byId = new LinkedHashMap<>();

        if (peers != null && !peers.isBlank()) {
            for (String peerSpec : peers.split(",")) {
                String trimmed = peerSpec.trim();
                if (trimmed.isEmpty()) continue;

                String[] parts = trimmed.split(":");
                if (parts.length != 3) {
                    log.warn("Invalid peer spec '{}' - expected format: peerId:host:port", trimmed);
                    continue;
                }
                try {
                    var peer = new PeerRecord(
                            Integer.parseInt(parts[0].trim()),
                            parts[1].trim(),
                            Integer.parseInt(parts[2].trim())
                    );
                    if (byId.putIfAbsent(peer.peerId(), peer) != null) {
                        log.warn("Duplicate peer id {} in spec '{}' - keeping first entry", peer.peerId(), trimmed);
                    }
                } catch (IllegalArgumentException e) {
                    log.warn("Invalid peer spec '{}': {}", trimmed, e.getMessage());
                }
            }
        }

        return byId.values().stream()
                .sorted((a, b) -> Integer.compare(a.peerId(), b.peerId()))
                .toList();
    }

    /**
     * Returns the peers other than this one.
     */
    public List<PeerRecord> getOtherPeers() {
        return getAllPeers().stream()
                .filter(peer -> peer.peerId() != peerId)
                .toList();
    }

    public Optional<PeerRecord> getSelf() {
        return getAllPeers().stream()
                .filter(peer -> peer.peerId() == peerId)
                .findFirst();
    }

    /**
     * Fails fast on a configuration the protocol cannot run with.
     */
    public void validate() {
        if (peerId <= 0) {
            throw new IllegalStateException("mutex.peer.peer-id must be a positive integer");
        }
        if (getSelf().isEmpty()) {
            var ids = new ArrayList<Integer>();
            getAllPeers().forEach(peer -> ids.add(peer.peerId()));
            throw new IllegalStateException("Peer " + peerId + " is not part of the configured peer set " + ids);
        }
        if (outboundThreads <= 0) {
            throw new IllegalStateException("mutex.peer.outbound-threads must be positive");
        }
    }
}
