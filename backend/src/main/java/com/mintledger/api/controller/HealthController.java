package com.mintledger.api.controller;

import com.mintledger.api.dto.HealthResponse;
import com.mintledger.api.dto.ServiceInfoResponse;
import com.mintledger.mint.store.MintRecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GET /api/health (liveness plus store connectivity) and GET / (service banner).
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final MintRecordStore mintRecordStore;

    @GetMapping("/api/health")
    public ResponseEntity<HealthResponse> health() {
        double uptimeSeconds = ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0;
        return ResponseEntity.ok(new HealthResponse(
                "healthy",
                mintRecordStore.isAvailable() ? "connected" : "disconnected",
                Instant.now(),
                uptimeSeconds));
    }

    @GetMapping("/")
    public ResponseEntity<ServiceInfoResponse> info() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("POST /api/nfts", "Save minted NFT data");
        endpoints.put("GET /api/nfts/:walletAddress", "Get user NFTs");
        endpoints.put("GET /api/nfts/stats/event", "Get event statistics");
        endpoints.put("GET /api/health", "Health check");
        return ResponseEntity.ok(new ServiceInfoResponse("Onchain Summer Lagos Backend API", "running", Instant.now(), endpoints));
    }
}
