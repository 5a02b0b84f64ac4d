package com.mintledger.api.dto;

import java.time.Instant;

/**
 * GET /api/health response. database is "connected" or "disconnected"; uptime in seconds.
 */
public record HealthResponse(String status, String database, Instant timestamp, double uptime) {
}
