package com.mintledger.api.dto;

import java.time.Instant;
import java.util.Map;

/**
 * GET / banner.
 */
public record ServiceInfoResponse(String message, String status, Instant timestamp, Map<String, String> endpoints) {
}
