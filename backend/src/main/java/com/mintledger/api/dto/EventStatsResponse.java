package com.mintledger.api.dto;

import java.time.Instant;
import java.util.List;

/**
 * GET /api/nfts/stats/event response.
 */
public record EventStatsResponse(boolean success, Data data, Instant timestamp) {

    public record Data(long totalMints, long totalUniqueUsers, List<EventEntry> events) {}

    public record EventEntry(
            String eventName,
            long totalMints,
            long uniqueUserCount,
            Instant firstMint,
            Instant lastMint
    ) {}
}
