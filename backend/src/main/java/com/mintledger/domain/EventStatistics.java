package com.mintledger.domain;

import java.time.Instant;

/**
 * Aggregate over CONFIRMED mints of one event.
 */
public record EventStatistics(
        String eventName,
        long totalMints,
        long uniqueOwnerCount,
        Instant firstMint,
        Instant lastMint
) {
}
