package com.mintledger.mint.query;

import com.mintledger.domain.EventStatistics;

import java.util.List;

/**
 * Per-event breakdown plus grand totals. totalUniqueUsers sums per-event unique owners.
 */
public record EventStatsSummary(long totalMints, long totalUniqueUsers, List<EventStatistics> events) {
}
