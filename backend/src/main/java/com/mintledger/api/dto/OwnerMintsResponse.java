package com.mintledger.api.dto;

import com.mintledger.mint.schema.MintRecordView;

import java.time.Instant;
import java.util.List;

/**
 * GET /api/nfts/{walletAddress} response.
 */
public record OwnerMintsResponse(boolean success, Data data) {

    public record Data(List<MintRecordView> nfts, Pagination pagination, Meta meta) {}

    public record Pagination(
            int currentPage,
            int totalPages,
            long totalCount,
            boolean hasNextPage,
            boolean hasPrevPage,
            int limit
    ) {}

    public record Meta(String walletAddress, Instant firstNFTDate, Instant latestNFTDate) {}
}
