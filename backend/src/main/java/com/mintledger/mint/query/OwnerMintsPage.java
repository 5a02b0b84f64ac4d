package com.mintledger.mint.query;

import com.mintledger.mint.schema.MintRecordView;

import java.time.Instant;
import java.util.List;

/**
 * Page of a wallet's confirmed mints with pagination and summary metadata.
 * firstMintDate / latestMintDate span the returned page only.
 */
public record OwnerMintsPage(
        String walletAddress,
        List<MintRecordView> records,
        int currentPage,
        int totalPages,
        long totalCount,
        boolean hasNextPage,
        boolean hasPrevPage,
        int pageSize,
        Instant firstMintDate,
        Instant latestMintDate
) {
}
