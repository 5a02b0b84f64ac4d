package com.mintledger.mint.schema;

import java.time.Instant;

/**
 * Read-side projection of a mint record with derived fields. Never carries userAgent or ipAddress.
 */
public record MintRecordView(
        String id,
        String walletAddress,
        String ipfsCid,
        String metadataUri,
        String tokenId,
        String contractAddress,
        String transactionHash,
        EventDataView eventData,
        Integer networkChainId,
        String imageUrl,
        String status,
        Instant createdAt,
        Instant updatedAt,
        String pinataImageUrl,
        String blockExplorerUrl,
        Long daysAgo
) {

    public record EventDataView(String eventName, Instant mintedAt) {
    }
}
