package com.mintledger.api.dto;

import java.time.Instant;

/**
 * POST /api/nfts request body. Presence and format are checked by SaveMintService, not here,
 * so that every missing field is reported at once.
 */
public record SaveMintRequest(
        String walletAddress,
        String ipfsCid,
        String metadataUri,
        String tokenId,
        String contractAddress,
        String transactionHash,
        EventDataRequest eventData,
        Integer networkChainId
) {

    public record EventDataRequest(String eventName, Instant mintedAt) {
    }
}
