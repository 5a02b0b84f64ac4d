package com.mintledger.mint.command;

import java.time.Instant;

/**
 * Inbound mint claim. Optional: eventName, mintedAt, networkChainId, userAgent, ipAddress.
 */
public record SaveMintCommand(
        String walletAddress,
        String ipfsCid,
        String metadataUri,
        String tokenId,
        String contractAddress,
        String transactionHash,
        String eventName,
        Instant mintedAt,
        Integer networkChainId,
        String userAgent,
        String ipAddress
) {
}
