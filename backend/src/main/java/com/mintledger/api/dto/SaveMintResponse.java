package com.mintledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mintledger.mint.schema.MintRecordView;

/**
 * POST /api/nfts response: 201 when created, 200 when the transaction was already recorded.
 */
public record SaveMintResponse(boolean success, String message, MintRecordView data, Meta meta) {

    public record Meta(
            long userTotalNFTs,
            @JsonProperty("isFirstNFT") boolean isFirstNFT,
            boolean alreadyRecorded
    ) {}
}
