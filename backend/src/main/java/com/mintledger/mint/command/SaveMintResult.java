package com.mintledger.mint.command;

import com.mintledger.mint.schema.MintRecordView;

/**
 * Saved (or already recorded) mint plus the caller's confirmed-mint count after the write.
 */
public record SaveMintResult(
        MintRecordView record,
        long userTotalMints,
        boolean firstMint,
        boolean alreadyRecorded
) {
}
