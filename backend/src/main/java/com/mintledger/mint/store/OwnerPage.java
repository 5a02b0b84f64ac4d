package com.mintledger.mint.store;

import com.mintledger.domain.MintRecord;

import java.util.List;

/**
 * One page of a wallet's confirmed records plus the wallet's total confirmed count.
 */
public record OwnerPage(List<MintRecord> records, long totalCount) {
}
