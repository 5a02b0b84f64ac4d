package com.mintledger.mint.store;

import com.mintledger.domain.MintRecord;

/**
 * Result of {@link MintRecordStore#insertOrGetExisting}: the stored record and whether this call created it.
 */
public record InsertOutcome(MintRecord record, boolean created) {

    public static InsertOutcome created(MintRecord record) {
        return new InsertOutcome(record, true);
    }

    public static InsertOutcome existing(MintRecord record) {
        return new InsertOutcome(record, false);
    }
}
