package com.mintledger.domain;

import java.time.Instant;

/**
 * Valid sample values and records shared by tests.
 */
public final class MintRecordFixtures {

    public static final String WALLET = "0x742d35Cc6634C0532925a3b844Bc454e4438f44e";
    public static final String OTHER_WALLET = "0xd8dA6BF26964aF9D7eEd9e03E53415D37aA96045";
    public static final String CONTRACT = "0x4200000000000000000000000000000000000006";
    public static final String CID = "QmYwAPJzv5CZsnA625s3Xf2nemtYgPpHdWEz79ojWnPbdG";
    public static final String METADATA_URI = "ipfs://" + CID;
    public static final String TX_HASH = "0x5C504ED432CB51138BCF09AA5E8A410DD4A1E204EF84BFED1BE16DFBA1B22060";
    public static final Instant MINTED_AT = Instant.parse("2025-07-01T10:00:00Z");

    private MintRecordFixtures() {
    }

    /** Deterministic distinct 32-byte hash for index i. */
    public static String txHash(int i) {
        return String.format("0x%064x", i + 1);
    }

    public static MintRecord record(String wallet, String txHash) {
        MintRecord record = new MintRecord();
        record.setWalletAddress(wallet);
        record.setIpfsCid(CID);
        record.setMetadataUri(METADATA_URI);
        record.setTokenId("1");
        record.setContractAddress(CONTRACT);
        record.setTransactionHash(txHash);
        record.setEventData(new MintRecord.EventData(MintEvent.DEFAULT.displayName(), MINTED_AT));
        record.setImageUrl("https://gateway.pinata.cloud/ipfs/" + CID);
        return record;
    }

    public static MintRecord record() {
        return record(WALLET, TX_HASH);
    }
}
