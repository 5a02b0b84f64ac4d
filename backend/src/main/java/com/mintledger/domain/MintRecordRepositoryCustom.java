package com.mintledger.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * MongoTemplate-backed queries for the nfts collection.
 */
public interface MintRecordRepositoryCustom {

    /**
     * One page of a wallet's records with the given status, newest first, without analytics fields.
     */
    List<MintRecord> findPageByWalletAddressAndStatus(String walletAddress, MintStatus status, long skip, int limit);

    /** Per-event totals over records with the given status, ordered by event name. */
    List<EventStatistics> aggregateEventStatistics(MintStatus status);

    /** Sets status and updatedAt atomically; returns the updated document. */
    Optional<MintRecord> updateStatusByTransactionHash(String transactionHash, MintStatus status, Instant updatedAt);

    /** True when the server answers a ping. */
    boolean ping();
}
