package com.mintledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for the nfts collection.
 */
public interface MintRecordRepository extends MongoRepository<MintRecord, String>, MintRecordRepositoryCustom {

    Optional<MintRecord> findByTransactionHash(String transactionHash);

    long countByWalletAddressAndStatus(String walletAddress, MintStatus status);
}
