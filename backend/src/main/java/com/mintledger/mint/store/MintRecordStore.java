package com.mintledger.mint.store;

import com.mintledger.common.HexIdentifiers;
import com.mintledger.config.CaffeineConfig;
import com.mintledger.domain.EventStatistics;
import com.mintledger.domain.MintRecord;
import com.mintledger.domain.MintRecordRepository;
import com.mintledger.domain.MintStatus;
import com.mintledger.mint.error.DuplicateMintException;
import com.mintledger.mint.error.MintStorageException;
import com.mintledger.mint.schema.MintRecordValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Persistence and queries for mint records. Uniqueness of transactionHash is enforced by the unique index,
 * so two racing inserts of the same hash yield one record and one {@link DuplicateMintException}.
 * Nothing is retried; driver failures surface as {@link MintStorageException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MintRecordStore {

    static final String TRANSACTION_HASH = "transactionHash";
    static final String SAVE_FAILED = "Failed to save NFT";
    static final String FETCH_FAILED = "Failed to fetch NFTs";
    static final String STATS_FAILED = "Failed to fetch event statistics";

    private final MintRecordRepository repository;
    private final MintRecordValidator validator;

    /**
     * Normalizes, validates and inserts a new record.
     *
     * @throws com.mintledger.mint.error.MintValidationException when any field fails its constraint
     * @throws DuplicateMintException when the transaction hash is already recorded
     */
    @CacheEvict(cacheNames = CaffeineConfig.EVENT_STATS_CACHE, allEntries = true)
    public MintRecord insert(MintRecord record) {
        record.normalize();
        validator.validate(record);
        Instant now = Instant.now();
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        try {
            MintRecord saved = repository.insert(record);
            log.debug("Mint recorded: {} for {}", saved.getTransactionHash(), saved.getWalletAddress());
            return saved;
        } catch (DuplicateKeyException e) {
            throw new DuplicateMintException(TRANSACTION_HASH, record.getTransactionHash(), e);
        } catch (DataAccessException e) {
            throw new MintStorageException(SAVE_FAILED, e);
        }
    }

    /**
     * Idempotent write: returns the record already stored under the same transaction hash instead of failing,
     * including when the conflict is only detected by the unique index.
     */
    @CacheEvict(cacheNames = CaffeineConfig.EVENT_STATS_CACHE, allEntries = true)
    public InsertOutcome insertOrGetExisting(MintRecord record) {
        record.normalize();
        validator.validate(record);
        Optional<MintRecord> existing = findByTransactionHash(record.getTransactionHash());
        if (existing.isPresent()) {
            return InsertOutcome.existing(existing.get());
        }
        try {
            return InsertOutcome.created(insert(record));
        } catch (DuplicateMintException e) {
            log.info("Concurrent insert for {}; returning existing record", record.getTransactionHash());
            return findByTransactionHash(record.getTransactionHash())
                    .map(InsertOutcome::existing)
                    .orElseThrow(() -> new MintStorageException(SAVE_FAILED, e));
        }
    }

    public Optional<MintRecord> findByTransactionHash(String transactionHash) {
        String hash = HexIdentifiers.normalize(transactionHash);
        return storageCall(FETCH_FAILED, () -> repository.findByTransactionHash(hash));
    }

    /** Confirmed records only. */
    public long countByOwner(String walletAddress) {
        String owner = HexIdentifiers.normalize(walletAddress);
        return storageCall(FETCH_FAILED, () -> repository.countByWalletAddressAndStatus(owner, MintStatus.CONFIRMED));
    }

    /**
     * Confirmed records of a wallet, newest first, at offset (page - 1) * pageSize.
     */
    public OwnerPage findByOwner(String walletAddress, int page, int pageSize) {
        if (page < 1 || pageSize < 1) {
            throw new IllegalArgumentException("page and pageSize must be positive");
        }
        String owner = HexIdentifiers.normalize(walletAddress);
        long skip = (long) (page - 1) * pageSize;
        return storageCall(FETCH_FAILED, () -> new OwnerPage(
                repository.findPageByWalletAddressAndStatus(owner, MintStatus.CONFIRMED, skip, pageSize),
                repository.countByWalletAddressAndStatus(owner, MintStatus.CONFIRMED)));
    }

    @Cacheable(cacheNames = CaffeineConfig.EVENT_STATS_CACHE)
    public List<EventStatistics> eventStatistics() {
        return storageCall(STATS_FAILED, () -> repository.aggregateEventStatistics(MintStatus.CONFIRMED));
    }

    /**
     * Moves a record to another status. No request flow calls this today.
     */
    @CacheEvict(cacheNames = CaffeineConfig.EVENT_STATS_CACHE, allEntries = true)
    public Optional<MintRecord> updateStatus(String transactionHash, MintStatus status) {
        String hash = HexIdentifiers.normalize(transactionHash);
        Optional<MintRecord> updated = storageCall(SAVE_FAILED,
                () -> repository.updateStatusByTransactionHash(hash, status, Instant.now()));
        updated.ifPresent(r -> log.info("Mint {} status set to {}", hash, status));
        return updated;
    }

    /**
     * Connectivity check for health reporting; never throws.
     */
    public boolean isAvailable() {
        try {
            return repository.ping();
        } catch (DataAccessException e) {
            log.warn("Mongo ping failed: {}", e.getMessage());
            return false;
        }
    }

    private static <T> T storageCall(String failureMessage, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new MintStorageException(failureMessage, e);
        }
    }
}
