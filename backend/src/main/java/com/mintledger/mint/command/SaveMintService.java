package com.mintledger.mint.command;

import com.mintledger.common.IpfsIdentifiers;
import com.mintledger.domain.MintEvent;
import com.mintledger.domain.MintRecord;
import com.mintledger.mint.error.MissingFieldsException;
import com.mintledger.mint.schema.MintRecordViews;
import com.mintledger.mint.store.InsertOutcome;
import com.mintledger.mint.store.MintRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records a mint claim. A claim for an already recorded transaction hash returns the stored record.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SaveMintService {

    public static final List<String> REQUIRED_FIELDS = List.of(
            "walletAddress", "ipfsCid", "metadataUri", "tokenId", "contractAddress", "transactionHash");

    private final MintRecordStore store;

    /**
     * @throws MissingFieldsException if any required field is absent or blank
     * @throws com.mintledger.mint.error.MintValidationException if a present field has the wrong format
     */
    public SaveMintResult save(SaveMintCommand command) {
        requirePresent(command);

        InsertOutcome outcome = store.insertOrGetExisting(toRecord(command, Instant.now()));
        MintRecord record = outcome.record();
        long userTotal = store.countByOwner(command.walletAddress());
        if (outcome.created()) {
            log.info("NFT saved: {} token {} for {} (total {})",
                    record.getTransactionHash(), record.getTokenId(), record.getWalletAddress(), userTotal);
        } else {
            log.info("NFT already recorded: {}", record.getTransactionHash());
        }
        return new SaveMintResult(
                MintRecordViews.enrich(record, Instant.now()),
                userTotal,
                userTotal == 1,
                !outcome.created());
    }

    static MintRecord toRecord(SaveMintCommand command, Instant now) {
        MintRecord record = new MintRecord();
        record.setWalletAddress(command.walletAddress());
        record.setIpfsCid(command.ipfsCid());
        record.setMetadataUri(command.metadataUri());
        record.setTokenId(command.tokenId());
        record.setContractAddress(command.contractAddress());
        record.setTransactionHash(command.transactionHash());
        record.setEventData(new MintRecord.EventData(
                command.eventName() != null && !command.eventName().isBlank()
                        ? command.eventName()
                        : MintEvent.DEFAULT.displayName(),
                command.mintedAt() != null ? command.mintedAt() : now));
        if (command.networkChainId() != null) {
            record.setNetworkChainId(command.networkChainId());
        }
        if (IpfsIdentifiers.isCid(command.ipfsCid())) {
            record.setImageUrl(IpfsIdentifiers.gatewayUrl(command.ipfsCid()));
        }
        record.setUserAgent(command.userAgent());
        record.setIpAddress(command.ipAddress());
        return record;
    }

    private static void requirePresent(SaveMintCommand command) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("walletAddress", command.walletAddress());
        values.put("ipfsCid", command.ipfsCid());
        values.put("metadataUri", command.metadataUri());
        values.put("tokenId", command.tokenId());
        values.put("contractAddress", command.contractAddress());
        values.put("transactionHash", command.transactionHash());
        List<String> missing = new ArrayList<>();
        values.forEach((field, value) -> {
            if (value == null || value.isBlank()) missing.add(field);
        });
        if (!missing.isEmpty()) {
            throw new MissingFieldsException(missing, REQUIRED_FIELDS);
        }
    }
}
