package com.mintledger.mint.schema;

import com.mintledger.common.IpfsIdentifiers;
import com.mintledger.domain.ChainNetwork;
import com.mintledger.domain.MintRecord;

import java.time.Duration;
import java.time.Instant;

/**
 * Derives read-time fields from a stored record: gateway URL, explorer URL and whole days since mint.
 */
public final class MintRecordViews {

    private static final long SECONDS_PER_DAY = Duration.ofDays(1).getSeconds();

    private MintRecordViews() {
    }

    public static MintRecordView enrich(MintRecord record, Instant now) {
        MintRecord.EventData eventData = record.getEventData();
        Instant mintedAt = eventData != null ? eventData.getMintedAt() : null;
        return new MintRecordView(
                record.getId(),
                record.getWalletAddress(),
                record.getIpfsCid(),
                record.getMetadataUri(),
                record.getTokenId(),
                record.getContractAddress(),
                record.getTransactionHash(),
                eventData != null ? new MintRecordView.EventDataView(eventData.getEventName(), mintedAt) : null,
                record.getNetworkChainId(),
                record.getImageUrl(),
                record.getStatus() != null ? record.getStatus().value() : null,
                record.getCreatedAt(),
                record.getUpdatedAt(),
                IpfsIdentifiers.gatewayUrl(record.getIpfsCid()),
                ChainNetwork.explorerTxUrl(record.getNetworkChainId(), record.getTransactionHash()),
                daysSince(mintedAt, now)
        );
    }

    /**
     * Floor of elapsed whole days; negative for timestamps in the future, null when unknown.
     */
    static Long daysSince(Instant mintedAt, Instant now) {
        if (mintedAt == null) return null;
        return Math.floorDiv(Duration.between(mintedAt, now).getSeconds(), SECONDS_PER_DAY);
    }
}
