package com.mintledger.mint.query;

import com.mintledger.common.HexIdentifiers;
import com.mintledger.config.ApiProperties;
import com.mintledger.domain.EventStatistics;
import com.mintledger.domain.MintRecord;
import com.mintledger.mint.error.InvalidFormatException;
import com.mintledger.mint.schema.MintRecordView;
import com.mintledger.mint.schema.MintRecordViews;
import com.mintledger.mint.store.MintRecordStore;
import com.mintledger.mint.store.OwnerPage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Read-only lookups over CONFIRMED mint records.
 */
@Service
@RequiredArgsConstructor
public class MintQueryService {

    private static final int DEFAULT_PAGE = 1;

    private final MintRecordStore store;
    private final ApiProperties apiProperties;

    /**
     * @param page  1-based; null or non-positive means 1
     * @param limit page size; null or non-positive means the default, capped at the configured maximum
     * @throws InvalidFormatException if the address is not 0x + 40 hex chars (checked before any store access)
     */
    public OwnerMintsPage listByOwner(String walletAddress, Integer page, Integer limit) {
        if (!HexIdentifiers.isAddress(walletAddress)) {
            throw new InvalidFormatException("walletAddress", "Invalid wallet address format");
        }
        int currentPage = page == null || page < 1 ? DEFAULT_PAGE : page;
        int pageSize = resolvePageSize(limit);

        OwnerPage ownerPage = store.findByOwner(walletAddress, currentPage, pageSize);
        Instant now = Instant.now();
        List<MintRecordView> views = ownerPage.records().stream()
                .map(r -> MintRecordViews.enrich(r, now))
                .toList();
        int totalPages = (int) ((ownerPage.totalCount() + pageSize - 1) / pageSize);

        List<Instant> mintTimes = ownerPage.records().stream()
                .map(MintRecord::getEventData)
                .filter(Objects::nonNull)
                .map(MintRecord.EventData::getMintedAt)
                .filter(Objects::nonNull)
                .toList();
        return new OwnerMintsPage(
                HexIdentifiers.normalize(walletAddress),
                views,
                currentPage,
                totalPages,
                ownerPage.totalCount(),
                currentPage < totalPages,
                currentPage > 1,
                pageSize,
                mintTimes.stream().min(Comparator.naturalOrder()).orElse(null),
                mintTimes.stream().max(Comparator.naturalOrder()).orElse(null));
    }

    public EventStatsSummary eventStatistics() {
        List<EventStatistics> events = store.eventStatistics();
        long totalMints = events.stream().mapToLong(EventStatistics::totalMints).sum();
        long totalUniqueUsers = events.stream().mapToLong(EventStatistics::uniqueOwnerCount).sum();
        return new EventStatsSummary(totalMints, totalUniqueUsers, events);
    }

    private int resolvePageSize(Integer limit) {
        int max = Math.max(1, apiProperties.getMaxPageSize());
        if (limit == null || limit < 1) {
            return Math.min(Math.max(1, apiProperties.getDefaultPageSize()), max);
        }
        return Math.min(limit, max);
    }
}
