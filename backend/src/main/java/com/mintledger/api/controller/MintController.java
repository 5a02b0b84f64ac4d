package com.mintledger.api.controller;

import com.mintledger.api.dto.EventStatsResponse;
import com.mintledger.api.dto.OwnerMintsResponse;
import com.mintledger.api.dto.SaveMintRequest;
import com.mintledger.api.dto.SaveMintResponse;
import com.mintledger.api.filter.ClientAddresses;
import com.mintledger.mint.command.SaveMintCommand;
import com.mintledger.mint.command.SaveMintResult;
import com.mintledger.mint.command.SaveMintService;
import com.mintledger.mint.query.EventStatsSummary;
import com.mintledger.mint.query.MintQueryService;
import com.mintledger.mint.query.OwnerMintsPage;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * POST /api/nfts, GET /api/nfts/{walletAddress}, GET /api/nfts/stats/event.
 */
@RestController
@RequestMapping("/api/nfts")
@RequiredArgsConstructor
public class MintController {

    private final SaveMintService saveMintService;
    private final MintQueryService mintQueryService;

    @PostMapping
    public ResponseEntity<SaveMintResponse> saveMint(@RequestBody SaveMintRequest request, ServerHttpRequest httpRequest) {
        SaveMintRequest.EventDataRequest eventData = request.eventData();
        SaveMintResult result = saveMintService.save(new SaveMintCommand(
                request.walletAddress(),
                request.ipfsCid(),
                request.metadataUri(),
                request.tokenId(),
                request.contractAddress(),
                request.transactionHash(),
                eventData != null ? eventData.eventName() : null,
                eventData != null ? eventData.mintedAt() : null,
                request.networkChainId(),
                httpRequest.getHeaders().getFirst(HttpHeaders.USER_AGENT),
                ClientAddresses.of(httpRequest)));

        SaveMintResponse.Meta meta = new SaveMintResponse.Meta(
                result.userTotalMints(), result.firstMint(), result.alreadyRecorded());
        if (result.alreadyRecorded()) {
            return ResponseEntity.ok(new SaveMintResponse(true, "NFT already recorded", result.record(), meta));
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new SaveMintResponse(true, "NFT saved successfully", result.record(), meta));
    }

    @GetMapping("/{walletAddress}")
    public ResponseEntity<OwnerMintsResponse> getOwnerMints(
            @PathVariable String walletAddress,
            @RequestParam(required = false) String page,
            @RequestParam(required = false) String limit
    ) {
        OwnerMintsPage result = mintQueryService.listByOwner(walletAddress, parseOrNull(page), parseOrNull(limit));
        return ResponseEntity.ok(new OwnerMintsResponse(true, new OwnerMintsResponse.Data(
                result.records(),
                new OwnerMintsResponse.Pagination(
                        result.currentPage(),
                        result.totalPages(),
                        result.totalCount(),
                        result.hasNextPage(),
                        result.hasPrevPage(),
                        result.pageSize()),
                new OwnerMintsResponse.Meta(
                        result.walletAddress(),
                        result.firstMintDate(),
                        result.latestMintDate()))));
    }

    @GetMapping("/stats/event")
    public ResponseEntity<EventStatsResponse> getEventStats() {
        EventStatsSummary summary = mintQueryService.eventStatistics();
        return ResponseEntity.ok(new EventStatsResponse(true, new EventStatsResponse.Data(
                summary.totalMints(),
                summary.totalUniqueUsers(),
                summary.events().stream()
                        .map(e -> new EventStatsResponse.EventEntry(
                                e.eventName(),
                                e.totalMints(),
                                e.uniqueOwnerCount(),
                                e.firstMint(),
                                e.lastMint()))
                        .toList()),
                Instant.now()));
    }

    /** Lenient integer parsing: anything non-numeric falls back to the service default. */
    private static Integer parseOrNull(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
