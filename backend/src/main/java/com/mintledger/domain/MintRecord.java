package com.mintledger.domain;

import com.mintledger.common.HexIdentifiers;
import com.mintledger.common.IpfsIdentifiers;
import com.mintledger.domain.validation.EvmAddress;
import com.mintledger.domain.validation.KnownEvent;
import com.mintledger.domain.validation.PlausibleMintTime;
import com.mintledger.domain.validation.SupportedChain;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One claimed NFT mint. Identity is the transaction hash (unique index).
 * Addresses and hash are stored lowercase; see {@link #normalize()}.
 */
@Document(collection = "nfts")
@CompoundIndexes({
    @CompoundIndex(name = "wallet_created", def = "{'walletAddress': 1, 'createdAt': -1}"),
    @CompoundIndex(name = "event_created", def = "{'eventData.eventName': 1, 'createdAt': -1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class MintRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;

    @NotBlank(message = "Wallet address is required")
    @EvmAddress(message = "Invalid Ethereum address format")
    @Indexed(name = "wallet_address")
    private String walletAddress;

    @NotBlank(message = "IPFS CID is required")
    @Pattern(regexp = IpfsIdentifiers.CID_REGEX, message = "Invalid IPFS CID format")
    private String ipfsCid;

    @NotBlank(message = "Metadata URI is required")
    @Pattern(regexp = IpfsIdentifiers.URI_REGEX, message = "Invalid IPFS URI format")
    private String metadataUri;

    @NotBlank(message = "Token ID is required")
    private String tokenId;

    @NotBlank(message = "Contract address is required")
    @EvmAddress(message = "Invalid contract address format")
    private String contractAddress;

    @NotBlank(message = "Transaction hash is required")
    @Pattern(regexp = HexIdentifiers.TX_HASH_REGEX, message = "Invalid transaction hash format")
    @Indexed(name = "transaction_hash_uniq", unique = true)
    private String transactionHash;

    @Valid
    @NotNull(message = "Event data is required")
    private EventData eventData = new EventData();

    @SupportedChain
    @Indexed(name = "network_chain_id")
    private Integer networkChainId = ChainNetwork.PRIMARY.chainId();

    @Pattern(regexp = IpfsIdentifiers.GATEWAY_URL_REGEX, message = "Invalid Pinata image URL format")
    private String imageUrl;

    @NotNull(message = "Status is required")
    private MintStatus status = MintStatus.CONFIRMED;

    /** Analytics only; never returned to readers. */
    private String userAgent;
    /** Analytics only; never returned to readers. */
    private String ipAddress;

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Lowercases wallet address, contract address and transaction hash in place.
     */
    public MintRecord normalize() {
        walletAddress = HexIdentifiers.normalize(walletAddress);
        contractAddress = HexIdentifiers.normalize(contractAddress);
        transactionHash = HexIdentifiers.normalize(transactionHash);
        return this;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class EventData {

        @NotBlank(message = "Event name is required")
        @KnownEvent
        private String eventName = MintEvent.DEFAULT.displayName();

        @NotNull(message = "Mint timestamp is required")
        @PlausibleMintTime
        private Instant mintedAt;

        public EventData(String eventName, Instant mintedAt) {
            this.eventName = eventName;
            this.mintedAt = mintedAt;
        }
    }
}
