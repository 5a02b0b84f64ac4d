package com.mintledger.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Chains a mint may be recorded for. BASE_MAINNET is the primary chain.
 */
public enum ChainNetwork {
    BASE_MAINNET(8453, "https://basescan.org/tx/"),
    BASE_SEPOLIA(84532, "https://sepolia.basescan.org/tx/");

    public static final ChainNetwork PRIMARY = BASE_MAINNET;

    private final int chainId;
    private final String explorerTxBaseUrl;

    ChainNetwork(int chainId, String explorerTxBaseUrl) {
        this.chainId = chainId;
        this.explorerTxBaseUrl = explorerTxBaseUrl;
    }

    public int chainId() {
        return chainId;
    }

    public String explorerTxBaseUrl() {
        return explorerTxBaseUrl;
    }

    public static Optional<ChainNetwork> fromChainId(Integer chainId) {
        if (chainId == null) return Optional.empty();
        return Arrays.stream(values()).filter(n -> n.chainId == chainId).findFirst();
    }

    /**
     * Explorer link for a transaction. Anything that is not the primary chain resolves to the testnet explorer.
     */
    public static String explorerTxUrl(Integer chainId, String transactionHash) {
        ChainNetwork network = chainId != null && chainId == PRIMARY.chainId ? PRIMARY : BASE_SEPOLIA;
        return network.explorerTxBaseUrl + transactionHash;
    }
}
