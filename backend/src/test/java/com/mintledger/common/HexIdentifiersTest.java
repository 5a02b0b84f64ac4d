package com.mintledger.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HexIdentifiersTest {

    @Test
    @DisplayName("Valid EVM address accepted in any case")
    void validAddress() {
        assertThat(HexIdentifiers.isAddress("0x742d35Cc6634C0532925a3b844Bc454e4438f44e")).isTrue();
        assertThat(HexIdentifiers.isAddress("0x0000000000000000000000000000000000000000")).isTrue();
    }

    @Test
    @DisplayName("Invalid address rejected")
    void invalidAddress() {
        assertThat(HexIdentifiers.isAddress(null)).isFalse();
        assertThat(HexIdentifiers.isAddress("")).isFalse();
        assertThat(HexIdentifiers.isAddress("not-an-address")).isFalse();
        assertThat(HexIdentifiers.isAddress("0x123")).isFalse();
        assertThat(HexIdentifiers.isAddress("742d35Cc6634C0532925a3b844Bc454e4438f44e")).isFalse();
        assertThat(HexIdentifiers.isAddress("0xZZ2d35Cc6634C0532925a3b844Bc454e4438f44e")).isFalse();
    }

    @Test
    @DisplayName("Transaction hash must be 0x + 64 hex chars")
    void transactionHash() {
        assertThat(HexIdentifiers.isTransactionHash("0x" + "ab".repeat(32))).isTrue();
        assertThat(HexIdentifiers.isTransactionHash("0x" + "ab".repeat(31))).isFalse();
        assertThat(HexIdentifiers.isTransactionHash("0x742d35Cc6634C0532925a3b844Bc454e4438f44e")).isFalse();
    }

    @Test
    @DisplayName("normalize lowercases and keeps null")
    void normalize() {
        assertThat(HexIdentifiers.normalize("0xABCdef")).isEqualTo("0xabcdef");
        assertThat(HexIdentifiers.normalize(null)).isNull();
    }
}
