package com.mintledger.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MintStatusTest {

    @Test
    @DisplayName("value is the lowercase name; fromValue accepts either case")
    void valueRoundTrip() {
        assertThat(MintStatus.CONFIRMED.value()).isEqualTo("confirmed");
        assertThat(MintStatus.fromValue("failed")).isEqualTo(MintStatus.FAILED);
        assertThat(MintStatus.fromValue(" Pending ")).isEqualTo(MintStatus.PENDING);
    }

    @Test
    @DisplayName("unknown or missing values are rejected")
    void rejectsUnknown() {
        assertThatThrownBy(() -> MintStatus.fromValue("minted")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MintStatus.fromValue(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
