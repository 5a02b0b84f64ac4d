package com.mintledger.domain;

import java.util.Arrays;

/**
 * Events a mint can be attributed to. Stored by display name.
 */
public enum MintEvent {
    ONCHAIN_SUMMER_LAGOS("Onchain Summer Lagos");

    public static final MintEvent DEFAULT = ONCHAIN_SUMMER_LAGOS;

    private final String displayName;

    MintEvent(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public static boolean isKnown(String displayName) {
        return Arrays.stream(values()).anyMatch(e -> e.displayName.equals(displayName));
    }
}
