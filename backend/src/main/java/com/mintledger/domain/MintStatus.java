package com.mintledger.domain;

import java.util.Locale;

/**
 * Lifecycle of a mint claim. Records are created CONFIRMED; only CONFIRMED records are visible to readers.
 * Stored in MongoDB by its lowercase {@link #value()}.
 */
public enum MintStatus {
    PENDING,
    CONFIRMED,
    FAILED;

    /** Stored and wire form: "pending", "confirmed", "failed". */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive, so documents written with the enum name still read.
     *
     * @throws IllegalArgumentException for an unknown value
     */
    public static MintStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Mint status is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
