package com.mintledger.common;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * EVM address and transaction hash formats. Comparison is case-insensitive; storage is lowercase.
 */
public final class HexIdentifiers {

    public static final String ADDRESS_REGEX = "^0x[a-fA-F0-9]{40}$";
    public static final String TX_HASH_REGEX = "^0x[a-fA-F0-9]{64}$";

    private static final Pattern ADDRESS = Pattern.compile(ADDRESS_REGEX);
    private static final Pattern TX_HASH = Pattern.compile(TX_HASH_REGEX);

    private HexIdentifiers() {
    }

    public static boolean isAddress(String value) {
        return value != null && ADDRESS.matcher(value).matches();
    }

    public static boolean isTransactionHash(String value) {
        return value != null && TX_HASH.matcher(value).matches();
    }

    /** Lowercases with a fixed locale; null stays null. */
    public static String normalize(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }
}
