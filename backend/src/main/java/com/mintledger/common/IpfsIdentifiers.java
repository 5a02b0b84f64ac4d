package com.mintledger.common;

import java.util.regex.Pattern;

/**
 * IPFS CIDv0 identifiers, ipfs:// locators and Pinata gateway URLs.
 */
public final class IpfsIdentifiers {

    public static final String CID_REGEX = "^Qm[a-zA-Z0-9]{44}$";
    public static final String URI_REGEX = "^ipfs://Qm[a-zA-Z0-9]{44}$";
    public static final String GATEWAY_URL_REGEX = "^https://.*\\.pinata\\.cloud/ipfs/Qm[a-zA-Z0-9]{44}$";

    public static final String GATEWAY_BASE_URL = "https://gateway.pinata.cloud/ipfs/";

    private static final Pattern CID = Pattern.compile(CID_REGEX);

    private IpfsIdentifiers() {
    }

    public static boolean isCid(String value) {
        return value != null && CID.matcher(value).matches();
    }

    /**
     * Gateway URL for a CID, or null when no CID is given.
     */
    public static String gatewayUrl(String cid) {
        return cid == null ? null : GATEWAY_BASE_URL + cid;
    }
}
