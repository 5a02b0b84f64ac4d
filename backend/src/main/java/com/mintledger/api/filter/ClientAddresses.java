package com.mintledger.api.filter;

import org.springframework.http.server.reactive.ServerHttpRequest;

import java.net.InetSocketAddress;

/**
 * Caller IP as seen by the server. Forwarded headers are honoured only through
 * server.forward-headers-strategy, never read here directly.
 */
public final class ClientAddresses {

    public static final String UNKNOWN = "unknown";

    private ClientAddresses() {
    }

    public static String of(ServerHttpRequest request) {
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote == null) return UNKNOWN;
        if (remote.getAddress() != null) return remote.getAddress().getHostAddress();
        return remote.getHostString();
    }
}
