package com.questrail.hostlink.config;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Target address of the host's socket server.
 */
public record HostAddress(String host, int port) {
    public HostAddress {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be 1-65535, got " + port);
        }
    }

    /**
     * Unresolved socket address; name resolution happens at connect time so a
     * host that comes up later under the same name is still reachable.
     */
    public InetSocketAddress toSocketAddress() {
        return InetSocketAddress.createUnresolved(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
