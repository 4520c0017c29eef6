package com.questrail.hostlink.observability;

import com.questrail.hostlink.config.HostAddress;

import java.time.Instant;

/**
 * Record representing a change in the cached connection's lifecycle.
 *
 * @param detail free-form diagnostic text; may be {@code null}
 */
public record HostLinkConnectionEvent(
    Instant timestamp,
    Kind kind,
    HostAddress address,
    String detail
) {
    public enum Kind {
        /** A new channel was opened. */
        OPENED,
        /** The cached channel passed its health check and is reused. */
        REUSED,
        /** The cached channel failed its health check and is discarded. */
        HEALTH_CHECK_FAILED,
        /** The channel was closed and the cache cleared. */
        RELEASED
    }
}
