package com.questrail.hostlink.observability;

import java.time.Instant;

/**
 * Record representing a transport failure in the host link.
 */
public record HostLinkErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
