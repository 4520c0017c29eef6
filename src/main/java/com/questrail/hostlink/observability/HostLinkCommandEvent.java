package com.questrail.hostlink.observability;

import com.questrail.hostlink.api.ResponseStatus;

import java.time.Instant;

/**
 * Record representing one leg of a command round trip.
 *
 * @param bytes  encoded request size for {@link Kind#SENT}, response size for
 *               {@link Kind#RESPONSE_RECEIVED}
 * @param status response status; {@code null} for {@link Kind#SENT}
 */
public record HostLinkCommandEvent(
    Instant timestamp,
    Kind kind,
    String commandType,
    int bytes,
    ResponseStatus status
) {
    public enum Kind {
        SENT,
        RESPONSE_RECEIVED
    }
}
