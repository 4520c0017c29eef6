package com.questrail.hostlink.observability;

import java.time.Instant;

/**
 * Record representing how a receive operation ended.
 */
public record HostLinkFrameEvent(
    Instant timestamp,
    Kind kind,
    int bufferedBytes
) {
    public enum Kind {
        /** The buffer decoded as a complete document. */
        COMPLETE,
        /** The receive deadline passed before a complete document arrived. */
        RECEIVE_TIMEOUT,
        /** The peer closed the channel during the receive. */
        PEER_CLOSED
    }
}
