package com.questrail.hostlink.transport;

import java.util.Objects;

/**
 * ReadResult
 * -----------------------------------------------------------------------------
 * Outcome of one bounded read from a {@link HostChannel}.
 */
public sealed interface ReadResult
        permits ReadResult.Data, ReadResult.Closed, ReadResult.TimedOut
{
    /** Shared instance for an orderly close by the peer. */
    ReadResult CLOSED = new Closed();

    /** Shared instance for a read that saw no bytes before its timeout. */
    ReadResult TIMED_OUT = new TimedOut();

    static ReadResult data(byte[] bytes) {
        return new Data(bytes);
    }

    /** One or more bytes were read. Never empty. */
    record Data(byte[] bytes) implements ReadResult {
        public Data {
            Objects.requireNonNull(bytes, "bytes");
            if (bytes.length == 0) {
                throw new IllegalArgumentException("Data chunk must not be empty; use CLOSED for end of stream");
            }
        }
    }

    /** The peer closed its side of the stream. No more bytes will arrive. */
    record Closed() implements ReadResult {}

    /** No bytes arrived within the read timeout. The channel is still open. */
    record TimedOut() implements ReadResult {}
}
