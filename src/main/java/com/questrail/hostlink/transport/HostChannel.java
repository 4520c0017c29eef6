package com.questrail.hostlink.transport;

import java.io.IOException;
import java.time.Duration;

/**
 * HostChannel
 * -----------------------------------------------------------------------------
 * One open duplex byte stream to the host.
 *
 * <p>A channel is used by one caller at a time. The connection manager's lock
 * guarantees this; implementations need not support concurrent reads or
 * concurrent writes.</p>
 */
public interface HostChannel
{
    /**
     * Write the whole payload, blocking until it has been handed to the
     * operating system or the timeout elapses.
     *
     * @throws IOException if the write fails or times out
     */
    void write(byte[] payload, Duration timeout) throws IOException;

    /**
     * Read up to {@code maxBytes}, blocking at most {@code timeout}.
     *
     * @return {@link ReadResult.Data} with between 1 and {@code maxBytes}
     *         bytes, {@link ReadResult#CLOSED} once the peer has closed and
     *         all buffered bytes have been returned, or
     *         {@link ReadResult#TIMED_OUT}
     * @throws IOException if the stream failed (for example a reset)
     */
    ReadResult read(int maxBytes, Duration timeout) throws IOException;

    boolean isOpen();

    /**
     * Close the stream. Idempotent.
     *
     * @throws IOException if the underlying close reports a failure
     */
    void close() throws IOException;
}
