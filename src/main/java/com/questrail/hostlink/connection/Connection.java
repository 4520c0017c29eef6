package com.questrail.hostlink.connection;

import com.questrail.hostlink.config.HostAddress;
import com.questrail.hostlink.transport.HostChannel;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection
 * -----------------------------------------------------------------------------
 * The live duplex channel to the host: target address, round-trip timeout and
 * at most one open {@link HostChannel}.
 *
 * <p>A Connection without a channel is <em>disconnected</em> and must be
 * reopened through {@link ConnectionManager#acquire(ConnectionProbe)} before
 * use. The channel is attached and detached only by the owning
 * {@link ConnectionManager} while it holds its lock.</p>
 */
public final class Connection
{
    private final HostAddress address;
    private final Duration timeout;

    private HostChannel channel;

    Connection(HostAddress address, Duration timeout)
    {
        this.address = Objects.requireNonNull(address, "address");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public HostAddress address()
    {
        return address;
    }

    /**
     * Bound applied to the write and to the receive of every round trip.
     */
    public Duration timeout()
    {
        return timeout;
    }

    public boolean hasChannel()
    {
        return channel != null;
    }

    /**
     * @throws IllegalStateException if the connection is disconnected
     */
    public HostChannel channel()
    {
        HostChannel c = channel;
        if (c == null) {
            throw new IllegalStateException("Connection to " + address + " is disconnected");
        }
        return c;
    }

    void attach(HostChannel channel)
    {
        if (this.channel != null) {
            throw new IllegalStateException("Connection to " + address + " already has an open channel");
        }
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    /**
     * Clear the handle first, then close it, so the connection reads as
     * disconnected even if the close fails.
     */
    void detachAndClose() throws IOException
    {
        HostChannel c = channel;
        channel = null;
        if (c != null) {
            c.close();
        }
    }
}
