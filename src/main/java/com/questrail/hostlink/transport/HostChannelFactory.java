package com.questrail.hostlink.transport;

import com.questrail.hostlink.config.HostAddress;

import java.io.IOException;
import java.time.Duration;

/**
 * Opens {@link HostChannel}s and owns whatever shared resources they need
 * (event loops, selectors).
 */
public interface HostChannelFactory extends AutoCloseable
{
    /**
     * Open a new channel to {@code address}.
     *
     * @throws IOException if the connection is refused, unreachable, or does
     *                     not complete within {@code connectTimeout}
     */
    HostChannel open(HostAddress address, Duration connectTimeout) throws IOException;

    /**
     * Release shared resources. Channels already opened become unusable.
     */
    @Override
    void close();
}
