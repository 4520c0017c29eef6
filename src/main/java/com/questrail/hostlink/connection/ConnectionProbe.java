package com.questrail.hostlink.connection;

import com.questrail.hostlink.api.HostLinkException;

/**
 * Health check applied to a cached {@link Connection} before it is reused.
 */
@FunctionalInterface
public interface ConnectionProbe
{
    /**
     * Verify the connection with a full round trip.
     *
     * @throws HostLinkException if the connection is not usable
     */
    void check(Connection connection);
}
