package com.questrail.hostlink.api;

/**
 * The host closed the channel before sending any byte of the response.
 */
public final class ConnectionClosedException extends HostLinkException
{
    public ConnectionClosedException(String message) {
        super(message);
    }
}
