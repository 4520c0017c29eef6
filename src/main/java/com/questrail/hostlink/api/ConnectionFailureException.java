package com.questrail.hostlink.api;

/**
 * The channel to the host could not be opened, failed its health check, or
 * broke while a command was being written or its response read.
 *
 * <p>Never retried automatically. Issuing the command again reconnects.</p>
 */
public final class ConnectionFailureException extends HostLinkException
{
    public ConnectionFailureException(String message) {
        super(message);
    }

    public ConnectionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
