package com.questrail.hostlink.api;

/**
 * A complete document arrived but it is not a valid response structure.
 */
public final class MalformedResponseException extends HostLinkException
{
    public MalformedResponseException(String message) {
        super(message);
    }
}
