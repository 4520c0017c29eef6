package com.questrail.hostlink.api;

/**
 * Base type for transport-layer failures raised by the host link.
 *
 * <p>Every subclass carries a message that can be shown to an end user as-is.
 * A {@code HostLinkException} always means the outcome on the host is unknown
 * or the command never reached it; domain-level failures are reported through
 * {@link HostResponse#isError()} instead.</p>
 */
public abstract class HostLinkException extends RuntimeException
{
    protected HostLinkException(String message) {
        super(message);
    }

    protected HostLinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
