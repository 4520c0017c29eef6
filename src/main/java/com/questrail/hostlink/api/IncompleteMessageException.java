package com.questrail.hostlink.api;

/**
 * No complete response document arrived before the timeout elapsed or the
 * host closed the channel.
 *
 * <p>The command may still be running on the host. Callers should re-verify
 * host state rather than assume the command did not happen.</p>
 */
public final class IncompleteMessageException extends HostLinkException
{
    private final int receivedBytes;

    public IncompleteMessageException(String message, int receivedBytes) {
        super(message);
        this.receivedBytes = receivedBytes;
    }

    /**
     * Number of bytes buffered when the receive gave up.
     */
    public int receivedBytes() {
        return receivedBytes;
    }
}
