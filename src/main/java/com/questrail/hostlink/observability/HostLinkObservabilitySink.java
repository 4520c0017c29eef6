package com.questrail.hostlink.observability;

/**
 * Main interface for receiving host link observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks are invoked on the caller's thread while the link's dispatch
 * lock is held. Implementations must be fast and must not call back into the
 * link.</p>
 */
public interface HostLinkObservabilitySink {
    /**
     * Called when the cached connection is opened, reused, invalidated or released.
     * @param event the connection event
     */
    void onConnectionEvent(HostLinkConnectionEvent event);

    /**
     * Called when a command is written or its response decoded.
     * @param event the command event
     */
    void onCommandEvent(HostLinkCommandEvent event);

    /**
     * Called when the frame reader finishes a receive, times out, or sees the peer close.
     * @param event the frame event
     */
    void onFrameEvent(HostLinkFrameEvent event);

    /**
     * Called when a transport failure is about to be surfaced to the caller.
     * @param event the error event
     */
    void onError(HostLinkErrorEvent event);
}
