package com.questrail.hostlink.observability;

/**
 * No-op implementation of HostLinkObservabilitySink.
 */
public final class NullObservabilitySink implements HostLinkObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConnectionEvent(HostLinkConnectionEvent event) {}

    @Override
    public void onCommandEvent(HostLinkCommandEvent event) {}

    @Override
    public void onFrameEvent(HostLinkFrameEvent event) {}

    @Override
    public void onError(HostLinkErrorEvent event) {}
}
