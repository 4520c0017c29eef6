package com.questrail.hostlink.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of HostLinkObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jHostLinkObservabilitySink implements HostLinkObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jHostLinkObservabilitySink.class);

    @Override
    public void onConnectionEvent(HostLinkConnectionEvent event) {
        switch (event.kind()) {
            case OPENED -> log.info("Connected to host at {}", event.address());
            case REUSED -> log.debug("Reusing connection to host at {}", event.address());
            case HEALTH_CHECK_FAILED -> log.warn("Existing connection to {} is no longer valid: {}",
                event.address(), event.detail());
            case RELEASED -> log.info("Disconnected from host at {}{}", event.address(),
                event.detail() != null ? " (" + event.detail() + ")" : "");
        }
    }

    @Override
    public void onCommandEvent(HostLinkCommandEvent event) {
        switch (event.kind()) {
            case SENT -> log.info("Sent command {} ({} bytes), waiting for response",
                event.commandType(), event.bytes());
            case RESPONSE_RECEIVED -> log.info("Response to {} parsed, status: {} ({} bytes)",
                event.commandType(), event.status().wireValue(), event.bytes());
        }
    }

    @Override
    public void onFrameEvent(HostLinkFrameEvent event) {
        switch (event.kind()) {
            case COMPLETE -> log.debug("Received complete response ({} bytes)", event.bufferedBytes());
            case RECEIVE_TIMEOUT -> log.warn("Socket timeout during chunked receive ({} bytes buffered)",
                event.bufferedBytes());
            case PEER_CLOSED -> log.warn("Host closed the connection during receive ({} bytes buffered)",
                event.bufferedBytes());
        }
    }

    @Override
    public void onError(HostLinkErrorEvent event) {
        log.error("Host link error: {}", event.message(), event.cause());
    }
}
