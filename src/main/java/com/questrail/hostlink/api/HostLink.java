package com.questrail.hostlink.api;

import java.util.Map;

/**
 * HostLink
 * =============================================================================
 * Public contract used by every domain operation to talk to the host.
 *
 * <p>{@code send} blocks until exactly one response has been decoded or a
 * bounded timeout elapses. It either returns a well-formed
 * {@link HostResponse} (which may carry a domain-level error) or throws one of
 * the {@link HostLinkException} subclasses:</p>
 * <ul>
 *   <li>{@link ConnectionFailureException}</li>
 *   <li>{@link ConnectionClosedException}</li>
 *   <li>{@link IncompleteMessageException}</li>
 *   <li>{@link MalformedResponseException}</li>
 * </ul>
 *
 * <p>Any of those exceptions leaves the link disconnected, so the next call
 * starts from a fresh connection.</p>
 */
public interface HostLink
{
    HostResponse send(HostCommand command);

    default HostResponse send(String commandType) {
        return send(HostCommand.of(commandType));
    }

    default HostResponse send(String commandType, Map<String, Object> params) {
        return send(HostCommand.of(commandType, params));
    }
}
