package com.questrail.hostlink.api;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.Optional;

/**
 * HostResponse
 * -----------------------------------------------------------------------------
 * An inbound result from the host.
 *
 * <p>A response is either a success carrying a result payload, or a
 * domain-level error carrying a message. Domain-level errors are values, not
 * exceptions: the transport layer never interprets them and passes them to
 * the caller unchanged.</p>
 *
 * <p>The result payload is kept as a Jackson {@link ObjectNode} because its
 * structure is defined per command type and is opaque to this library.</p>
 */
public record HostResponse(ResponseStatus status, ObjectNode result, String message)
{
    public HostResponse {
        Objects.requireNonNull(status, "status");
        if (result == null) {
            result = JsonNodeFactory.instance.objectNode();
        }
    }

    public static HostResponse success(ObjectNode result) {
        return new HostResponse(ResponseStatus.SUCCESS, result, null);
    }

    public static HostResponse error(String message) {
        return new HostResponse(ResponseStatus.ERROR, null, message);
    }

    /**
     * The result payload. Each call returns an independent copy; changes to it
     * are not visible through this response.
     */
    @Override
    public ObjectNode result() {
        return result.deepCopy();
    }

    public boolean isSuccess() {
        return status == ResponseStatus.SUCCESS;
    }

    public boolean isError() {
        return status == ResponseStatus.ERROR;
    }

    /**
     * Error message supplied by the host, if any.
     */
    public Optional<String> errorMessage() {
        return Optional.ofNullable(message);
    }
}
