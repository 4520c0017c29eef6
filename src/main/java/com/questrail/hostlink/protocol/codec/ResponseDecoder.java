package com.questrail.hostlink.protocol.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.hostlink.api.HostResponse;
import com.questrail.hostlink.api.MalformedResponseException;
import com.questrail.hostlink.api.ResponseStatus;

import java.util.Objects;

/**
 * ResponseDecoder
 * -----------------------------------------------------------------------------
 * Structural decode of a complete response document into a {@link HostResponse}.
 *
 * <p>Rules:</p>
 * <ul>
 *   <li>The document must be a JSON object with a textual {@code status} of
 *       {@code success} or {@code error}.</li>
 *   <li>On success, {@code result} must be an object; absent or null reads as
 *       an empty object.</li>
 *   <li>On error, {@code message} is taken as text; absent or null reads as
 *       {@value #UNKNOWN_ERROR}.</li>
 * </ul>
 *
 * <p>Any other shape is a {@link MalformedResponseException}. Domain-level
 * error content is never interpreted here.</p>
 */
public final class ResponseDecoder
{
    static final String UNKNOWN_ERROR = "Unknown error";

    public HostResponse decode(JsonNode document)
    {
        Objects.requireNonNull(document, "document");

        if (!document.isObject()) {
            throw new MalformedResponseException(
                    "Invalid response from host: expected a JSON object but got " + document.getNodeType());
        }

        JsonNode statusNode = document.get("status");
        if (statusNode == null || !statusNode.isTextual()) {
            throw new MalformedResponseException("Invalid response from host: missing 'status' field");
        }

        ResponseStatus status = ResponseStatus.fromWire(statusNode.textValue())
                .orElseThrow(() -> new MalformedResponseException(
                        "Invalid response from host: unknown status '" + statusNode.textValue() + "'"));

        if (status == ResponseStatus.SUCCESS) {
            JsonNode result = document.get("result");
            if (result == null || result.isNull()) {
                return HostResponse.success(null);
            }
            if (!result.isObject()) {
                throw new MalformedResponseException(
                        "Invalid response from host: 'result' must be an object but got " + result.getNodeType());
            }
            return HostResponse.success((ObjectNode) result);
        }

        JsonNode message = document.get("message");
        if (message == null || message.isNull()) {
            return HostResponse.error(UNKNOWN_ERROR);
        }
        return HostResponse.error(message.isTextual() ? message.textValue() : message.toString());
    }
}
