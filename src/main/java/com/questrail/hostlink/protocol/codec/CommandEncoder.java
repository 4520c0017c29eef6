package com.questrail.hostlink.protocol.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.hostlink.api.HostCommand;

import java.util.Objects;

/**
 * Encodes a {@link HostCommand} as one self-contained JSON document.
 *
 * <p>Field order on the wire is {@code type} then {@code params}. An absent
 * parameter map is sent as {@code {}} so the host never sees a null.</p>
 */
public final class CommandEncoder
{
    private final ObjectMapper mapper;

    public CommandEncoder(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * @throws IllegalArgumentException if a parameter value cannot be
     *                                  represented as JSON
     */
    public byte[] encode(HostCommand command)
    {
        Objects.requireNonNull(command, "command");

        ObjectNode root = mapper.createObjectNode();
        root.put("type", command.type());

        // valueToTree reports unserializable values as IllegalArgumentException.
        JsonNode params = mapper.valueToTree(command.params());
        root.set("params", params);

        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Parameters of command '" + command.type() + "' cannot be encoded as JSON", e);
        }
    }
}
