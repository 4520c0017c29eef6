package com.questrail.hostlink.protocol.codec;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One complete inbound document, as produced by a {@link FrameReader}.
 *
 * @param document the decoded document
 * @param length   number of bytes the document occupied on the wire
 */
public record Frame(JsonNode document, int length)
{
    public Frame {
        Objects.requireNonNull(document, "document");
    }
}
