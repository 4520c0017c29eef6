package com.questrail.hostlink.protocol.codec.impl;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Optional;

/**
 * Complete-document decode used as the frame boundary test.
 */
final class JsonDocuments
{
    private JsonDocuments() {}

    /**
     * Decode {@code bytes[0, length)} as exactly one JSON document.
     *
     * <p>Succeeds only if the range holds one complete value, optionally
     * surrounded by whitespace. Truncated input, malformed input, trailing
     * tokens and empty or whitespace-only input all yield
     * {@link Optional#empty()}.</p>
     */
    static Optional<JsonNode> decodeComplete(ObjectMapper mapper, byte[] bytes, int length)
    {
        try (JsonParser parser = mapper.getFactory().createParser(bytes, 0, length)) {
            JsonNode node = mapper.readTree(parser);
            if (node == null || node.isMissingNode()) {
                return Optional.empty();
            }
            if (parser.nextToken() != null) {
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (IOException e) {
            // Incomplete or not (yet) valid JSON. The caller keeps reading.
            return Optional.empty();
        }
    }
}
