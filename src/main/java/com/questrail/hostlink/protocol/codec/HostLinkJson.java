package com.questrail.hostlink.protocol.codec;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Jackson configuration shared by the encoder, decoder and frame reader.
 *
 * <p>Host results can carry large embedded strings (serialized scenes, node
 * trees, script output), so the default string-length read constraint is
 * raised. Nesting depth keeps Jackson's default.</p>
 *
 * <p>The host serializes with Python's {@code json} module, which writes
 * non-finite floats as the bare tokens {@code NaN}, {@code Infinity} and
 * {@code -Infinity}. They are accepted on read.</p>
 */
public final class HostLinkJson
{
    /** Longest single JSON string accepted from the host, in chars. */
    public static final int MAX_STRING_LENGTH = 256 * 1024 * 1024;

    private HostLinkJson() {}

    public static ObjectMapper newObjectMapper()
    {
        JsonFactory factory = JsonFactory.builder()
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .streamReadConstraints(StreamReadConstraints.builder()
                        .maxStringLength(MAX_STRING_LENGTH)
                        .build())
                .build();
        return new ObjectMapper(factory);
    }
}
