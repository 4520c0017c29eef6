package com.questrail.hostlink.protocol.codec.impl;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.async.ByteArrayFeeder;

import java.io.Closeable;
import java.io.IOException;

/**
 * JsonBoundaryProbe
 * -----------------------------------------------------------------------------
 * Incremental tokenizer that tells the frame reader when a complete-document
 * decode is worth attempting.
 *
 * <p>Re-decoding the whole buffer after every chunk is quadratic in the
 * response size. The probe feeds each chunk once into a Jackson non-blocking
 * parser and tracks container depth. A decode attempt is signalled only when
 * the stream is back at root level after some non-whitespace content, which
 * is necessary for the buffer to be one complete document.</p>
 *
 * <p>The probe never accepts a frame by itself; {@link JsonDocuments} remains
 * the only boundary test. Once the tokenizer hits a syntax error the probe
 * stays negative: no extension of a malformed JSON prefix is valid.</p>
 */
final class JsonBoundaryProbe implements Closeable
{
    private final JsonParser parser;
    private final ByteArrayFeeder feeder;

    private int depth;
    private boolean contentSeen;
    private boolean malformed;

    JsonBoundaryProbe(JsonFactory factory) throws IOException
    {
        this.parser = factory.createNonBlockingByteArrayParser();
        this.feeder = (ByteArrayFeeder) parser.getNonBlockingInputFeeder();
    }

    /**
     * Consume one chunk.
     *
     * @return true if the bytes fed so far may form one complete document
     */
    boolean feed(byte[] chunk)
    {
        if (!contentSeen) {
            contentSeen = hasNonWhitespace(chunk);
        }
        if (malformed) {
            return false;
        }

        try {
            feeder.feedInput(chunk, 0, chunk.length);
            JsonToken token;
            while ((token = parser.nextToken()) != null && token != JsonToken.NOT_AVAILABLE) {
                if (token == JsonToken.START_OBJECT || token == JsonToken.START_ARRAY) {
                    depth++;
                }
                else if (token == JsonToken.END_OBJECT || token == JsonToken.END_ARRAY) {
                    depth--;
                }
            }
        } catch (IOException e) {
            malformed = true;
            return false;
        }

        return contentSeen && depth == 0;
    }

    boolean isMalformed()
    {
        return malformed;
    }

    @Override
    public void close() throws IOException
    {
        parser.close();
    }

    private static boolean hasNonWhitespace(byte[] chunk)
    {
        for (byte b : chunk) {
            if (b != ' ' && b != '\t' && b != '\n' && b != '\r') {
                return true;
            }
        }
        return false;
    }
}
