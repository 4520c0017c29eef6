package com.questrail.hostlink.protocol.codec.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.hostlink.api.ConnectionClosedException;
import com.questrail.hostlink.api.IncompleteMessageException;
import com.questrail.hostlink.observability.HostLinkFrameEvent;
import com.questrail.hostlink.observability.RecordingObservabilitySink;
import com.questrail.hostlink.protocol.codec.Frame;
import com.questrail.hostlink.protocol.codec.HostLinkJson;
import com.questrail.hostlink.time.ManualMonotonicClock;
import com.questrail.hostlink.transport.FakeHostChannel;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JsonDocumentFrameReaderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link JsonDocumentFrameReader}.
 *
 * <p>The channel is scripted; no sockets are involved. These tests cover the
 * boundary rule (the buffer decodes as one complete document) and the
 * close/timeout outcomes of a receive.</p>
 */
final class JsonDocumentFrameReaderTest
{
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ObjectMapper mapper = HostLinkJson.newObjectMapper();
    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final JsonDocumentFrameReader reader = new JsonDocumentFrameReader(mapper, 8192, clock, sink);

    @Test
    void singleChunkDocumentIsReturned() throws IOException
    {
        FakeHostChannel channel = new FakeHostChannel()
                .thenData("{\"status\":\"success\",\"result\":{\"name\":\"Scene\"}}");

        Frame frame = reader.readFrame(channel, TIMEOUT);

        assertEquals("success", frame.document().get("status").asText());
        assertEquals("Scene", frame.document().at("/result/name").asText());
        assertEquals(HostLinkFrameEvent.Kind.COMPLETE, lastFrameKind());
    }

    @Test
    void documentDeliveredOneByteAtATimeIsReassembled() throws IOException
    {
        String json = "{\"status\": \"success\", \"result\": {\"items\": [1, 2, {\"x\": \"}]\"}]}}";
        FakeHostChannel channel = new FakeHostChannel().thenDataBytewise(json);

        Frame frame = reader.readFrame(channel, TIMEOUT);

        assertEquals(json.length(), frame.length());
        assertEquals("}]", frame.document().at("/result/items/2/x").asText());
    }

    @Test
    void readerDoesNotConsumePastTheCompletingChunk() throws IOException
    {
        FakeHostChannel channel = new FakeHostChannel()
                .thenData("{\"status\":")
                .thenData("\"success\"}")
                .thenData("{\"status\":\"error\"}");

        Frame first = reader.readFrame(channel, TIMEOUT);
        Frame second = reader.readFrame(channel, TIMEOUT);

        assertEquals("success", first.document().get("status").asText());
        assertEquals("error", second.document().get("status").asText());
    }

    @Test
    void chunksLargerThanTheReadSizeAreStillReassembled() throws IOException
    {
        JsonDocumentFrameReader small = new JsonDocumentFrameReader(mapper, 4, clock, sink);
        FakeHostChannel channel = new FakeHostChannel()
                .thenData("{\"status\":\"success\",\"result\":{}}");

        Frame frame = small.readFrame(channel, TIMEOUT);

        assertTrue(frame.document().get("result").isObject());
    }

    @Test
    void closeBeforeAnyDataIsConnectionClosed()
    {
        FakeHostChannel channel = new FakeHostChannel().thenClosed();

        ConnectionClosedException e = assertThrows(ConnectionClosedException.class,
                () -> reader.readFrame(channel, TIMEOUT));

        assertTrue(e.getMessage().contains("before receiving any data"));
        assertEquals(HostLinkFrameEvent.Kind.PEER_CLOSED, lastFrameKind());
    }

    @Test
    void closeWithPartialDocumentIsIncompleteWithByteCount()
    {
        FakeHostChannel channel = new FakeHostChannel()
                .thenData("{\"status\":\"succ")
                .thenClosed();

        IncompleteMessageException e = assertThrows(IncompleteMessageException.class,
                () -> reader.readFrame(channel, TIMEOUT));

        assertEquals(15, e.receivedBytes());
        assertTrue(e.getMessage().contains("15 bytes"));
    }

    @Test
    void closeAfterCompleteDocumentWithTrailingWhitespaceReturnsIt() throws IOException
    {
        FakeHostChannel channel = new FakeHostChannel()
                .thenData("{\"status\":\"success\"}\n")
                .thenClosed();

        Frame frame = reader.readFrame(channel, TIMEOUT);

        assertEquals("success", frame.document().get("status").asText());
    }

    @Test
    void timeoutWithEmptyBufferIsIncompleteWithZeroBytes()
    {
        FakeHostChannel channel = new FakeHostChannel()
                .onTimeout(clock::advance)
                .thenTimeout();

        IncompleteMessageException e = assertThrows(IncompleteMessageException.class,
                () -> reader.readFrame(channel, TIMEOUT));

        assertEquals(0, e.receivedBytes());
        assertTrue(e.getMessage().contains("No response received"));
        assertEquals(HostLinkFrameEvent.Kind.RECEIVE_TIMEOUT, lastFrameKind());
    }

    @Test
    void timeoutWithPartialDocumentIsIncomplete()
    {
        FakeHostChannel channel = new FakeHostChannel()
                .thenData("{\"status\":\"success\",\"result\":{")
                .thenTimeout();

        IncompleteMessageException e = assertThrows(IncompleteMessageException.class,
                () -> reader.readFrame(channel, TIMEOUT));

        assertEquals(30, e.receivedBytes());
    }

    @Test
    void deadlineBoundsTheWholeReceiveNotEachRead()
    {
        // Each read sees fresh data, but three seconds pass per read.
        FakeHostChannel channel = new FakeHostChannel()
                .beforeEachRead(() -> clock.advanceMillis(3000))
                .thenData("{\"status\":")
                .thenData("\"success\",")
                .thenData("\"result\":{}}");

        IncompleteMessageException e = assertThrows(IncompleteMessageException.class,
                () -> reader.readFrame(channel, TIMEOUT));

        assertEquals(20, e.receivedBytes());
        assertEquals(HostLinkFrameEvent.Kind.RECEIVE_TIMEOUT, lastFrameKind());
    }

    @Test
    void trailingGarbageNeverFormsADocument()
    {
        FakeHostChannel channel = new FakeHostChannel()
                .thenData("{\"status\":\"success\"} xyz")
                .thenClosed();

        assertThrows(IncompleteMessageException.class, () -> reader.readFrame(channel, TIMEOUT));
    }

    @Test
    void malformedBytesAreIncompleteNotMalformed()
    {
        FakeHostChannel channel = new FakeHostChannel()
                .thenData("{\"status\": success}")
                .thenClosed();

        IncompleteMessageException e = assertThrows(IncompleteMessageException.class,
                () -> reader.readFrame(channel, TIMEOUT));
        assertEquals(19, e.receivedBytes());
    }

    @Test
    void whitespaceOnlyIsIncomplete()
    {
        FakeHostChannel channel = new FakeHostChannel()
                .thenData("  \n\t ")
                .thenClosed();

        assertThrows(IncompleteMessageException.class, () -> reader.readFrame(channel, TIMEOUT));
    }

    @Test
    void scalarRootIsReturnedAsAFrame() throws IOException
    {
        // Framing is structural only; rejecting non-objects is the decoder's job.
        FakeHostChannel channel = new FakeHostChannel().thenData("\"hello\"");

        Frame frame = reader.readFrame(channel, TIMEOUT);

        assertTrue(frame.document().isTextual());
    }

    @Test
    void nonFiniteNumbersFromPythonHostAreAccepted() throws IOException
    {
        // Python's json.dumps writes NaN and the infinities as bare tokens.
        FakeHostChannel channel = new FakeHostChannel()
                .thenData("{\"status\": \"success\", \"result\": {\"x\": NaN, \"y\": Infinity, \"z\": -Infinity}}")
                .thenTimeout();

        Frame frame = reader.readFrame(channel, Duration.ofSeconds(180));

        assertTrue(Double.isNaN(frame.document().at("/result/x").asDouble()));
        assertEquals(Double.POSITIVE_INFINITY, frame.document().at("/result/y").asDouble());
        assertEquals(Double.NEGATIVE_INFINITY, frame.document().at("/result/z").asDouble());
        assertEquals(HostLinkFrameEvent.Kind.COMPLETE, lastFrameKind());
        assertTrue(sink.frameEvents().stream().noneMatch(e -> e.kind() == HostLinkFrameEvent.Kind.RECEIVE_TIMEOUT));
    }

    @Test
    void streamFailurePropagatesAsIOException()
    {
        FakeHostChannel channel = new FakeHostChannel()
                .thenData("{\"sta")
                .thenFails(new SocketException("Connection reset"));

        IOException e = assertThrows(IOException.class, () -> reader.readFrame(channel, TIMEOUT));
        assertEquals("Connection reset", e.getMessage());
    }

    @Test
    void largeDocumentInManySmallChunksCompletes() throws IOException
    {
        StringBuilder json = new StringBuilder("{\"status\":\"success\",\"result\":{\"data\":\"");
        json.append("a".repeat(2_000_000));
        json.append("\"}}");

        FakeHostChannel channel = new FakeHostChannel();
        byte[] bytes = json.toString().getBytes(StandardCharsets.UTF_8);
        for (int offset = 0; offset < bytes.length; offset += 8192) {
            channel.thenData(Arrays.copyOfRange(bytes, offset, Math.min(bytes.length, offset + 8192)));
        }

        Frame frame = reader.readFrame(channel, TIMEOUT);

        assertEquals(bytes.length, frame.length());
        assertEquals(2_000_000, frame.document().at("/result/data").asText().length());
    }

    private HostLinkFrameEvent.Kind lastFrameKind()
    {
        List<HostLinkFrameEvent> events = sink.frameEvents();
        assertFalse(events.isEmpty(), "expected a frame event");
        return events.get(events.size() - 1).kind();
    }
}
