package com.questrail.hostlink.protocol.codec.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.hostlink.api.ConnectionClosedException;
import com.questrail.hostlink.api.IncompleteMessageException;
import com.questrail.hostlink.internal.time.MonotonicClock;
import com.questrail.hostlink.observability.HostLinkFrameEvent;
import com.questrail.hostlink.observability.HostLinkObservabilitySink;
import com.questrail.hostlink.protocol.codec.Frame;
import com.questrail.hostlink.protocol.codec.FrameReader;
import com.questrail.hostlink.transport.HostChannel;
import com.questrail.hostlink.transport.ReadResult;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * JsonDocumentFrameReader
 * -----------------------------------------------------------------------------
 * {@link FrameReader} for hosts that write bare JSON documents with no length
 * prefix and no delimiter.
 *
 * <p>The receive proceeds as follows:</p>
 * <ol>
 *   <li>Start an empty buffer and a deadline of now + timeout.</li>
 *   <li>Read up to {@code chunkSize} bytes, waiting no longer than the deadline.
 *     <ul>
 *       <li>Data: append it. If the buffer now decodes as one complete
 *           document, return it. Otherwise keep reading.</li>
 *       <li>Closed with an empty buffer: {@link ConnectionClosedException}.</li>
 *       <li>Closed with data, or deadline reached: stop reading.</li>
 *     </ul>
 *   </li>
 *   <li>Make one final decode attempt on whatever was buffered. Success is
 *       returned; failure is an {@link IncompleteMessageException}.</li>
 * </ol>
 *
 * <p>A successful complete-document decode is the only boundary signal. The
 * {@link JsonBoundaryProbe} merely skips decode attempts that cannot succeed.
 * If the probe rejects input the full decode accepts, every chunk is tried.</p>
 *
 * <p>Instances are stateless between calls and may be shared, but one channel
 * must only be read by one caller at a time.</p>
 */
public final class JsonDocumentFrameReader implements FrameReader
{
    private final ObjectMapper mapper;
    private final int chunkSize;
    private final MonotonicClock clock;
    private final HostLinkObservabilitySink sink;

    public JsonDocumentFrameReader(ObjectMapper mapper,
                                   int chunkSize,
                                   MonotonicClock clock,
                                   HostLinkObservabilitySink sink)
    {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.chunkSize = chunkSize;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public Frame readFrame(HostChannel channel, Duration timeout) throws IOException
    {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(timeout, "timeout");

        final ReceiveBuffer buffer = new ReceiveBuffer(chunkSize);
        final long deadline = clock.nowNanos() + timeout.toNanos();

        try (JsonBoundaryProbe probe = new JsonBoundaryProbe(mapper.getFactory())) {
            while (true) {
                long remaining = deadline - clock.nowNanos();
                if (remaining <= 0) {
                    emit(HostLinkFrameEvent.Kind.RECEIVE_TIMEOUT, buffer.size());
                    break;
                }

                ReadResult result = channel.read(chunkSize, Duration.ofNanos(remaining));

                if (result instanceof ReadResult.Data data) {
                    buffer.append(data.bytes());
                    // A tokenizer that lost sync gives no boundary hint; decode every chunk then.
                    if (probe.feed(data.bytes()) || probe.isMalformed()) {
                        Optional<JsonNode> document = JsonDocuments.decodeComplete(mapper, buffer.array(), buffer.size());
                        if (document.isPresent()) {
                            emit(HostLinkFrameEvent.Kind.COMPLETE, buffer.size());
                            return new Frame(document.get(), buffer.size());
                        }
                    }
                }
                else if (result instanceof ReadResult.Closed) {
                    if (buffer.isEmpty()) {
                        emit(HostLinkFrameEvent.Kind.PEER_CLOSED, 0);
                        throw new ConnectionClosedException("Connection closed by host before receiving any data");
                    }
                    emit(HostLinkFrameEvent.Kind.PEER_CLOSED, buffer.size());
                    break;
                }
                else {
                    emit(HostLinkFrameEvent.Kind.RECEIVE_TIMEOUT, buffer.size());
                    break;
                }
            }
        }

        // Timed out or closed mid-stream: use what arrived, if it is complete.
        if (buffer.isEmpty()) {
            throw new IncompleteMessageException(
                    "No response received from host within " + timeout.toMillis() + " ms."
                            + " The command may still be running; try simplifying the request", 0);
        }

        Optional<JsonNode> document = JsonDocuments.decodeComplete(mapper, buffer.array(), buffer.size());
        if (document.isPresent()) {
            emit(HostLinkFrameEvent.Kind.COMPLETE, buffer.size());
            return new Frame(document.get(), buffer.size());
        }

        throw new IncompleteMessageException(
                "Incomplete JSON response received from host (" + buffer.size() + " bytes)", buffer.size());
    }

    private void emit(HostLinkFrameEvent.Kind kind, int bufferedBytes)
    {
        sink.onFrameEvent(new HostLinkFrameEvent(Instant.now(), kind, bufferedBytes));
    }
}
