package com.questrail.hostlink.dispatch;

import com.questrail.hostlink.api.ConnectionFailureException;
import com.questrail.hostlink.api.HostCommand;
import com.questrail.hostlink.api.HostLink;
import com.questrail.hostlink.api.HostLinkException;
import com.questrail.hostlink.api.HostResponse;
import com.questrail.hostlink.connection.Connection;
import com.questrail.hostlink.connection.ConnectionManager;
import com.questrail.hostlink.observability.HostLinkCommandEvent;
import com.questrail.hostlink.observability.HostLinkErrorEvent;
import com.questrail.hostlink.observability.HostLinkObservabilitySink;
import com.questrail.hostlink.protocol.codec.CommandEncoder;
import com.questrail.hostlink.protocol.codec.Frame;
import com.questrail.hostlink.protocol.codec.FrameReader;
import com.questrail.hostlink.protocol.codec.ResponseDecoder;
import com.questrail.hostlink.transport.HostChannel;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;

/**
 * CommandDispatcher
 * =============================================================================
 * The {@link HostLink} implementation: one command out, exactly one response
 * back.
 *
 * <h2>Dispatch</h2>
 * <ol>
 *   <li>Acquire a connection (health-checking a cached one). Failure to open
 *       propagates as {@link ConnectionFailureException}, not retried.</li>
 *   <li>Write the encoded command in full, bounded by the connection timeout.</li>
 *   <li>Read exactly one frame through the {@link FrameReader}, bounded by the
 *       same timeout.</li>
 *   <li>Decode the frame structurally into a {@link HostResponse}.</li>
 *   <li>Return it unchanged, including error-status responses.</li>
 * </ol>
 *
 * <h2>Failure mapping</h2>
 * Every {@link HostLinkException} leaves the connection invalidated before it
 * reaches the caller, so the next {@code send} opens a fresh channel instead
 * of reading from a stream whose position is unknown. This includes
 * malformed responses: the document boundary was found, but nothing proves
 * the stream holds no further stray bytes. Domain-level errors never
 * invalidate the connection.
 *
 * <p>The dispatcher never retries. A caller that wants to retry issues
 * {@code send} again, which reconnects transparently.</p>
 */
public final class CommandDispatcher implements HostLink
{
    private final ConnectionManager connections;
    private final FrameReader frameReader;
    private final CommandEncoder encoder;
    private final ResponseDecoder decoder;
    private final HostCommand healthCheck;
    private final HostLinkObservabilitySink sink;

    public CommandDispatcher(ConnectionManager connections,
                             FrameReader frameReader,
                             CommandEncoder encoder,
                             ResponseDecoder decoder,
                             HostLinkObservabilitySink sink)
    {
        this.connections = Objects.requireNonNull(connections, "connections");
        this.frameReader = Objects.requireNonNull(frameReader, "frameReader");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.healthCheck = HostCommand.of(connections.config().healthCheckCommand());
    }

    @Override
    public HostResponse send(HostCommand command)
    {
        Objects.requireNonNull(command, "command");

        // Encoding problems are caller bugs, not transport failures, and must
        // not cost the connection.
        final byte[] payload = encoder.encode(command);

        return connections.exclusive(() -> {
            try {
                Connection connection = connections.acquire(this::healthCheck);
                return exchange(connection, command.type(), payload);
            } catch (HostLinkException e) {
                sink.onError(new HostLinkErrorEvent(Instant.now(), e.getMessage(), e));
                connections.invalidate(e.getMessage());
                throw e;
            }
        });
    }

    /**
     * Acquire a connection without sending a command. A cached channel is
     * health-checked; otherwise a new one is opened.
     *
     * @throws HostLinkException if no usable connection could be established
     */
    public void connect()
    {
        connections.exclusive(() -> {
            try {
                return connections.acquire(this::healthCheck);
            } catch (HostLinkException e) {
                sink.onError(new HostLinkErrorEvent(Instant.now(), e.getMessage(), e));
                connections.invalidate(e.getMessage());
                throw e;
            }
        });
    }

    /**
     * Shut the link down: close the cached channel, if any.
     */
    public void release()
    {
        connections.release();
    }

    private void healthCheck(Connection connection)
    {
        exchange(connection, healthCheck.type(), encoder.encode(healthCheck));
    }

    /**
     * One write plus one receive on an already acquired connection. Does not
     * touch the connection's lifecycle; callers decide what a failure means.
     */
    private HostResponse exchange(Connection connection, String commandType, byte[] payload)
    {
        try {
            HostChannel channel = connection.channel();

            try {
                channel.write(payload, connection.timeout());
            } catch (IOException e) {
                throw new ConnectionFailureException(
                        "Connection to host lost while sending '" + commandType + "': " + describe(e), e);
            }
            sink.onCommandEvent(new HostLinkCommandEvent(
                    Instant.now(), HostLinkCommandEvent.Kind.SENT, commandType, payload.length, null));

            final Frame frame;
            try {
                frame = frameReader.readFrame(channel, connection.timeout());
            } catch (IOException e) {
                throw new ConnectionFailureException(
                        "Connection to host lost while waiting for '" + commandType + "': " + describe(e), e);
            }

            HostResponse response = decoder.decode(frame.document());
            sink.onCommandEvent(new HostLinkCommandEvent(
                    Instant.now(), HostLinkCommandEvent.Kind.RESPONSE_RECEIVED,
                    commandType, frame.length(), response.status()));
            return response;
        } catch (HostLinkException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConnectionFailureException("Communication error with host: " + describe(e), e);
        }
    }

    private static String describe(Throwable t)
    {
        String message = t.getMessage();
        return message != null ? message : t.getClass().getSimpleName();
    }
}
