package com.questrail.hostlink.connection;

import com.questrail.hostlink.api.ConnectionFailureException;
import com.questrail.hostlink.api.HostLinkException;
import com.questrail.hostlink.config.HostLinkConfig;
import com.questrail.hostlink.observability.HostLinkConnectionEvent;
import com.questrail.hostlink.observability.HostLinkErrorEvent;
import com.questrail.hostlink.observability.HostLinkObservabilitySink;
import com.questrail.hostlink.transport.HostChannel;
import com.questrail.hostlink.transport.HostChannelFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * ConnectionManager
 * =============================================================================
 * Owns the lifecycle of the single {@link Connection} to the host.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #acquire(ConnectionProbe)}: return an open connection. A cached
 *       channel is health-checked with the given probe; if the check fails
 *       for any reason the channel is closed and a new one opened. With no
 *       cached channel, one is opened against the configured address.</li>
 *   <li>{@link #release()}: close the channel if open, best effort, and clear
 *       the cache. Used at shutdown.</li>
 *   <li>{@link #invalidate(String)}: same as release, used after a transport
 *       failure so the next acquire starts clean.</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * <p>One manager holds exactly one connection; the host is a single-instance
 * local application and multiplexing offers it nothing. Every method, and
 * every action run through {@link #exclusive(Supplier)}, holds the manager's
 * monitor. The dispatcher runs acquire, write and receive as one exclusive
 * action, which is what guarantees a single in-flight command per
 * connection. The monitor is reentrant, so a probe may run a full round trip
 * from inside {@code acquire}.</p>
 */
public final class ConnectionManager
{
    private final Object lock = new Object();

    private final HostLinkConfig config;
    private final HostChannelFactory channelFactory;
    private final HostLinkObservabilitySink sink;

    private final Connection connection;

    public ConnectionManager(HostLinkConfig config,
                             HostChannelFactory channelFactory,
                             HostLinkObservabilitySink sink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.connection = new Connection(config.address(), config.responseTimeout());
    }

    /**
     * Run {@code action} while holding the manager's lock.
     */
    public <T> T exclusive(Supplier<T> action)
    {
        Objects.requireNonNull(action, "action");
        synchronized (lock) {
            return action.get();
        }
    }

    /**
     * Return a usable, open connection.
     *
     * @param probe health check for a cached channel; not applied to a
     *              channel opened by this call
     * @throws ConnectionFailureException if a new channel cannot be opened
     */
    public Connection acquire(ConnectionProbe probe)
    {
        Objects.requireNonNull(probe, "probe");
        synchronized (lock) {
            if (connection.hasChannel()) {
                try {
                    probe.check(connection);
                    emit(HostLinkConnectionEvent.Kind.REUSED, null);
                    return connection;
                } catch (HostLinkException e) {
                    emit(HostLinkConnectionEvent.Kind.HEALTH_CHECK_FAILED, e.getMessage());
                    releaseLocked("health check failed");
                }
            }

            openLocked();
            return connection;
        }
    }

    /**
     * Close the channel, if any, and clear cached state. Close-time errors are
     * reported to the observability sink and otherwise ignored.
     */
    public void release()
    {
        synchronized (lock) {
            releaseLocked(null);
        }
    }

    /**
     * Discard the channel after a failure. The next {@link #acquire} opens a
     * fresh one.
     *
     * @param reason diagnostic text for observability
     */
    public void invalidate(String reason)
    {
        synchronized (lock) {
            releaseLocked(reason);
        }
    }

    /**
     * @return true if a channel is currently cached. The channel may still
     *         turn out to be dead on next use.
     */
    public boolean isConnected()
    {
        synchronized (lock) {
            return connection.hasChannel();
        }
    }

    public HostLinkConfig config()
    {
        return config;
    }

    // -------------------------------------------------------------------------
    // Internals (lock held)
    // -------------------------------------------------------------------------

    private void openLocked()
    {
        final HostChannel channel;
        try {
            channel = channelFactory.open(config.address(), config.connectTimeout());
        } catch (IOException | RuntimeException e) {
            // Netty reports some address problems (unresolvable, unsupported)
            // as unchecked exceptions; they mean the same thing here.
            String message = "Could not connect to host at " + config.address()
                    + ". Make sure the host add-on is running (" + describe(e) + ")";
            sink.onError(new HostLinkErrorEvent(Instant.now(), message, e));
            throw new ConnectionFailureException(message, e);
        }

        connection.attach(channel);
        emit(HostLinkConnectionEvent.Kind.OPENED, null);
    }

    private void releaseLocked(String reason)
    {
        if (!connection.hasChannel()) {
            return;
        }
        try {
            connection.detachAndClose();
        } catch (IOException e) {
            sink.onError(new HostLinkErrorEvent(Instant.now(), "Error disconnecting from host", e));
        }
        emit(HostLinkConnectionEvent.Kind.RELEASED, reason);
    }

    private void emit(HostLinkConnectionEvent.Kind kind, String detail)
    {
        sink.onConnectionEvent(new HostLinkConnectionEvent(Instant.now(), kind, config.address(), detail));
    }

    private static String describe(Throwable t)
    {
        String message = t.getMessage();
        return message != null ? message : t.getClass().getSimpleName();
    }
}
