package com.questrail.hostlink.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.hostlink.api.HostCommand;
import com.questrail.hostlink.api.HostLink;
import com.questrail.hostlink.api.HostLinkException;
import com.questrail.hostlink.api.HostResponse;
import com.questrail.hostlink.config.HostLinkConfig;
import com.questrail.hostlink.connection.ConnectionManager;
import com.questrail.hostlink.dispatch.CommandDispatcher;
import com.questrail.hostlink.internal.time.MonotonicClock;
import com.questrail.hostlink.internal.time.SystemMonotonicClock;
import com.questrail.hostlink.observability.HostLinkObservabilitySink;
import com.questrail.hostlink.observability.NullObservabilitySink;
import com.questrail.hostlink.observability.Slf4jHostLinkObservabilitySink;
import com.questrail.hostlink.protocol.codec.CommandEncoder;
import com.questrail.hostlink.protocol.codec.FrameReader;
import com.questrail.hostlink.protocol.codec.HostLinkJson;
import com.questrail.hostlink.protocol.codec.ResponseDecoder;
import com.questrail.hostlink.protocol.codec.impl.JsonDocumentFrameReader;
import com.questrail.hostlink.tool.HostToolInvoker;
import com.questrail.hostlink.transport.HostChannelFactory;
import com.questrail.hostlink.transport.tcp.netty.NettyTcpChannelFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * HostLinkRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a host link.
 *
 * <h2>Wiring</h2>
 * <pre>
 *   HostLinkRuntime.send(...)
 *        → CommandDispatcher
 *            → ConnectionManager (acquire / health check / invalidate)
 *                → HostChannelFactory (Netty TCP by default)
 *            → CommandEncoder → HostChannel.write
 *            → JsonDocumentFrameReader → ResponseDecoder
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} tries to connect eagerly so a missing host is
 *       reported early. Failure is logged as a warning, not thrown: the
 *       link connects lazily on the first command anyway.</li>
 *   <li>{@link #stop()} releases the connection and, if the runtime created
 *       the channel factory, shuts it down. Idempotent.</li>
 * </ul>
 *
 * <p>No protocol semantics live here.</p>
 */
public final class HostLinkRuntime implements HostLink, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(HostLinkRuntime.class);

    private final HostLinkConfig config;
    private final HostChannelFactory channelFactory;
    private final boolean ownsChannelFactory;
    private final ConnectionManager connections;
    private final CommandDispatcher dispatcher;
    private final HostToolInvoker tools;

    private final Object lifecycleLock = new Object();
    private boolean stopped;

    private HostLinkRuntime(HostLinkConfig config,
                            HostChannelFactory channelFactory,
                            boolean ownsChannelFactory,
                            ConnectionManager connections,
                            CommandDispatcher dispatcher,
                            HostToolInvoker tools)
    {
        this.config = config;
        this.channelFactory = channelFactory;
        this.ownsChannelFactory = ownsChannelFactory;
        this.connections = connections;
        this.dispatcher = dispatcher;
        this.tools = tools;
    }

    /**
     * Attempt an eager connection.
     *
     * @return true if a connection is now cached
     */
    public boolean start()
    {
        log.info("Host link starting, target {}", config.address());
        try {
            dispatcher.connect();
            log.info("Successfully connected to host on startup");
            return true;
        } catch (HostLinkException e) {
            log.warn("Could not connect to host on startup: {}", e.getMessage());
            log.warn("Make sure the host add-on is running before issuing commands");
            return false;
        }
    }

    public void stop()
    {
        synchronized (lifecycleLock) {
            if (stopped) {
                return;
            }
            stopped = true;
        }

        log.info("Disconnecting from host on shutdown");
        dispatcher.release();
        if (ownsChannelFactory) {
            channelFactory.close();
        }
        log.info("Host link shut down");
    }

    @Override
    public void close()
    {
        stop();
    }

    /**
     * @throws IllegalStateException if the link is stopped before or while
     *                               the command is in flight
     */
    @Override
    public HostResponse send(HostCommand command)
    {
        checkNotStopped(null);
        try {
            return dispatcher.send(command);
        } catch (HostLinkException e) {
            // A concurrent stop() closes the channel under the call.
            checkNotStopped(e);
            throw e;
        }
    }

    private void checkNotStopped(Throwable cause)
    {
        synchronized (lifecycleLock) {
            if (stopped) {
                throw new IllegalStateException("Host link has been stopped", cause);
            }
        }
    }

    /**
     * Text-rendering front end for agent tools, bound to this link.
     */
    public HostToolInvoker tools()
    {
        return tools;
    }

    public HostLinkConfig config()
    {
        return config;
    }

    public boolean isConnected()
    {
        return connections.isConnected();
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private HostLinkConfig config;
        private HostChannelFactory channelFactory;
        private HostLinkObservabilitySink observabilitySink = new Slf4jHostLinkObservabilitySink();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        public Builder withConfig(HostLinkConfig config)
        {
            this.config = config;
            return this;
        }

        /**
         * Use an externally owned channel factory. The runtime will not close it.
         */
        public Builder withChannelFactory(HostChannelFactory channelFactory)
        {
            this.channelFactory = channelFactory;
            return this;
        }

        /**
         * Defaults to logging through SLF4J. {@code null} silences events.
         */
        public Builder withObservabilitySink(HostLinkObservabilitySink sink)
        {
            this.observabilitySink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
            return this;
        }

        public Builder withClock(MonotonicClock clock)
        {
            this.clock = clock;
            return this;
        }

        public HostLinkRuntime build()
        {
            HostLinkConfig effectiveConfig = config != null ? config : HostLinkConfig.fromEnvironment();
            Objects.requireNonNull(clock, "clock");

            // 1. Transport
            boolean ownsFactory = channelFactory == null;
            HostChannelFactory factory = ownsFactory ? new NettyTcpChannelFactory() : channelFactory;

            // 2. Codec
            ObjectMapper mapper = HostLinkJson.newObjectMapper();
            FrameReader frameReader = new JsonDocumentFrameReader(
                    mapper, effectiveConfig.readChunkSize(), clock, observabilitySink);

            // 3. Connection + dispatch
            ConnectionManager connections = new ConnectionManager(effectiveConfig, factory, observabilitySink);
            CommandDispatcher dispatcher = new CommandDispatcher(
                    connections,
                    frameReader,
                    new CommandEncoder(mapper),
                    new ResponseDecoder(),
                    observabilitySink);

            HostToolInvoker tools = new HostToolInvoker(dispatcher, mapper);

            return new HostLinkRuntime(effectiveConfig, factory, ownsFactory, connections, dispatcher, tools);
        }
    }
}
