package com.questrail.hostlink.transport.tcp.netty;

import com.questrail.hostlink.config.HostAddress;
import com.questrail.hostlink.transport.HostChannel;
import com.questrail.hostlink.transport.HostChannelFactory;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyTcpChannelFactory
 * =============================================================================
 * Netty-backed implementation of the {@link HostChannelFactory} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It opens TCP
 * connections and hands back {@link HostChannel}s that expose a blocking,
 * bounded read/write surface over Netty's event-driven pipeline.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode response documents</li>
 *   <li>Retry or reconnect</li>
 *   <li>Interpret host commands or results</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) MUST
 * NOT escape this package. Inbound buffers are copied into {@code byte[]} on
 * the event loop and released there.
 *
 * <h2>Lifecycle</h2>
 * The factory owns a single-threaded {@link NioEventLoopGroup} shared by every
 * channel it opens; the host link never holds more than one channel at a time.
 * {@link #close()} shuts the group down.
 */
public final class NettyTcpChannelFactory implements HostChannelFactory
{
    private final EventLoopGroup group;
    private final boolean ownsGroup;

    public NettyTcpChannelFactory()
    {
        this(new NioEventLoopGroup(1), true);
    }

    /**
     * Use an externally managed event loop group. The caller remains
     * responsible for shutting it down.
     */
    public NettyTcpChannelFactory(EventLoopGroup group)
    {
        this(group, false);
    }

    private NettyTcpChannelFactory(EventLoopGroup group, boolean ownsGroup)
    {
        this.group = Objects.requireNonNull(group, "group");
        this.ownsGroup = ownsGroup;
    }

    @Override
    public HostChannel open(HostAddress address, Duration connectTimeout) throws IOException
    {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(connectTimeout, "connectTimeout");

        if (group.isShuttingDown()) {
            throw new IOException("Channel factory has been closed");
        }

        final InboundQueue inbound = new InboundQueue();
        final int connectMillis = (int) Math.min(Integer.MAX_VALUE, Math.max(1, connectTimeout.toMillis()));

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectMillis)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler(inbound));
                    }
                });

        ChannelFuture connect = bootstrap.connect(address.toSocketAddress());
        try {
            // Netty enforces CONNECT_TIMEOUT_MILLIS itself; the extra second
            // only covers name resolution and scheduling slack.
            if (!connect.await(connectMillis + 1000L, TimeUnit.MILLISECONDS)) {
                connect.cancel(false);
                throw new ConnectException("Timed out connecting to " + address);
            }
        } catch (InterruptedException e) {
            connect.cancel(false);
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while connecting to " + address);
        }

        if (!connect.isSuccess()) {
            Throwable cause = connect.cause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException("Failed to connect to " + address, cause);
        }

        Channel channel = connect.channel();
        return new NettyTcpHostChannel(channel, inbound);
    }

    @Override
    public void close()
    {
        if (ownsGroup) {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
    }
}
