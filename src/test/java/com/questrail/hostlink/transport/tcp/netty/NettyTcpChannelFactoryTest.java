package com.questrail.hostlink.transport.tcp.netty;

import com.questrail.hostlink.config.HostAddress;
import com.questrail.hostlink.testhost.ScriptedTcpHost;
import com.questrail.hostlink.transport.HostChannel;
import com.questrail.hostlink.transport.ReadResult;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 30, unit = TimeUnit.SECONDS)
final class NettyTcpChannelFactoryTest
{
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final NettyTcpChannelFactory factory = new NettyTcpChannelFactory();
    private ScriptedTcpHost host;

    @AfterEach
    void tearDown() throws IOException
    {
        factory.close();
        if (host != null) {
            host.close();
        }
    }

    @Test
    void readsNeverExceedMaxBytes() throws IOException
    {
        host = new ScriptedTcpHost((command, out) -> out.send("{\"status\":\"success\",\"result\":{\"k\":\"0123456789\"}}"));
        HostChannel channel = factory.open(new HostAddress("127.0.0.1", host.port()), TIMEOUT);

        channel.write("{\"type\":\"ping\",\"params\":{}}".getBytes(StandardCharsets.UTF_8), TIMEOUT);

        ByteArrayOutputStream received = new ByteArrayOutputStream();
        while (received.size() < 48) {
            ReadResult result = channel.read(5, TIMEOUT);
            ReadResult.Data data = assertInstanceOf(ReadResult.Data.class, result);
            assertTrue(data.bytes().length <= 5);
            received.write(data.bytes());
        }

        assertEquals("{\"status\":\"success\",\"result\":{\"k\":\"0123456789\"}}",
                received.toString(StandardCharsets.UTF_8));
        channel.close();
    }

    @Test
    void peerCloseReadsAsClosed() throws IOException
    {
        host = new ScriptedTcpHost((command, out) -> out.close());
        HostChannel channel = factory.open(new HostAddress("127.0.0.1", host.port()), TIMEOUT);

        channel.write("{\"type\":\"ping\"}".getBytes(StandardCharsets.UTF_8), TIMEOUT);

        assertEquals(ReadResult.CLOSED, channel.read(8192, TIMEOUT));
        assertFalse(channel.isOpen());
        channel.close();
    }

    @Test
    void idleReadTimesOut() throws IOException
    {
        host = new ScriptedTcpHost((command, out) -> {});
        HostChannel channel = factory.open(new HostAddress("127.0.0.1", host.port()), TIMEOUT);

        assertEquals(ReadResult.TIMED_OUT, channel.read(8192, Duration.ofMillis(100)));
        assertTrue(channel.isOpen());
        channel.close();
    }

    @Test
    void refusedConnectionIsIOException() throws IOException
    {
        int port;
        try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = probe.getLocalPort();
        }

        assertThrows(IOException.class, () -> factory.open(new HostAddress("127.0.0.1", port), TIMEOUT));
    }

    @Test
    void sharedEventLoopGroupOutlivesTheFactory() throws Exception
    {
        EventLoopGroup shared = new NioEventLoopGroup(1);
        try {
            host = new ScriptedTcpHost((command, out) -> out.send("{\"status\":\"success\"}"));
            NettyTcpChannelFactory borrowing = new NettyTcpChannelFactory(shared);

            HostChannel first = borrowing.open(new HostAddress("127.0.0.1", host.port()), TIMEOUT);
            first.close();
            borrowing.close();

            assertFalse(shared.isShuttingDown());

            NettyTcpChannelFactory again = new NettyTcpChannelFactory(shared);
            HostChannel second = again.open(new HostAddress("127.0.0.1", host.port()), TIMEOUT);
            second.write("{\"type\":\"ping\"}".getBytes(StandardCharsets.UTF_8), TIMEOUT);
            assertInstanceOf(ReadResult.Data.class, second.read(8192, TIMEOUT));
            second.close();
        } finally {
            shared.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
    }

    @Test
    void openAfterCloseIsRejected()
    {
        factory.close();

        assertThrows(IOException.class, () -> factory.open(new HostAddress("127.0.0.1", 9), TIMEOUT));
    }
}
