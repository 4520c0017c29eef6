package com.questrail.hostlink.transport.tcp.netty;

import com.questrail.hostlink.transport.HostChannel;
import com.questrail.hostlink.transport.ReadResult;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyTcpHostChannel
 * -----------------------------------------------------------------------------
 * Blocking {@link HostChannel} view of one Netty TCP channel.
 *
 * <p>Inbound chunks arrive at whatever size Netty's receive allocator chose.
 * A chunk larger than the caller's {@code maxBytes} is split; the remainder is
 * returned by the next read before anything new is taken from the queue.</p>
 *
 * <p>Not thread-safe: the host link serializes every read and write.</p>
 */
final class NettyTcpHostChannel implements HostChannel
{
    private static final long CLOSE_TIMEOUT_MILLIS = 2000;

    private final Channel channel;
    private final InboundQueue inbound;

    private byte[] pending;
    private int pendingOffset;

    private boolean ended;
    private Throwable endCause;

    NettyTcpHostChannel(Channel channel, InboundQueue inbound)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.inbound = Objects.requireNonNull(inbound, "inbound");
    }

    @Override
    public void write(byte[] payload, Duration timeout) throws IOException
    {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(timeout, "timeout");

        ChannelFuture future = channel.writeAndFlush(Unpooled.wrappedBuffer(payload));
        try {
            if (!future.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new SocketTimeoutException("Timed out writing " + payload.length + " bytes to host");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while writing to host");
        }

        if (!future.isSuccess()) {
            throw asIOException("Write to host failed", future.cause());
        }
    }

    @Override
    public ReadResult read(int maxBytes, Duration timeout) throws IOException
    {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        Objects.requireNonNull(timeout, "timeout");

        if (pending != null) {
            return takePending(maxBytes);
        }
        if (ended) {
            return endResult();
        }

        final InboundQueue.Item item;
        try {
            item = inbound.poll(Math.max(0, timeout.toNanos()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while reading from host");
        }

        if (item == null) {
            return ReadResult.TIMED_OUT;
        }
        if (item instanceof InboundQueue.Chunk chunk) {
            pending = chunk.bytes();
            pendingOffset = 0;
            return takePending(maxBytes);
        }

        InboundQueue.End end = (InboundQueue.End) item;
        ended = true;
        endCause = end.cause();
        return endResult();
    }

    @Override
    public boolean isOpen()
    {
        return !ended && channel.isActive();
    }

    @Override
    public void close() throws IOException
    {
        ChannelFuture future = channel.close();
        if (!future.awaitUninterruptibly(CLOSE_TIMEOUT_MILLIS)) {
            throw new IOException("Timed out closing host channel");
        }
        if (!future.isSuccess()) {
            throw asIOException("Failed to close host channel", future.cause());
        }
    }

    private ReadResult takePending(int maxBytes)
    {
        int available = pending.length - pendingOffset;
        int n = Math.min(available, maxBytes);

        byte[] out = (pendingOffset == 0 && n == pending.length)
                ? pending
                : Arrays.copyOfRange(pending, pendingOffset, pendingOffset + n);

        pendingOffset += n;
        if (pendingOffset >= pending.length) {
            pending = null;
            pendingOffset = 0;
        }
        return ReadResult.data(out);
    }

    private ReadResult endResult() throws IOException
    {
        if (endCause != null) {
            throw asIOException("Connection to host lost", endCause);
        }
        return ReadResult.CLOSED;
    }

    private static IOException asIOException(String message, Throwable cause)
    {
        if (cause instanceof IOException io) {
            return io;
        }
        return new IOException(message, cause);
    }
}
