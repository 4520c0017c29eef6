package com.questrail.hostlink.transport.tcp.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

/**
 * InboundHandler
 * -----------------------------------------------------------------------------
 * Copies every inbound {@link ByteBuf} into a plain {@code byte[]} and forwards
 * it, together with end-of-stream notifications, to an {@link InboundQueue}.
 *
 * <p>{@link SimpleChannelInboundHandler} releases the buffer after
 * {@link #channelRead0}, so no reference-counted object leaves the event
 * loop.</p>
 */
final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
{
    private final InboundQueue inbound;

    InboundHandler(InboundQueue inbound)
    {
        this.inbound = inbound;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
    {
        int readable = msg.readableBytes();
        if (readable == 0) {
            return;
        }
        byte[] bytes = new byte[readable];
        msg.getBytes(msg.readerIndex(), bytes);
        inbound.offerChunk(bytes);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx)
    {
        inbound.offerEnd(null);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        // The failure is queued ahead of the End that channelInactive will add.
        inbound.offerEnd(cause);
        ctx.close();
    }
}
