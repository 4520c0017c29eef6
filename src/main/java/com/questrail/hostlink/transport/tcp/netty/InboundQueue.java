package com.questrail.hostlink.transport.tcp.netty;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * InboundQueue
 * -----------------------------------------------------------------------------
 * Hand-off between the Netty event loop (producer) and the blocking reader
 * (consumer).
 *
 * <p>Items are delivered in the order the pipeline produced them. After an
 * {@link End} item nothing further is enqueued that the reader will consume.</p>
 */
final class InboundQueue
{
    sealed interface Item permits Chunk, End {}

    record Chunk(byte[] bytes) implements Item {}

    /** End of stream. {@code cause} is null for an orderly close. */
    record End(Throwable cause) implements Item {}

    private final BlockingQueue<Item> items = new LinkedBlockingQueue<>();

    void offerChunk(byte[] bytes)
    {
        items.add(new Chunk(bytes));
    }

    void offerEnd(Throwable cause)
    {
        items.add(new End(cause));
    }

    /**
     * @return the next item, or {@code null} if none arrived within the timeout
     */
    Item poll(long timeoutNanos) throws InterruptedException
    {
        return items.poll(timeoutNanos, TimeUnit.NANOSECONDS);
    }
}
