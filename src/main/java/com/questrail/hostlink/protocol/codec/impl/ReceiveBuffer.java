package com.questrail.hostlink.protocol.codec.impl;

import java.util.Arrays;

/**
 * Growable byte accumulator for one receive operation.
 *
 * <p>Exposes its backing array so decode attempts can parse in place instead
 * of copying the whole buffer on every chunk.</p>
 */
final class ReceiveBuffer
{
    private byte[] bytes;
    private int size;

    ReceiveBuffer(int initialCapacity)
    {
        this.bytes = new byte[Math.max(16, initialCapacity)];
    }

    void append(byte[] chunk)
    {
        ensureCapacity(size + chunk.length);
        System.arraycopy(chunk, 0, bytes, size, chunk.length);
        size += chunk.length;
    }

    /** Backing array; only the first {@link #size()} bytes are valid. */
    byte[] array()
    {
        return bytes;
    }

    int size()
    {
        return size;
    }

    boolean isEmpty()
    {
        return size == 0;
    }

    private void ensureCapacity(int required)
    {
        if (required < 0) {
            throw new IllegalStateException("Receive buffer exceeds 2 GiB");
        }
        if (required > bytes.length) {
            int grown = Math.max(required, bytes.length * 2);
            if (grown < 0) {
                grown = Integer.MAX_VALUE - 8;
            }
            bytes = Arrays.copyOf(bytes, grown);
        }
    }
}
