package com.ning.deflate;

import java.nio.ByteBuffer;

/**
 * {@link BufferPool} that does no pooling: allocates a new heap buffer
 * for every request and lets garbage collector deal with released ones.
 */
public final class NoPool implements BufferPool
{
    public final static NoPool INSTANCE = new NoPool();

    private NoPool() { }

    @Override
    public ByteBuffer acquire(int size) {
        return ByteBuffer.allocate(size);
    }

    @Override
    public void release(ByteBuffer buffer) { }
}
