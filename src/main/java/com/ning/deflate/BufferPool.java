package com.ning.deflate;

import java.nio.ByteBuffer;

/**
 * Capability used by {@link CompressingChannel} for obtaining its
 * staging buffers. Passed explicitly to channels, not looked up globally;
 * {@link NoPool#INSTANCE} is a valid implementation when no pooling is
 * wanted.
 */
public interface BufferPool
{
    /**
     * @param size Number of bytes caller needs
     *
     * @return Buffer with position of 0 and limit of exactly <code>size</code>
     *   (capacity may be bigger)
     */
    public ByteBuffer acquire(int size);

    /**
     * Method called to return a buffer previously obtained with {@link #acquire}.
     * Caller must not access the buffer after this call.
     */
    public void release(ByteBuffer buffer);
}
