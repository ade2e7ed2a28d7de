package com.ning.deflate.util;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;

import com.ning.deflate.BufferPool;
import com.ning.deflate.CompressingChannel;
import com.ning.deflate.NoPool;

/**
 * Simple helper class with static factory methods for wrapping channels
 * so that they return compressed content, as well as other convenience
 * methods for dealing with channels.
 */
public class DeflatedChannels
{
    /**
     * Size of the intermediate buffer used by {@link #transferTo}.
     */
    protected final static int TRANSFER_BUFFER_SIZE = 16000;

    private DeflatedChannels() { }

    /**
     * Wraps given channel so that reads return gzip-compressed content.
     */
    public static CompressingChannel deflated(ReadableByteChannel source) {
        return new CompressingChannel(source, true);
    }

    /**
     * @param gzip Whether to produce gzip envelope (true) or raw deflate stream (false)
     */
    public static CompressingChannel deflated(ReadableByteChannel source, boolean gzip) {
        return new CompressingChannel(source, gzip);
    }

    public static CompressingChannel deflated(ReadableByteChannel source, boolean gzip, BufferPool pool) {
        return new CompressingChannel(source, gzip, pool);
    }

    /**
     * Convenience method that reads all content available from given source
     * and writes it to target, without closing either.
     *
     * @return Number of bytes transferred
     */
    public static long transferTo(ReadableByteChannel source, WritableByteChannel target)
        throws IOException
    {
        return transferTo(source, target, NoPool.INSTANCE);
    }

    public static long transferTo(ReadableByteChannel source, WritableByteChannel target, BufferPool pool)
        throws IOException
    {
        ByteBuffer buffer = pool.acquire(TRANSFER_BUFFER_SIZE);
        try {
            long total = 0L;
            int count;
            while ((count = source.read(buffer)) >= 0) {
                buffer.flip();
                while (buffer.hasRemaining()) {
                    target.write(buffer);
                }
                buffer.clear();
                total += count;
            }
            return total;
        } finally {
            pool.release(buffer);
        }
    }
}
