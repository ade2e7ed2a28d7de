package com.ning.deflate.util;

import java.nio.ByteBuffer;

/**
 * ByteBufferUtil
 */
public final class ByteBufferUtil {

    private ByteBufferUtil() {
    }

    /**
     * Copies as many bytes as possible from <code>src</code> (between its
     * position and limit) into <code>dest</code>, advancing positions of both.
     * Does not allocate.
     *
     * @return Number of bytes copied
     */
    public static int drain(ByteBuffer src, ByteBuffer dest) {
        int length = Math.min(src.remaining(), dest.remaining());
        if (length <= 0) {
            return 0;
        }
        if (length == src.remaining()) {
            dest.put(src);
            return length;
        }
        // mark.
        int limit = src.limit();

        // only expose what fits.
        src.limit(src.position() + length);
        dest.put(src);

        // reset limit.
        src.limit(limit);
        return length;
    }
}
