package com.ning.deflate.gzip;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;

import com.ning.deflate.BufferPool;
import com.ning.deflate.BufferRecycler;
import com.ning.deflate.CompressingChannel;

/**
 * Decorator {@link InputStream} implementation used for reading
 * uncompressed data and compressing it on the fly, such that reads
 * return gzip (or raw deflate) compressed content. Its counterpart is
 * {@link java.util.zip.GZIPInputStream}.
 *<p>
 * Implemented on top of {@link CompressingChannel}, so that content is
 * only read from the wrapped stream as compressed content is requested.
 */
public class GZIPCompressingInputStream extends InputStream
{
    protected final CompressingChannel _channel;

    private byte[] _singleByte = null;

    public GZIPCompressingInputStream(InputStream in) {
        this(in, true);
    }

    /**
     * @param gzip Whether to produce gzip envelope (true) or raw deflate
     *   stream (false)
     */
    public GZIPCompressingInputStream(InputStream in, boolean gzip) {
        this(in, gzip, BufferRecycler.instance());
    }

    /**
     * @param pool Buffer pool instance, for usages where the
     *   caller manages the pool instances
     */
    public GZIPCompressingInputStream(InputStream in, boolean gzip, BufferPool pool) {
        this(new CompressingChannel(Channels.newChannel(in), gzip, pool));
    }

    public GZIPCompressingInputStream(CompressingChannel channel) {
        super();
        _channel = channel;
    }

    /*
    ///////////////////////////////////////////////////////////////////////
    // InputStream impl
    ///////////////////////////////////////////////////////////////////////
     */

    @Override
    public int read() throws IOException
    {
        if (_singleByte == null) {
            _singleByte = new byte[1];
        }
        if (read(_singleByte, 0, 1) < 0) {
            return -1;
        }
        return _singleByte[0] & 0xFF;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException
    {
        if (offset < 0 || length < 0 || length > buffer.length - offset) {
            throw new IndexOutOfBoundsException();
        }
        if (length == 0) {
            return 0;
        }
        ByteBuffer dst = ByteBuffer.wrap(buffer, offset, length);
        int count;
        // only non-blocking sources may return 0; InputStream must block instead
        do {
            count = _channel.read(dst);
        } while (count == 0);
        return count;
    }

    @Override
    public void close() throws IOException {
        _channel.close();
    }

    /*
    ///////////////////////////////////////////////////////////////////////
    // Extended public API
    ///////////////////////////////////////////////////////////////////////
     */

    /**
     * @return Number of uncompressed bytes read from the wrapped stream so far
     */
    public long getBytesRead() {
        return _channel.getBytesRead();
    }

    /**
     * @return Number of compressed bytes returned so far
     */
    public long getBytesWritten() {
        return _channel.getBytesWritten();
    }
}
