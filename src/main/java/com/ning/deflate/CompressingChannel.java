package com.ning.deflate;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ReadableByteChannel;
import java.util.zip.CRC32;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ning.deflate.gzip.DeflaterEngine;
import com.ning.deflate.gzip.GZIPFormat;
import com.ning.deflate.util.ByteBufferUtil;

/**
 * Decorator {@link ReadableByteChannel} implementation that reads uncompressed
 * content from the underlying channel and returns it compressed, either as
 * a full gzip envelope (header, deflate stream, trailer) or as raw
 * deflate stream. Compression is done incrementally, on demand: nothing
 * is read from the underlying channel until caller asks for more compressed
 * content, and memory usage is bounded by three staging buffers that are
 * obtained from a {@link BufferPool} on construction and returned on
 * {@link #close}.
 *<p>
 * Instances are <b>not thread-safe</b>: only one read may be in progress
 * at any given time. The only blocking call made is the read from the
 * underlying channel.
 *<p>
 * If destination buffer has no room, {@link #read} returns 0 without
 * reading anything, as per {@link ReadableByteChannel} contract.
 *
 * @see com.ning.deflate.util.DeflatedChannels
 */
public class CompressingChannel implements ReadableByteChannel
{
    private final static Logger LOG = LoggerFactory.getLogger(CompressingChannel.class);

    /**
     * Size of the input and compressed-output staging buffers, unless
     * explicitly specified.
     */
    public final static int DEFAULT_CHUNK_SIZE = 8192;

    enum State {
        STREAMING, FINISHING, EXHAUSTED;
    }

    /**
     * Channel from which uncompressed content is read
     */
    protected final ReadableByteChannel _source;

    protected final boolean _gzip;

    protected final BufferPool _pool;

    protected final CompressionEngine _engine;

    protected final CRC32 _crc = new CRC32();

    /**
     * Number of bytes staging buffers are limited to; pooled buffers may
     * have bigger capacity.
     */
    protected final int _chunkSize;

    /**
     * Buffer into which uncompressed content is read; owned by the engine
     * until it reports it needs more input.
     */
    protected ByteBuffer _input;

    /**
     * Compressed content not yet returned to caller; kept ready for
     * reading (flipped) between calls. Also holds the gzip header
     * initially.
     */
    protected ByteBuffer _compressed;

    /**
     * Gzip trailer, empty until engine has finished.
     */
    protected ByteBuffer _trailer;

    protected State _state = State.STREAMING;

    protected boolean _closed;

    protected long _bytesRead;

    protected long _bytesWritten;

    /*
    ///////////////////////////////////////////////////////////////////////
    // Construction
    ///////////////////////////////////////////////////////////////////////
     */

    public CompressingChannel(ReadableByteChannel source) {
        this(source, true);
    }

    /**
     * @param gzip Whether to produce gzip envelope (true) or raw deflate
     *   stream (false)
     */
    public CompressingChannel(ReadableByteChannel source, boolean gzip) {
        this(source, gzip, NoPool.INSTANCE);
    }

    public CompressingChannel(ReadableByteChannel source, boolean gzip, BufferPool pool) {
        this(source, gzip, pool, new DeflaterEngine(), DEFAULT_CHUNK_SIZE);
    }

    /**
     * @param source Channel to read uncompressed content from
     * @param gzip Whether to produce gzip envelope (true) or raw deflate
     *   stream (false)
     * @param pool Pool from which staging buffers are acquired
     * @param engine Engine to use for compression; this channel takes
     *   ownership and releases it on close
     * @param chunkSize Size of input and output staging buffers
     */
    public CompressingChannel(ReadableByteChannel source, boolean gzip, BufferPool pool,
            CompressionEngine engine, int chunkSize)
    {
        if (source == null) {
            throw new IllegalArgumentException("Source channel can not be null");
        }
        if (pool == null || engine == null) {
            throw new IllegalArgumentException("Buffer pool and compression engine can not be null");
        }
        if (chunkSize < GZIPFormat.HEADER_LENGTH) {
            throw new IllegalArgumentException("Chunk size must be at least "+GZIPFormat.HEADER_LENGTH+", was: "+chunkSize);
        }
        _source = source;
        _gzip = gzip;
        _pool = pool;
        _engine = engine;
        _chunkSize = chunkSize;
        try {
            _input = pool.acquire(chunkSize);
            _compressed = pool.acquire(chunkSize);
            _trailer = pool.acquire(GZIPFormat.TRAILER_LENGTH);
        } catch (RuntimeException e) {
            _releaseBuffers();
            engine.release();
            throw e;
        }
        if (gzip) {
            GZIPFormat.putHeader(_compressed);
        }
        _compressed.flip();
        _trailer.flip();
    }

    /*
    ///////////////////////////////////////////////////////////////////////
    // ReadableByteChannel impl
    ///////////////////////////////////////////////////////////////////////
     */

    @Override
    public int read(ByteBuffer dst) throws IOException
    {
        _checkNotClosed();
        if (!dst.hasRemaining()) {
            return 0;
        }
        if (_state != State.STREAMING) {
            return _readFinished(dst);
        }
        // first: anything produced (or producible) from earlier input?
        _compressPending();
        if (_compressed.hasRemaining()) {
            return _drain(_compressed, dst);
        }
        while (true) {
            _input.clear();
            _input.limit(_chunkSize);
            int count = _source.read(_input);
            // engine may still hold this buffer: only expose what was just read
            _input.flip();
            if (count < 0) {
                _state = State.FINISHING;
                _engine.finish();
                return _readFinished(dst);
            }
            if (count == 0) { // non-blocking source with nothing available
                return 0;
            }
            if (_engine.isFinished()) {
                throw new IllegalStateException("Compression engine finished before end of input");
            }
            _bytesRead += count;
            _updateChecksum(_input);
            _engine.feed(_input);

            int delivered = 0;
            while (!_engine.needsMoreInput() && dst.hasRemaining()) {
                _compactCompressed();
                _engine.compressInto(_compressed);
                _compressed.flip();
                delivered += _drain(_compressed, dst);
            }
            if (delivered > 0 || !dst.hasRemaining()) {
                return delivered;
            }
        }
    }

    @Override
    public boolean isOpen() {
        return !_closed;
    }

    /**
     * Method that releases staging buffers and compression engine, and
     * closes the underlying channel. Calling it more than once has no effect.
     */
    @Override
    public void close() throws IOException
    {
        if (_closed) {
            return;
        }
        _closed = true;
        if (_state != State.EXHAUSTED) {
            LOG.debug("Closing compressing channel before end of content ({} bytes read, {} bytes written)",
                    _bytesRead, _bytesWritten);
        }
        try {
            _releaseBuffers();
            _engine.release();
        } finally {
            _source.close();
        }
    }

    /*
    ///////////////////////////////////////////////////////////////////////
    // Extended public API
    ///////////////////////////////////////////////////////////////////////
     */

    public boolean isGzip() {
        return _gzip;
    }

    /**
     * @return Number of uncompressed bytes read from the underlying channel so far
     */
    public long getBytesRead() {
        return _bytesRead;
    }

    /**
     * @return Number of compressed bytes (including gzip header and trailer,
     *   if any) returned to callers so far
     */
    public long getBytesWritten() {
        return _bytesWritten;
    }

    /**
     * Method that can be used to find underlying {@link ReadableByteChannel} that
     * we read uncompressed content from.
     * Will never return null; although underlying channel may be closed
     * (if this channel has been closed).
     */
    public ReadableByteChannel getUnderlyingChannel() {
        return _source;
    }

    /*
    ///////////////////////////////////////////////////////////////////////
    // Internal methods
    ///////////////////////////////////////////////////////////////////////
     */

    /**
     * Compresses input engine still holds from an earlier call (one where
     * destination filled up first) into free space of the output buffer.
     */
    protected void _compressPending()
    {
        if (_engine.needsMoreInput()) {
            return;
        }
        _compactCompressed();
        while (!_engine.needsMoreInput() && _compressed.hasRemaining()) {
            _engine.compressInto(_compressed);
        }
        _compressed.flip();
    }

    /**
     * Handling once underlying channel has reported end-of-input: complete
     * compression if not yet done, then return compressed content, then
     * trailer; and once all is returned, report end-of-stream.
     */
    protected int _readFinished(ByteBuffer dst)
    {
        if (_state == State.FINISHING) {
            _driveFinish();
        }
        int count = _drain(_compressed, dst);
        if (!_compressed.hasRemaining()) {
            count += _drain(_trailer, dst);
        }
        return (count == 0) ? -1 : count;
    }

    /**
     * Flushes engine into the output buffer until it is finished or buffer
     * is full; in latter case continued on next read.
     */
    protected void _driveFinish()
    {
        _compactCompressed();
        while (!_engine.isFinished() && _compressed.hasRemaining()) {
            _engine.compressInto(_compressed);
        }
        _compressed.flip();
        if (_engine.isFinished()) {
            if (_gzip) {
                _trailer.clear();
                GZIPFormat.putTrailer(_trailer, (int) _crc.getValue(), (int) _engine.totalInputBytesConsumed());
                _trailer.flip();
            }
            _state = State.EXHAUSTED;
            LOG.debug("Compression complete: {} bytes of input, {} bytes of output pending delivery",
                    _engine.totalInputBytesConsumed(), _bytesWritten + _compressed.remaining() + _trailer.remaining());
        }
    }

    /**
     * Prepares output buffer for appending, keeping undelivered bytes and
     * limiting free space to the chunk size.
     */
    private void _compactCompressed()
    {
        _compressed.compact();
        _compressed.limit(_chunkSize);
    }

    protected int _drain(ByteBuffer src, ByteBuffer dst)
    {
        int count = ByteBufferUtil.drain(src, dst);
        _bytesWritten += count;
        return count;
    }

    private void _updateChecksum(ByteBuffer input)
    {
        int pos = input.position();
        _crc.update(input);
        input.position(pos);
    }

    private void _releaseBuffers()
    {
        ByteBuffer buf = _input;
        if (buf != null) {
            _input = null;
            _pool.release(buf);
        }
        buf = _compressed;
        if (buf != null) {
            _compressed = null;
            _pool.release(buf);
        }
        buf = _trailer;
        if (buf != null) {
            _trailer = null;
            _pool.release(buf);
        }
    }

    protected void _checkNotClosed() throws IOException
    {
        if (_closed) {
            throw new ClosedChannelException();
        }
    }
}
