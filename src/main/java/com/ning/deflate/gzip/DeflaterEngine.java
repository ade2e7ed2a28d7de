package com.ning.deflate.gzip;

import java.nio.ByteBuffer;
import java.util.zip.Deflater;

import com.ning.deflate.CompressionEngine;

/**
 * {@link CompressionEngine} implementation that uses JDK provided
 * {@link Deflater} (in "nowrap" mode, so that no zlib header or checksum
 * is produced) for actual compression. Deflater instances are obtained from,
 * and returned to, a {@link DeflaterRecycler}.
 */
public class DeflaterEngine implements CompressionEngine
{
    /**
     * Default compression level; favors size over speed since content is
     * typically compressed once and transferred over network.
     */
    public final static int DEFAULT_LEVEL = Deflater.BEST_COMPRESSION;

    protected final DeflaterRecycler _recycler;

    protected Deflater _deflater;

    protected boolean _finishCalled;

    public DeflaterEngine() {
        this(DEFAULT_LEVEL);
    }

    public DeflaterEngine(int level) {
        this(level, DeflaterRecycler.instance());
    }

    public DeflaterEngine(int level, DeflaterRecycler recycler)
    {
        if (level != Deflater.DEFAULT_COMPRESSION
                && (level < Deflater.NO_COMPRESSION || level > Deflater.BEST_COMPRESSION)) {
            throw new IllegalArgumentException("Invalid compression level: "+level);
        }
        _recycler = recycler;
        _deflater = recycler.allocDeflater(level);
    }

    /*
    ///////////////////////////////////////////////////////////////////////
    // CompressionEngine impl
    ///////////////////////////////////////////////////////////////////////
     */

    @Override
    public void feed(ByteBuffer input)
    {
        Deflater d = _deflater();
        if (_finishCalled) {
            throw new IllegalStateException("Can not feed more input after finish() has been called");
        }
        d.setInput(input);
    }

    @Override
    public boolean needsMoreInput() {
        return _deflater().needsInput();
    }

    @Override
    public int compressInto(ByteBuffer output)
    {
        Deflater d = _deflater();
        if (!output.hasRemaining()) {
            return 0;
        }
        return d.deflate(output);
    }

    @Override
    public void finish() {
        _deflater().finish();
        _finishCalled = true;
    }

    @Override
    public boolean isFinished() {
        return _deflater().finished();
    }

    @Override
    public long totalInputBytesConsumed() {
        return _deflater().getBytesRead();
    }

    @Override
    public void release()
    {
        Deflater d = _deflater;
        if (d != null) {
            _deflater = null;
            _recycler.releaseDeflater(d);
        }
    }

    /*
    ///////////////////////////////////////////////////////////////////////
    // Internal methods
    ///////////////////////////////////////////////////////////////////////
     */

    protected Deflater _deflater()
    {
        Deflater d = _deflater;
        if (d == null) {
            throw new IllegalStateException(getClass().getName()+" already released");
        }
        return d;
    }
}
