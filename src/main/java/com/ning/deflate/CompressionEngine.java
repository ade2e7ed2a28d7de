package com.ning.deflate;

import java.nio.ByteBuffer;

/**
 * Interface for stateful incremental compressors driven by
 * {@link CompressingChannel}. Implementation does the actual entropy
 * coding; caller is responsible for framing, checksums and buffering.
 *<p>
 * Contract: after {@link #feed}, repeated calls to {@link #compressInto}
 * (given room in the output buffer) must eventually result in
 * {@link #needsMoreInput()} returning true; and after {@link #finish},
 * repeated calls must eventually result in {@link #isFinished()}
 * returning true.
 *<p>
 * Note that instances <b>are stateful</b> and hence <b>not thread-safe</b>.
 *
 * @see com.ning.deflate.gzip.DeflaterEngine
 */
public interface CompressionEngine
{
    /**
     * Method called to give more uncompressed content to compress. Engine
     * may hold on to the buffer (and advance its position) until
     * {@link #needsMoreInput()} returns true; caller must not modify
     * contents before that.
     *
     * @throws IllegalStateException if called after {@link #finish}
     */
    public void feed(ByteBuffer input);

    /**
     * @return True if all content passed via {@link #feed} has been consumed
     */
    public boolean needsMoreInput();

    /**
     * Method called to compress pending input into given buffer, starting
     * at its current position and advancing it.
     *
     * @return Number of compressed bytes written; may be 0
     */
    public int compressInto(ByteBuffer output);

    /**
     * Method called to indicate that no more input will be fed; remaining
     * state is flushed by subsequent {@link #compressInto} calls.
     */
    public void finish();

    public boolean isFinished();

    /**
     * Accessor for total number of uncompressed bytes consumed so far.
     * This is the authoritative count used for gzip trailer.
     */
    public long totalInputBytesConsumed();

    /**
     * Method called once engine is no longer needed, to free (or recycle)
     * underlying resources. Engine may not be used after this call.
     */
    public void release();
}
