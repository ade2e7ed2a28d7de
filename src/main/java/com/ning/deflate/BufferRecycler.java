package com.ning.deflate;
/*
 *
 * Copyright 2009-2013 Ning, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 *
*/

import java.lang.ref.SoftReference;
import java.nio.ByteBuffer;

/**
 * Simple helper class to encapsulate details of basic buffer
 * recycling scheme, which helps a lot (as per profiling) for
 * relatively short content: allocation of staging buffers is
 * surprisingly costly compared to compressing a few hundred bytes.
 *<p>
 * Instances are <b>not thread-safe</b>; {@link #instance()} gives
 * access to a thread-local instance, which is the expected way to use
 * the recycler with one channel per thread.
 *
 * @author Tatu Saloranta (tatu.saloranta@iki.fi)
 */
public final class BufferRecycler implements BufferPool
{
    /**
     * Maximum number of released buffers retained for reuse.
     */
    public final static int MAX_RETAINED_BUFFERS = 4;

    final protected static ThreadLocal<SoftReference<BufferRecycler>> _recyclerRef
        = new ThreadLocal<SoftReference<BufferRecycler>>();

    private final ByteBuffer[] _buffers = new ByteBuffer[MAX_RETAINED_BUFFERS];

    /**
     * Accessor to get thread-local recycler instance
     */
    public static BufferRecycler instance()
    {
        SoftReference<BufferRecycler> ref = _recyclerRef.get();
        BufferRecycler br = (ref == null) ? null : ref.get();
        if (br == null) {
            br = new BufferRecycler();
            _recyclerRef.set(new SoftReference<BufferRecycler>(br));
        }
        return br;
    }

    /*
    ///////////////////////////////////////////////////////////////////////
    // BufferPool API
    ///////////////////////////////////////////////////////////////////////
     */

    @Override
    public ByteBuffer acquire(int size)
    {
        // smallest retained buffer that is big enough
        int best = -1;
        for (int i = 0; i < _buffers.length; ++i) {
            ByteBuffer buf = _buffers[i];
            if (buf != null && buf.capacity() >= size
                    && (best < 0 || buf.capacity() < _buffers[best].capacity())) {
                best = i;
            }
        }
        if (best < 0) {
            return ByteBuffer.allocate(size);
        }
        ByteBuffer buf = _buffers[best];
        _buffers[best] = null;
        buf.clear();
        buf.limit(size);
        return buf;
    }

    @Override
    public void release(ByteBuffer buffer)
    {
        if (buffer == null) {
            return;
        }
        int smallest = -1;
        for (int i = 0; i < _buffers.length; ++i) {
            ByteBuffer buf = _buffers[i];
            if (buf == null) {
                _buffers[i] = buffer;
                return;
            }
            if (smallest < 0 || buf.capacity() < _buffers[smallest].capacity()) {
                smallest = i;
            }
        }
        // all slots taken: only keep the new one if it is bigger than what we have
        if (buffer.capacity() > _buffers[smallest].capacity()) {
            _buffers[smallest] = buffer;
        }
    }

    /**
     * Accessor mostly useful for testing: number of buffers currently
     * retained for reuse.
     */
    public int retainedCount()
    {
        int count = 0;
        for (ByteBuffer buf : _buffers) {
            if (buf != null) {
                ++count;
            }
        }
        return count;
    }
}
