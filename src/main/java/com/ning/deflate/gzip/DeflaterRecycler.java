package com.ning.deflate.gzip;
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
import java.util.zip.Deflater;

/**
 * Deflate-specific "extension" to {@link com.ning.deflate.BufferRecycler},
 * used for recycling {@link Deflater} instances, which are expensive to
 * construct (and hold native memory).
 *
 * @author Tatu Saloranta (tatu.saloranta@iki.fi)
 */
public final class DeflaterRecycler
{
    final protected static ThreadLocal<SoftReference<DeflaterRecycler>> _recyclerRef
        = new ThreadLocal<SoftReference<DeflaterRecycler>>();

    protected Deflater _deflater;

    /**
     * Accessor to get thread-local recycler instance
     */
    public static DeflaterRecycler instance()
    {
        SoftReference<DeflaterRecycler> ref = _recyclerRef.get();
        DeflaterRecycler br = (ref == null) ? null : ref.get();
        if (br == null) {
            br = new DeflaterRecycler();
            _recyclerRef.set(new SoftReference<DeflaterRecycler>(br));
        }
        return br;
    }

    /*
    ///////////////////////////////////////////////////////////////////////
    // API
    ///////////////////////////////////////////////////////////////////////
     */

    /**
     * @param level Compression level to use, from {@link Deflater#NO_COMPRESSION}
     *   to {@link Deflater#BEST_COMPRESSION}, or {@link Deflater#DEFAULT_COMPRESSION}
     */
    public Deflater allocDeflater(int level)
    {
        Deflater d = _deflater;
        if (d == null) { // important: true means 'dont add zlib header'; gzip has its own
            d = new Deflater(level, true);
        } else {
            _deflater = null;
            d.setLevel(level);
        }
        return d;
    }

    public void releaseDeflater(Deflater d)
    {
        if (d != null) {
            d.reset();
            if (_deflater == null) {
                _deflater = d;
            } else { // already have one cached; free native memory of this one
                d.end();
            }
        }
    }
}
