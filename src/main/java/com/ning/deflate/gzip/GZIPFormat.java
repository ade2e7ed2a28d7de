package com.ning.deflate.gzip;

import java.nio.ByteBuffer;
import java.util.zip.Deflater;

/**
 * Constants and helper methods for writing the gzip envelope
 * (see <a href="http://www.ietf.org/rfc/rfc1952.txt">RFC 1952</a>)
 * around a raw deflate stream.
 */
public final class GZIPFormat
{
    /**
     * GZIP header magic number.
     */
    public final static int GZIP_MAGIC = 0x8b1f;

    public final static int HEADER_LENGTH = 10;

    public final static int TRAILER_LENGTH = 8;

    /**
     * For now, static header seems fine, since JDK default gzip writer
     * does it too:
     */
    final static byte[] DEFAULT_HEADER = new byte[] {
        (byte) GZIP_MAGIC,                // Magic number (short)
        (byte)(GZIP_MAGIC >> 8),          // Magic number (short)
        Deflater.DEFLATED,                // Compression method (CM)
        0,                                // Flags (FLG)
        0,                                // Modification time MTIME (int)
        0,                                // Modification time MTIME (int)
        0,                                // Modification time MTIME (int)
        0,                                // Modification time MTIME (int)
        0,                                // Extra flags (XFLG)
        (byte) 0xff                       // Operating system (OS), UNKNOWN
    };

    private GZIPFormat() { }

    /**
     * @return Copy of the header bytes written by {@link #putHeader}
     */
    public static byte[] defaultHeader() {
        return DEFAULT_HEADER.clone();
    }

    public static void putHeader(ByteBuffer out) {
        out.put(DEFAULT_HEADER);
    }

    /**
     * Method for writing the 8-byte trailer: CRC-32 of uncompressed content,
     * followed by its length modulo 2^32.
     */
    public static void putTrailer(ByteBuffer out, int crc, int uncompressedLength)
    {
        _putInt(out, crc);
        _putInt(out, uncompressedLength);
    }

    /**
     * Stupid GZIP, writes stuff in wrong order (not network, but x86)
     */
    private static void _putInt(ByteBuffer out, int value)
    {
        out.put((byte) value);
        out.put((byte) (value >> 8));
        out.put((byte) (value >> 16));
        out.put((byte) (value >> 24));
    }
}
