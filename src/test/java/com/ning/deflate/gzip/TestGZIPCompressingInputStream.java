package com.ning.deflate.gzip;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;

import com.ning.deflate.BaseForTests;
import com.ning.deflate.BufferRecycler;
import com.ning.deflate.CompressingChannel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestGZIPCompressingInputStream extends BaseForTests
{
    private final static String INPUT_STR = "Some somewhat short text string -- but enough repetition to overcome shortness of input";
    private final static byte[] INPUT_BYTES = INPUT_STR.getBytes(StandardCharsets.UTF_8);

    @Test
    public void testSimpleCompression() throws IOException
    {
        // multiple staging buffers' worth of content
        byte[] source = constructFluff(140000);
        GZIPCompressingInputStream compIn = new GZIPCompressingInputStream(new ByteArrayInputStream(source));
        byte[] comp = readAll(compIn);
        assertArrayEquals(source, gunzip(comp));
        assertEquals(source.length, compIn.getBytesRead());
        assertEquals(comp.length, compIn.getBytesWritten());
        assertTrue(comp.length < source.length);
    }

    @Test
    public void testSingleByteReads() throws IOException
    {
        GZIPCompressingInputStream compIn = new GZIPCompressingInputStream(new ByteArrayInputStream(INPUT_BYTES));
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        int b;
        while ((b = compIn.read()) >= 0) {
            bytes.write(b);
        }
        compIn.close();
        byte[] comp = bytes.toByteArray();
        assertArrayEquals(GZIPFormat.defaultHeader(), java.util.Arrays.copyOf(comp, GZIPFormat.HEADER_LENGTH));
        assertArrayEquals(INPUT_BYTES, readAll(new GZIPInputStream(new ByteArrayInputStream(comp))));
    }

    @Test
    public void testRawDeflate() throws Exception
    {
        byte[] source = constructFluff(30000);
        byte[] comp = readAll(new GZIPCompressingInputStream(new ByteArrayInputStream(source), false,
                new BufferRecycler()));
        assertArrayEquals(source, inflateRaw(comp));
    }

    @Test
    public void testZeroLengthRead() throws IOException
    {
        GZIPCompressingInputStream compIn = new GZIPCompressingInputStream(new ByteArrayInputStream(INPUT_BYTES));
        assertEquals(0, compIn.read(new byte[10], 5, 0));
        assertArrayEquals(INPUT_BYTES, gunzip(readAll(compIn)));
    }

    @Test
    public void testNeverReturnsZeroForNonEmptyRead() throws IOException
    {
        byte[] source = constructFluff(20000);
        StallingChannel stalling = new StallingChannel(source, 500, 2);
        GZIPCompressingInputStream compIn = new GZIPCompressingInputStream(new CompressingChannel(stalling));
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        byte[] buf = new byte[300];
        int count;
        while ((count = compIn.read(buf)) != -1) {
            assertNotEquals(0, count);
            bytes.write(buf, 0, count);
        }
        compIn.close();
        assertArrayEquals(source, gunzip(bytes.toByteArray()));
        assertTrue(stalling.readCalls > 2);
    }

    @Test
    public void testClosesWrappedStream() throws IOException
    {
        final boolean[] closed = new boolean[1];
        InputStream in = new ByteArrayInputStream(INPUT_BYTES) {
            @Override
            public void close() throws IOException {
                closed[0] = true;
                super.close();
            }
        };
        GZIPCompressingInputStream compIn = new GZIPCompressingInputStream(in);
        compIn.close();
        compIn.close();
        assertTrue(closed[0]);
    }
}
