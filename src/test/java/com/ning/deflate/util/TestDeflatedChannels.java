package com.ning.deflate.util;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.ReadableByteChannel;

import com.ning.deflate.BaseForTests;
import com.ning.deflate.BufferRecycler;
import com.ning.deflate.CompressingChannel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestDeflatedChannels extends BaseForTests
{
    @Test
    public void testDeflatedDefaultsToGzip() throws IOException
    {
        byte[] input = constructFluff(25000);
        CompressingChannel ch = DeflatedChannels.deflated(new ChunkedChannel(input, 333));
        assertTrue(ch.isGzip());
        assertArrayEquals(input, gunzip(readAll(ch, 512)));
    }

    @Test
    public void testDeflatedRaw() throws Exception
    {
        byte[] input = constructFluff(25000);
        CompressingChannel ch = DeflatedChannels.deflated(new ChunkedChannel(input, 333), false);
        assertFalse(ch.isGzip());
        assertArrayEquals(input, inflateRaw(readAll(ch, 512)));
    }

    @Test
    public void testTransferTo() throws IOException
    {
        byte[] input = constructFluff(60000);
        ChunkedChannel source = new ChunkedChannel(input, 4096);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (CompressingChannel ch = DeflatedChannels.deflated(source, true, BufferRecycler.instance())) {
            long count = DeflatedChannels.transferTo(ch, Channels.newChannel(bytes));
            assertEquals(bytes.size(), count);
            assertEquals(input.length, ch.getBytesRead());
            assertSame(source, ch.getUnderlyingChannel());
        }
        assertEquals(1, source.closeCalls);
        assertArrayEquals(input, gunzip(bytes.toByteArray()));
    }

    @Test
    public void testComposesWithStreamConsumers() throws IOException
    {
        byte[] input = constructFluff(10000);
        ReadableByteChannel ch = DeflatedChannels.deflated(Channels.newChannel(new ByteArrayInputStream(input)));
        assertArrayEquals(input, gunzip(readAll(Channels.newInputStream(ch))));
    }

    @Test
    public void testDrain()
    {
        ByteBuffer src = ByteBuffer.wrap(new byte[] { 1, 2, 3, 4, 5 });
        ByteBuffer dst = ByteBuffer.allocate(3);
        assertEquals(3, ByteBufferUtil.drain(src, dst));
        assertEquals(3, src.position());
        assertEquals(5, src.limit());
        assertEquals(0, ByteBufferUtil.drain(src, dst));
        dst.clear();
        assertEquals(2, ByteBufferUtil.drain(src, dst));
        assertFalse(src.hasRemaining());
        assertEquals(4, dst.get(0));
    }
}
