package com.rex.tunnel.relay;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import org.junit.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class RelayHandlerTest {

    @Test
    public void testRelayBuffer() throws Exception {
        EmbeddedChannel inbound = new EmbeddedChannel();
        EmbeddedChannel outbound = new EmbeddedChannel();
        RelayHandler relay = new RelayHandler(outbound);

        inbound.pipeline().addLast(relay);
        inbound.writeInbound(Unpooled.wrappedBuffer("HelloWorld!".getBytes()));

        ByteBuf frame = outbound.readOutbound();
        assertEquals("HelloWorld!", StandardCharsets.UTF_8
                .newDecoder()
                .decode(frame.nioBuffer())
                .toString());
    }

    @Test
    public void testLargeBuffer() throws Exception {
        EmbeddedChannel inbound = new EmbeddedChannel();
        EmbeddedChannel outbound = new EmbeddedChannel();
        RelayHandler relay = new RelayHandler(outbound);

        inbound.pipeline().addLast(relay);

        StringBuffer sb = new StringBuffer();
        int total = 65536 * 2;
        for (int i = 0; i < total; i++) {
            sb.append((char) ((i % 26) + 'A'));
        }
        inbound.writeInbound(Unpooled.wrappedBuffer(sb.toString().getBytes()));

        ByteBuf buf = outbound.readOutbound();
        ByteBuffer data = buf.nioBuffer();
        assertEquals(total, buf.readableBytes());

        int idx = 0; // The first byte
        assertEquals(((idx) % 26) + 'A', data.get(idx));

        idx = data.remaining() - 1; // The last byte
        assertEquals(((idx) % 26) + 'A', data.get(idx));

        Random rand = new Random();
        for (int i = 0; i < 9; i++) {
            idx = rand.nextInt(total);
            assertEquals((idx % 26) + 'A', data.get(idx));
        }

        inbound.close();
        outbound.close();
    }

    @Test
    public void testOutputClosed() throws Exception {
        EmbeddedChannel inbound = new EmbeddedChannel();
        EmbeddedChannel outbound = new EmbeddedChannel();
        inbound.pipeline().addLast(new RelayHandler(outbound));
        outbound.close();

        ByteBuf data = Unpooled.wrappedBuffer("HelloWorld!".getBytes());
        inbound.writeInbound(data);
        assertEquals(0, data.refCnt());
    }

    @Test
    public void testInputShutdown() throws Exception {
        RelayHandler.Listener listener = mock(RelayHandler.Listener.class);
        EmbeddedChannel inbound = new EmbeddedChannel();
        EmbeddedChannel outbound = new EmbeddedChannel();
        inbound.pipeline().addLast(new RelayHandler(outbound, listener));

        inbound.pipeline().fireUserEventTriggered(ChannelInputShutdownEvent.INSTANCE);
        verify(listener).onInputShutdown(inbound);
        verify(listener, never()).onFailure(any(), any());
        assertTrue(outbound.isActive());
    }

    @Test
    public void testInputClosed() throws Exception {
        EmbeddedChannel inbound = new EmbeddedChannel();
        EmbeddedChannel outbound = new EmbeddedChannel();
        inbound.pipeline().addLast(new RelayHandler(outbound));

        inbound.close();
        outbound.runPendingTasks();
        assertFalse(outbound.isActive());
    }

    @Test
    public void testCaughtException() throws Exception {
        RelayHandler.Listener listener = mock(RelayHandler.Listener.class);
        EmbeddedChannel inbound = new EmbeddedChannel();
        EmbeddedChannel outbound = new EmbeddedChannel();
        RuntimeException cause = new RuntimeException("Mock");

        inbound.pipeline()
                .addLast(new RelayHandler(outbound, listener))
                .fireExceptionCaught(cause);
        verify(listener).onFailure(eq(inbound), eq(cause));
        assertFalse(inbound.isActive());
        assertFalse(outbound.isActive());
    }
}
