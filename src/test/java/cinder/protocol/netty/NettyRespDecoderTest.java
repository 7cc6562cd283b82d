package cinder.protocol.netty;

import cinder.protocol.Command;
import cinder.protocol.ProtocolException;
import cinder.protocol.RespParser;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class NettyRespDecoderTest {

    private static void write(EmbeddedChannel channel, String s) {
        channel.writeInbound(Unpooled.copiedBuffer(s, StandardCharsets.UTF_8));
    }

    @Test
    public void testFragmentedPacket() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());

        write(channel, "*3\r\n$3\r\nSE");
        assertNull(channel.readInbound());

        write(channel, "T\r\n$3\r\nkey\r\n$3\r\nval\r\n");
        Command cmd = channel.readInbound();
        assertNotNull(cmd);
        assertEquals("SET", cmd.getName());
        assertEquals("key", cmd.argString(0));
        assertEquals("val", cmd.argString(1));
        assertFalse(channel.finish());
    }

    @Test
    public void testPipelinedCommandsInOneRead() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        write(channel, "*1\r\n$4\r\nPING\r\nECHO hi\r\n*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");

        assertEquals("PING", ((Command) channel.readInbound()).getName());
        assertEquals("ECHO", ((Command) channel.readInbound()).getName());
        assertEquals("GET", ((Command) channel.readInbound()).getName());
        assertNull(channel.readInbound());
        channel.finish();
    }

    @Test
    public void testLargePayloadHeaderWaitsForContent() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        write(channel, "*1\r\n$1000000\r\n");
        assertNull(channel.readInbound());
        assertTrue(channel.isOpen());
        channel.finishAndReleaseAll();
    }

    @Test
    public void testMalformedInputRaisesProtocolException() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        assertThrows(ProtocolException.class, () -> write(channel, "*2\r\n$3\r\nSET\r\n$garbage\r\n"));
        channel.finishAndReleaseAll();
    }

    @Test
    public void testCommandsBeforeAnErrorAreStillDelivered() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        assertThrows(ProtocolException.class, () -> write(channel, "*1\r\n$4\r\nPING\r\n*1\r\n:5\r\n"));
        Command first = channel.readInbound();
        assertEquals("PING", first.getName());
        channel.finishAndReleaseAll();
    }

    @Test
    public void testConfiguredInlineLimit() {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder(new RespParser(1024, 8, 16)));
        assertThrows(ProtocolException.class, () -> write(channel, "PING PING PING"));
        channel.finishAndReleaseAll();
    }
}
