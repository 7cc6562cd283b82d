package cinder.protocol.netty;

import cinder.protocol.Command;
import cinder.protocol.ProtocolException;
import cinder.protocol.RespParser;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * Netty decoder turning the inbound byte stream into {@link Command} messages.
 * Partial frames stay in the cumulation buffer until the rest arrives.
 */
public class NettyRespDecoder extends ByteToMessageDecoder {
    private final RespParser parser;

    public NettyRespDecoder() {
        this(new RespParser());
    }

    public NettyRespDecoder(RespParser parser) {
        this.parser = parser;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        Command cmd;
        try {
            while ((cmd = parser.decodeCommand(in)) != null) {
                out.add(cmd);
            }
        } catch (ProtocolException e) {
            // the stream cannot be resynchronised; drop it so nothing is decoded twice
            in.skipBytes(in.readableBytes());
            throw e;
        }
    }
}
