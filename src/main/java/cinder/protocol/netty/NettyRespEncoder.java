package cinder.protocol.netty;

import cinder.protocol.Reply;
import cinder.protocol.RespEncoder;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

/**
 * Encodes outbound {@link Reply} messages into RESP.
 */
@ChannelHandler.Sharable
public class NettyRespEncoder extends MessageToByteEncoder<Reply> {

    @Override
    protected void encode(ChannelHandlerContext ctx, Reply msg, ByteBuf out) {
        RespEncoder.encode(msg, out);
    }
}
