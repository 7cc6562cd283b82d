package cinder.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;

/**
 * Writes {@link Reply} values in RESP2 wire format.
 */
public final class RespEncoder {
    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_ARRAY = "*-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private RespEncoder() { }

    public static void encode(Reply reply, ByteBuf out) {
        switch (reply.type()) {
            case STATUS:
                out.writeByte('+');
                out.writeCharSequence(((Reply.StatusReply) reply).getMessage(), StandardCharsets.UTF_8);
                out.writeBytes(CRLF);
                break;
            case ERROR:
                out.writeByte('-');
                out.writeCharSequence(((Reply.ErrorReply) reply).line(), StandardCharsets.UTF_8);
                out.writeBytes(CRLF);
                break;
            case INTEGER:
                out.writeByte(':');
                ByteBufUtil.writeAscii(out, Long.toString(((Reply.IntegerReply) reply).getValue()));
                out.writeBytes(CRLF);
                break;
            case BULK: {
                byte[] value = ((Reply.BulkReply) reply).getValue();
                if (value == null) {
                    out.writeBytes(NULL_BULK);
                } else {
                    out.writeByte('$');
                    ByteBufUtil.writeAscii(out, Integer.toString(value.length));
                    out.writeBytes(CRLF);
                    out.writeBytes(value);
                    out.writeBytes(CRLF);
                }
                break;
            }
            case ARRAY: {
                Reply.ArrayReply array = (Reply.ArrayReply) reply;
                if (array.isNull()) {
                    out.writeBytes(NULL_ARRAY);
                } else {
                    out.writeByte('*');
                    ByteBufUtil.writeAscii(out, Integer.toString(array.getItems().size()));
                    out.writeBytes(CRLF);
                    for (Reply item : array.getItems()) {
                        encode(item, out);
                    }
                }
                break;
            }
            default:
                throw new IllegalArgumentException("Unknown reply type: " + reply.type());
        }
    }

    public static byte[] encode(Reply reply) {
        ByteBuf buf = Unpooled.buffer();
        try {
            encode(reply, buf);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }
}
