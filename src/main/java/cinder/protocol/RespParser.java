package cinder.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Restartable RESP2 decoder. Every method either consumes one complete frame or returns
 * {@code null} leaving the reader index where it was, so it can be called again once more
 * bytes have arrived. Input that can never become valid raises {@link ProtocolException}.
 */
public class RespParser {
    public static final int DEFAULT_MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int DEFAULT_MAX_INLINE_LENGTH = 64 * 1024;
    public static final int DEFAULT_MAX_MULTIBULK_LENGTH = 1024 * 1024;
    static final int MAX_NESTING = 64;

    private final int maxBulkLength;
    private final int maxInlineLength;
    private final int maxMultiBulkLength;

    public RespParser() {
        this(DEFAULT_MAX_BULK_LENGTH, DEFAULT_MAX_INLINE_LENGTH, DEFAULT_MAX_MULTIBULK_LENGTH);
    }

    public RespParser(int maxBulkLength, int maxInlineLength, int maxMultiBulkLength) {
        this.maxBulkLength = maxBulkLength;
        this.maxInlineLength = maxInlineLength;
        this.maxMultiBulkLength = maxMultiBulkLength;
    }

    /**
     * Decodes one value of any reply type.
     */
    public Reply parse(ByteBuf in) {
        Cursor c = new Cursor(in.readerIndex());
        Reply reply = readValue(in, c, 0);
        if (reply == null) return null;
        in.readerIndex(c.pos);
        return reply;
    }

    /**
     * Decodes the next request, either a multi-bulk array of bulk strings or an inline line.
     * Empty frames are consumed and skipped.
     */
    public Command decodeCommand(ByteBuf in) {
        while (in.isReadable()) {
            Cursor c = new Cursor(in.readerIndex());
            List<byte[]> parts = in.getByte(c.pos) == '*' ? readMultiBulk(in, c) : readInline(in, c);
            if (parts == null) return null;
            in.readerIndex(c.pos);
            if (!parts.isEmpty()) return Command.of(parts);
        }
        return null;
    }

    /**
     * Decodes every complete request currently buffered.
     */
    public List<Command> decodeCommands(ByteBuf in) {
        List<Command> out = new ArrayList<>();
        Command cmd;
        while ((cmd = decodeCommand(in)) != null) {
            out.add(cmd);
        }
        return out;
    }

    private Reply readValue(ByteBuf in, Cursor c, int depth) {
        if (c.pos >= in.writerIndex()) return null;
        byte type = in.getByte(c.pos);
        c.pos++;
        switch (type) {
            case '+': {
                String line = readLine(in, c);
                return line == null ? null : Reply.status(line);
            }
            case '-': {
                String line = readLine(in, c);
                return line == null ? null : Reply.error(line);
            }
            case ':': {
                String line = readLine(in, c);
                return line == null ? null : Reply.integer(parseNumber(line, "invalid integer"));
            }
            case '$': {
                String line = readLine(in, c);
                if (line == null) return null;
                long len = parseNumber(line, "invalid bulk length");
                if (len == -1) return Reply.nullBulk();
                checkBulkLength(len);
                byte[] data = readBulkBody(in, c, (int) len);
                return data == null ? null : Reply.bulk(data);
            }
            case '*': {
                String line = readLine(in, c);
                if (line == null) return null;
                long n = parseNumber(line, "invalid multibulk length");
                if (n == -1) return Reply.nullArray();
                if (n < 0 || n > maxMultiBulkLength) throw new ProtocolException("invalid multibulk length");
                if (depth >= MAX_NESTING) throw new ProtocolException("nesting too deep");
                List<Reply> items = new ArrayList<>((int) Math.min(n, 1024));
                for (long i = 0; i < n; i++) {
                    Reply item = readValue(in, c, depth + 1);
                    if (item == null) return null;
                    items.add(item);
                }
                return Reply.array(items);
            }
            default:
                throw new ProtocolException("unexpected type byte '" + printable(type) + "'");
        }
    }

    private List<byte[]> readMultiBulk(ByteBuf in, Cursor c) {
        c.pos++;
        String header = readLine(in, c);
        if (header == null) return null;
        long n = parseNumber(header, "invalid multibulk length");
        if (n < -1 || n > maxMultiBulkLength) throw new ProtocolException("invalid multibulk length");
        if (n <= 0) return Collections.emptyList();

        List<byte[]> parts = new ArrayList<>((int) Math.min(n, 1024));
        for (long i = 0; i < n; i++) {
            if (c.pos >= in.writerIndex()) return null;
            byte type = in.getByte(c.pos);
            if (type != '$') throw new ProtocolException("expected '$', got '" + printable(type) + "'");
            c.pos++;
            String line = readLine(in, c);
            if (line == null) return null;
            long len = parseNumber(line, "invalid bulk length");
            checkBulkLength(len);
            byte[] data = readBulkBody(in, c, (int) len);
            if (data == null) return null;
            parts.add(data);
        }
        return parts;
    }

    private List<byte[]> readInline(ByteBuf in, Cursor c) {
        int eol = in.indexOf(c.pos, in.writerIndex(), (byte) '\n');
        if (eol < 0) {
            if (in.writerIndex() - c.pos > maxInlineLength) throw new ProtocolException("too big inline request");
            return null;
        }
        int end = eol;
        if (end > c.pos && in.getByte(end - 1) == '\r') end--;
        if (end - c.pos > maxInlineLength) throw new ProtocolException("too big inline request");

        List<byte[]> parts = new ArrayList<>();
        int tokenStart = -1;
        for (int i = c.pos; i <= end; i++) {
            boolean sep = i == end || in.getByte(i) == ' ' || in.getByte(i) == '\t';
            if (sep) {
                if (tokenStart >= 0) {
                    byte[] token = new byte[i - tokenStart];
                    in.getBytes(tokenStart, token);
                    parts.add(token);
                    tokenStart = -1;
                }
            } else if (tokenStart < 0) {
                tokenStart = i;
            }
        }
        c.pos = eol + 1;
        return parts;
    }

    /** Reads up to CRLF starting at the cursor; the cursor moves past the terminator. */
    private String readLine(ByteBuf in, Cursor c) {
        int eol = in.indexOf(c.pos, in.writerIndex(), (byte) '\n');
        if (eol < 0) {
            if (in.writerIndex() - c.pos > maxInlineLength) throw new ProtocolException("line too long");
            return null;
        }
        if (eol == c.pos || in.getByte(eol - 1) != '\r') throw new ProtocolException("expected CRLF line terminator");
        int len = eol - 1 - c.pos;
        if (len > maxInlineLength) throw new ProtocolException("line too long");
        if (in.indexOf(c.pos, eol - 1, (byte) '\r') >= 0) throw new ProtocolException("stray CR in line");
        String line;
        try {
            // the default decoder reports malformed input instead of substituting U+FFFD
            line = StandardCharsets.UTF_8.newDecoder().decode(in.nioBuffer(c.pos, len)).toString();
        } catch (CharacterCodingException e) {
            throw new ProtocolException("invalid UTF-8 in line");
        }
        c.pos = eol + 1;
        return line;
    }

    private byte[] readBulkBody(ByteBuf in, Cursor c, int len) {
        if ((long) in.writerIndex() - c.pos < (long) len + 2) return null;
        if (in.getByte(c.pos + len) != '\r' || in.getByte(c.pos + len + 1) != '\n') {
            throw new ProtocolException("expected CRLF after bulk data");
        }
        byte[] data = new byte[len];
        in.getBytes(c.pos, data);
        c.pos += len + 2;
        return data;
    }

    private void checkBulkLength(long len) {
        if (len < 0 || len > maxBulkLength) throw new ProtocolException("invalid bulk length");
    }

    /**
     * Canonical decimal only: optional '-', no '+', no leading zeros and no "-0", so that the
     * number re-encodes to the bytes it was read from.
     */
    private static long parseNumber(String line, String error) {
        int start = !line.isEmpty() && line.charAt(0) == '-' ? 1 : 0;
        if (line.length() == start || line.length() > 20) throw new ProtocolException(error);
        char first = line.charAt(start);
        if (first == '0' && (start == 1 || line.length() > 1)) throw new ProtocolException(error);
        for (int i = start; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch < '0' || ch > '9') throw new ProtocolException(error);
        }
        try {
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new ProtocolException(error);
        }
    }

    private static String printable(byte b) {
        return b >= 0x20 && b < 0x7f ? String.valueOf((char) b) : String.format("\\x%02x", b & 0xff);
    }

    private static final class Cursor {
        int pos;

        Cursor(int pos) {
            this.pos = pos;
        }
    }
}
