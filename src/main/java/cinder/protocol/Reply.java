package cinder.protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of a command, one of the five RESP reply shapes.
 */
public abstract class Reply {

    public enum Type {
        STATUS, ERROR, INTEGER, BULK, ARRAY
    }

    private static final StatusReply OK = new StatusReply("OK");
    private static final StatusReply PONG = new StatusReply("PONG");
    private static final BulkReply NULL_BULK = new BulkReply(null);
    private static final ArrayReply NULL_ARRAY = new ArrayReply(null);
    private static final ArrayReply EMPTY_ARRAY = new ArrayReply(Collections.emptyList());
    private static final IntegerReply ZERO = new IntegerReply(0);
    private static final IntegerReply ONE = new IntegerReply(1);

    Reply() { }

    public abstract Type type();

    public static Reply ok() {
        return OK;
    }

    public static Reply pong() {
        return PONG;
    }

    public static Reply status(String message) {
        return new StatusReply(message);
    }

    public static Reply error(String kind, String message) {
        return new ErrorReply(kind, message);
    }

    /**
     * Splits a full error line into its kind (first word) and message.
     */
    public static Reply error(String line) {
        return new ErrorReply(line);
    }

    public static Reply integer(long value) {
        if (value == 0) return ZERO;
        if (value == 1) return ONE;
        return new IntegerReply(value);
    }

    public static Reply bulk(byte[] value) {
        return value == null ? NULL_BULK : new BulkReply(value);
    }

    public static Reply bulk(String value) {
        return value == null ? NULL_BULK : new BulkReply(value.getBytes(StandardCharsets.UTF_8));
    }

    public static Reply nullBulk() {
        return NULL_BULK;
    }

    public static Reply array(List<Reply> items) {
        return items == null ? NULL_ARRAY : new ArrayReply(items);
    }

    public static Reply nullArray() {
        return NULL_ARRAY;
    }

    public static Reply emptyArray() {
        return EMPTY_ARRAY;
    }

    public static Reply bulkArray(List<byte[]> items) {
        List<Reply> replies = new ArrayList<>(items.size());
        for (byte[] item : items) {
            replies.add(bulk(item));
        }
        return new ArrayReply(replies);
    }

    private static void checkLine(String s) {
        if (s.indexOf('\r') >= 0 || s.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("line replies cannot contain CR or LF");
        }
    }

    public static final class StatusReply extends Reply {
        private final String message;

        StatusReply(String message) {
            checkLine(message);
            this.message = message;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public Type type() {
            return Type.STATUS;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof StatusReply && message.equals(((StatusReply) o).message);
        }

        @Override
        public int hashCode() {
            return message.hashCode();
        }

        @Override
        public String toString() {
            return "+" + message;
        }
    }

    public static final class ErrorReply extends Reply {
        private final String line;

        ErrorReply(String kind, String message) {
            checkLine(kind);
            checkLine(message);
            if (kind.indexOf(' ') >= 0) throw new IllegalArgumentException("error kind cannot contain spaces");
            this.line = message.isEmpty() ? kind : kind + " " + message;
        }

        ErrorReply(String line) {
            checkLine(line);
            this.line = line;
        }

        /** First word of the line. */
        public String getKind() {
            int space = line.indexOf(' ');
            return space < 0 ? line : line.substring(0, space);
        }

        public String getMessage() {
            int space = line.indexOf(' ');
            return space < 0 ? "" : line.substring(space + 1);
        }

        /**
         * The line as written on the wire, without the leading '-'.
         */
        public String line() {
            return line;
        }

        @Override
        public Type type() {
            return Type.ERROR;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ErrorReply)) return false;
            return line.equals(((ErrorReply) o).line);
        }

        @Override
        public int hashCode() {
            return line.hashCode();
        }

        @Override
        public String toString() {
            return "-" + line();
        }
    }

    public static final class IntegerReply extends Reply {
        private final long value;

        IntegerReply(long value) {
            this.value = value;
        }

        public long getValue() {
            return value;
        }

        @Override
        public Type type() {
            return Type.INTEGER;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof IntegerReply && value == ((IntegerReply) o).value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }

        @Override
        public String toString() {
            return ":" + value;
        }
    }

    public static final class BulkReply extends Reply {
        private final byte[] value;

        BulkReply(byte[] value) {
            this.value = value;
        }

        /**
         * Payload, or null for the nil bulk string.
         */
        public byte[] getValue() {
            return value;
        }

        public boolean isNull() {
            return value == null;
        }

        public String asString() {
            return value == null ? null : new String(value, StandardCharsets.UTF_8);
        }

        @Override
        public Type type() {
            return Type.BULK;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BulkReply && Arrays.equals(value, ((BulkReply) o).value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return value == null ? "$nil" : "$" + asString();
        }
    }

    public static final class ArrayReply extends Reply {
        private final List<Reply> items;

        ArrayReply(List<Reply> items) {
            this.items = items == null ? null : Collections.unmodifiableList(new ArrayList<>(items));
        }

        /**
         * Elements, or null for the nil array.
         */
        public List<Reply> getItems() {
            return items;
        }

        public boolean isNull() {
            return items == null;
        }

        @Override
        public Type type() {
            return Type.ARRAY;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ArrayReply && Objects.equals(items, ((ArrayReply) o).items);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(items);
        }

        @Override
        public String toString() {
            return items == null ? "*nil" : items.toString();
        }
    }
}
