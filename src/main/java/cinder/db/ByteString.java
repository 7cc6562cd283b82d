package cinder.db;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Immutable byte sequence used for keys, hash fields and set / sorted set members.
 * Ordering is unsigned lexicographic, the same order clients see for equal scores.
 */
public final class ByteString implements Comparable<ByteString> {
    private final byte[] bytes;
    private int hash;

    private ByteString(byte[] bytes) {
        this.bytes = bytes;
    }

    public static ByteString copyOf(byte[] bytes) {
        return new ByteString(bytes.clone());
    }

    public static ByteString of(String s) {
        return new ByteString(s.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns a copy; the wrapped array never escapes.
     */
    public byte[] toByteArray() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public int compareTo(ByteString o) {
        return Arrays.compareUnsigned(bytes, o.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ByteString)) return false;
        return Arrays.equals(bytes, ((ByteString) o).bytes);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0 && bytes.length > 0) {
            h = Arrays.hashCode(bytes);
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
