package cinder.persistence;

import cinder.db.ByteString;
import cinder.db.DataType;
import cinder.db.ValueEntry;
import cinder.structs.CinderHash;
import cinder.structs.CinderList;
import cinder.structs.CinderSet;
import cinder.structs.CinderZSet;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.function.BiConsumer;
import java.util.zip.CRC32;

/**
 * Reads {@link SnapshotEncoder} output. The checksum is verified before any entry is handed out,
 * so a damaged file never yields a partial keyspace.
 */
public class SnapshotParser {
    private final byte[] data;
    private DataInputStream in;
    private int remaining;

    public SnapshotParser(byte[] data) {
        this.data = data;
    }

    public void parse(BiConsumer<ByteString, ValueEntry> sink) throws IOException {
        int header = SnapshotConstants.MAGIC.length() + SnapshotConstants.VERSION.length();
        if (data.length < header + 1 + SnapshotConstants.CHECKSUM_LENGTH) {
            throw new IOException("Snapshot truncated: " + data.length + " bytes");
        }
        byte[] magic = Arrays.copyOfRange(data, 0, SnapshotConstants.MAGIC.length());
        if (!SnapshotConstants.MAGIC.equals(new String(magic, StandardCharsets.US_ASCII))) {
            throw new IOException("Not a snapshot file (bad magic)");
        }
        String version = new String(data, SnapshotConstants.MAGIC.length(), SnapshotConstants.VERSION.length(),
                StandardCharsets.US_ASCII);
        if (!SnapshotConstants.VERSION.equals(version)) {
            throw new IOException("Unsupported snapshot version: " + version);
        }

        int body = data.length - SnapshotConstants.CHECKSUM_LENGTH;
        CRC32 crc = new CRC32();
        crc.update(data, 0, body);
        long expected = ByteBuffer.wrap(data, body, SnapshotConstants.CHECKSUM_LENGTH).getLong();
        if (crc.getValue() != expected) {
            throw new IOException("Snapshot checksum mismatch");
        }

        in = new DataInputStream(new ByteArrayInputStream(data, header, body - header));
        remaining = body - header;
        try {
            readEntries(sink);
        } catch (EOFException e) {
            throw new IOException("Snapshot ended before EOF marker", e);
        }
    }

    private void readEntries(BiConsumer<ByteString, ValueEntry> sink) throws IOException {
        while (true) {
            int opcode = readUnsignedByte();
            long expireAt = ValueEntry.NO_EXPIRY;
            if (opcode == SnapshotConstants.OPCODE_EOF) {
                if (remaining != 0) throw new IOException("Trailing bytes after EOF marker");
                return;
            }
            if (opcode == SnapshotConstants.OPCODE_EXPIRETIME_MS) {
                expireAt = readLong();
                if (expireAt < 0) throw new IOException("Negative expiry: " + expireAt);
                opcode = readUnsignedByte();
            }
            ByteString key = ByteString.copyOf(readString());
            sink.accept(key, readValue(opcode, expireAt));
        }
    }

    private ValueEntry readValue(int type, long expireAt) throws IOException {
        switch (type) {
            case SnapshotConstants.TYPE_STRING:
                return ValueEntry.string(readString(), expireAt);
            case SnapshotConstants.TYPE_LIST: {
                long len = readLen();
                CinderList list = new CinderList();
                for (long i = 0; i < len; i++) {
                    list.pushRight(readString());
                }
                return ValueEntry.of(DataType.LIST, list, expireAt);
            }
            case SnapshotConstants.TYPE_SET: {
                long len = readLen();
                CinderSet set = new CinderSet();
                for (long i = 0; i < len; i++) {
                    set.add(ByteString.copyOf(readString()));
                }
                return ValueEntry.of(DataType.SET, set, expireAt);
            }
            case SnapshotConstants.TYPE_HASH: {
                long len = readLen();
                CinderHash hash = new CinderHash();
                for (long i = 0; i < len; i++) {
                    ByteString field = ByteString.copyOf(readString());
                    hash.put(field, readString());
                }
                return ValueEntry.of(DataType.HASH, hash, expireAt);
            }
            case SnapshotConstants.TYPE_ZSET: {
                long len = readLen();
                CinderZSet zset = new CinderZSet();
                for (long i = 0; i < len; i++) {
                    ByteString member = ByteString.copyOf(readString());
                    double score = readDouble();
                    if (Double.isNaN(score)) throw new IOException("NaN score for member " + member);
                    zset.add(score, member);
                }
                return ValueEntry.of(DataType.ZSET, zset, expireAt);
            }
            default:
                throw new IOException("Unknown value type: " + type);
        }
    }

    private long readLen() throws IOException {
        int first = readUnsignedByte();
        int type = (first & 0xC0) >> 6;
        long len;
        if (type == SnapshotConstants.LEN_6BIT) {
            len = first & 0x3F;
        } else if (type == SnapshotConstants.LEN_14BIT) {
            len = ((first & 0x3F) << 8) | readUnsignedByte();
        } else if (first == SnapshotConstants.LEN_32BIT) {
            len = readInt() & 0xFFFFFFFFL;
        } else {
            throw new IOException("Bad length prefix: 0x" + Integer.toHexString(first));
        }
        // every element takes at least one byte, so a larger count is corrupt
        if (len > remaining) throw new IOException("Length " + len + " exceeds remaining " + remaining + " bytes");
        return len;
    }

    private byte[] readString() throws IOException {
        int len = (int) readLen();
        byte[] b = new byte[len];
        in.readFully(b);
        remaining -= len;
        return b;
    }

    private int readUnsignedByte() throws IOException {
        int b = in.readUnsignedByte();
        remaining--;
        return b;
    }

    private int readInt() throws IOException {
        int v = in.readInt();
        remaining -= 4;
        return v;
    }

    private long readLong() throws IOException {
        long v = in.readLong();
        remaining -= 8;
        return v;
    }

    private double readDouble() throws IOException {
        double v = in.readDouble();
        remaining -= 8;
        return v;
    }
}
