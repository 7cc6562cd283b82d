package cinder.persistence;

/**
 * Byte layout of the snapshot file.
 *
 * <pre>
 * "CINDER" version(4 ascii digits)
 * { [0xFC expireAtMillis(8)] type(1) key value }*
 * 0xFF crc32(8)
 * </pre>
 *
 * Lengths use the 6/14/32-bit prefix encoding of RDB. The checksum covers every byte before it.
 */
public final class SnapshotConstants {
    public static final String MAGIC = "CINDER";
    public static final String VERSION = "0001";

    public static final int OPCODE_EOF = 0xFF;
    public static final int OPCODE_EXPIRETIME_MS = 0xFC;

    public static final int TYPE_STRING = 0;
    public static final int TYPE_LIST = 1;
    public static final int TYPE_SET = 2;
    public static final int TYPE_HASH = 4;
    public static final int TYPE_ZSET = 5;

    public static final int LEN_6BIT = 0;
    public static final int LEN_14BIT = 1;
    public static final int LEN_32BIT = 0x80;

    public static final int CHECKSUM_LENGTH = 8;

    private SnapshotConstants() { }
}
