package cinder.persistence;

import cinder.db.ByteString;
import cinder.db.ValueEntry;
import cinder.structs.CinderHash;
import cinder.structs.CinderSet;
import cinder.structs.ZNode;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Map;
import java.util.zip.CRC32;
import java.util.zip.CheckedOutputStream;

public class SnapshotEncoder {

    public byte[] encode(Collection<Map.Entry<ByteString, ValueEntry>> entries) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        CRC32 crc = new CRC32();
        DataOutputStream dos = new DataOutputStream(new CheckedOutputStream(bytes, crc));

        dos.write(SnapshotConstants.MAGIC.getBytes(StandardCharsets.US_ASCII));
        dos.write(SnapshotConstants.VERSION.getBytes(StandardCharsets.US_ASCII));

        for (Map.Entry<ByteString, ValueEntry> e : entries) {
            writeEntry(dos, e.getKey(), e.getValue());
        }

        dos.write(SnapshotConstants.OPCODE_EOF);
        dos.flush();
        // the checksum itself is not part of the checked range
        new DataOutputStream(bytes).writeLong(crc.getValue());
        return bytes.toByteArray();
    }

    private void writeEntry(DataOutputStream dos, ByteString key, ValueEntry v) throws IOException {
        if (v.hasExpiry()) {
            dos.write(SnapshotConstants.OPCODE_EXPIRETIME_MS);
            dos.writeLong(v.getExpireAt());
        }
        switch (v.getType()) {
            case STRING:
                dos.write(SnapshotConstants.TYPE_STRING);
                writeString(dos, key.toByteArray());
                writeString(dos, v.asString());
                break;
            case LIST:
                dos.write(SnapshotConstants.TYPE_LIST);
                writeString(dos, key.toByteArray());
                writeLen(dos, v.asList().size());
                for (byte[] item : v.asList()) {
                    writeString(dos, item);
                }
                break;
            case SET: {
                dos.write(SnapshotConstants.TYPE_SET);
                writeString(dos, key.toByteArray());
                CinderSet set = v.asSet();
                writeLen(dos, set.size());
                for (ByteString member : set.members()) {
                    writeString(dos, member.toByteArray());
                }
                break;
            }
            case HASH: {
                dos.write(SnapshotConstants.TYPE_HASH);
                writeString(dos, key.toByteArray());
                CinderHash hash = v.asHash();
                writeLen(dos, hash.size());
                for (Map.Entry<ByteString, byte[]> field : hash.entrySet()) {
                    writeString(dos, field.getKey().toByteArray());
                    writeString(dos, field.getValue());
                }
                break;
            }
            case ZSET:
                dos.write(SnapshotConstants.TYPE_ZSET);
                writeString(dos, key.toByteArray());
                writeLen(dos, v.asZSet().size());
                for (ZNode node : v.asZSet()) {
                    writeString(dos, node.member.toByteArray());
                    dos.writeDouble(node.score);
                }
                break;
            default:
                throw new IOException("Unsupported type: " + v.getType());
        }
    }

    private void writeLen(DataOutputStream dos, long len) throws IOException {
        if (len < 64) {
            dos.write((int) (len | (SnapshotConstants.LEN_6BIT << 6)));
        } else if (len < 16384) {
            dos.write((int) (((len >> 8) & 0x3F) | (SnapshotConstants.LEN_14BIT << 6)));
            dos.write((int) (len & 0xFF));
        } else {
            dos.write(SnapshotConstants.LEN_32BIT);
            dos.writeInt((int) len);
        }
    }

    private void writeString(DataOutputStream dos, byte[] bytes) throws IOException {
        writeLen(dos, bytes.length);
        dos.write(bytes);
    }
}
