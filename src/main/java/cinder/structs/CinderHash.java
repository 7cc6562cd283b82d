package cinder.structs;

import cinder.db.ByteString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Hash value keeping fields in insertion order. Guarded by the shard lock of the owning key.
 */
public class CinderHash {
    private final Map<ByteString, byte[]> map = new LinkedHashMap<>();

    /**
     * Returns true when the field did not exist before.
     */
    public boolean put(ByteString field, byte[] value) {
        return map.put(field, value) == null;
    }

    public byte[] get(ByteString field) {
        return map.get(field);
    }

    public boolean remove(ByteString field) {
        return map.remove(field) != null;
    }

    public boolean contains(ByteString field) {
        return map.containsKey(field);
    }

    public int size() {
        return map.size();
    }

    public Set<Map.Entry<ByteString, byte[]>> entrySet() {
        return Collections.unmodifiableMap(map).entrySet();
    }
}
