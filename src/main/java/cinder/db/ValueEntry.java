package cinder.db;

import cinder.structs.CinderHash;
import cinder.structs.CinderList;
import cinder.structs.CinderSet;
import cinder.structs.CinderZSet;

/**
 * A typed value plus its optional absolute expiry. Only touched while the owning shard is locked.
 */
public class ValueEntry {
    public static final long NO_EXPIRY = -1;

    private final DataType type;
    private final Object value;
    private long expireAt = NO_EXPIRY;

    ValueEntry(Object value, DataType type, long expireAt) {
        this.value = value;
        this.type = type;
        this.expireAt = expireAt;
    }

    /**
     * Rebuilds an entry of any type, as read back from a snapshot.
     */
    public static ValueEntry of(DataType type, Object value, long expireAt) {
        boolean matches;
        switch (type) {
            case STRING: matches = value instanceof byte[]; break;
            case LIST: matches = value instanceof CinderList; break;
            case HASH: matches = value instanceof CinderHash; break;
            case SET: matches = value instanceof CinderSet; break;
            case ZSET: matches = value instanceof CinderZSet; break;
            default: matches = false;
        }
        if (!matches) {
            throw new IllegalArgumentException("value of class " + value.getClass().getSimpleName() + " is not a " + type);
        }
        return new ValueEntry(value, type, expireAt);
    }

    public static ValueEntry string(byte[] value) {
        return new ValueEntry(value, DataType.STRING, NO_EXPIRY);
    }

    public static ValueEntry string(byte[] value, long expireAt) {
        return new ValueEntry(value, DataType.STRING, expireAt);
    }

    public static ValueEntry list(CinderList list) {
        return new ValueEntry(list, DataType.LIST, NO_EXPIRY);
    }

    public static ValueEntry hash(CinderHash hash) {
        return new ValueEntry(hash, DataType.HASH, NO_EXPIRY);
    }

    public static ValueEntry set(CinderSet set) {
        return new ValueEntry(set, DataType.SET, NO_EXPIRY);
    }

    public static ValueEntry zset(CinderZSet zset) {
        return new ValueEntry(zset, DataType.ZSET, NO_EXPIRY);
    }

    public DataType getType() {
        return type;
    }

    public long getExpireAt() {
        return expireAt;
    }

    void setExpireAt(long expireAt) {
        this.expireAt = expireAt;
    }

    public boolean hasExpiry() {
        return expireAt != NO_EXPIRY;
    }

    public boolean isExpired(long now) {
        return expireAt != NO_EXPIRY && now > expireAt;
    }

    public byte[] asString() {
        expect(DataType.STRING);
        return (byte[]) value;
    }

    public CinderList asList() {
        expect(DataType.LIST);
        return (CinderList) value;
    }

    public CinderHash asHash() {
        expect(DataType.HASH);
        return (CinderHash) value;
    }

    public CinderSet asSet() {
        expect(DataType.SET);
        return (CinderSet) value;
    }

    public CinderZSet asZSet() {
        expect(DataType.ZSET);
        return (CinderZSet) value;
    }

    /**
     * True for a collection with no elements left. Strings are never empty in this sense.
     */
    boolean isEmptyCollection() {
        switch (type) {
            case LIST: return ((CinderList) value).size() == 0;
            case HASH: return ((CinderHash) value).size() == 0;
            case SET: return ((CinderSet) value).size() == 0;
            case ZSET: return ((CinderZSet) value).size() == 0;
            default: return false;
        }
    }

    private void expect(DataType expected) {
        if (type != expected) throw new WrongTypeException();
    }
}
