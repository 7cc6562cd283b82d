package cinder.db;

import cinder.structs.CinderHash;
import cinder.structs.CinderList;
import cinder.structs.CinderSet;
import cinder.structs.CinderZSet;

import java.util.function.Supplier;

/**
 * View of the database handed to a command while the shards of its keys are locked.
 * Every read applies the lazy expiry check, so an expired entry is never visible here.
 * Touching a key whose shard is not held by the calling thread is a bug and fails fast.
 */
public final class Keyspace {
    private final Database db;
    private final long now;

    Keyspace(Database db, long now) {
        this.db = db;
        this.now = now;
    }

    /**
     * Clock reading taken once when the command started.
     */
    public long now() {
        return now;
    }

    public ValueEntry get(ByteString key) {
        Shard shard = locked(key);
        ValueEntry entry = shard.entries.get(key);
        if (entry == null) return null;
        if (entry.isExpired(now)) {
            shard.remove(key);
            db.recordExpired(1);
            return null;
        }
        return entry;
    }

    public boolean exists(ByteString key) {
        return get(key) != null;
    }

    public void put(ByteString key, ValueEntry entry) {
        locked(key).put(key, entry);
    }

    public boolean remove(ByteString key) {
        if (get(key) == null) return false;
        locked(key).remove(key);
        return true;
    }

    /**
     * Sets or clears ({@link ValueEntry#NO_EXPIRY}) the expiry of a live key.
     * An instant that is already past deletes the key. Returns false when the key is absent.
     */
    public boolean setExpireAt(ByteString key, long expireAt) {
        ValueEntry entry = get(key);
        if (entry == null) return false;
        Shard shard = locked(key);
        if (expireAt != ValueEntry.NO_EXPIRY && expireAt <= now) {
            shard.remove(key);
            return true;
        }
        shard.setExpireAt(key, entry, expireAt);
        return true;
    }

    public byte[] getString(ByteString key) {
        ValueEntry entry = get(key);
        return entry == null ? null : entry.asString();
    }

    public CinderList getList(ByteString key) {
        ValueEntry entry = get(key);
        return entry == null ? null : entry.asList();
    }

    public CinderHash getHash(ByteString key) {
        ValueEntry entry = get(key);
        return entry == null ? null : entry.asHash();
    }

    public CinderSet getSet(ByteString key) {
        ValueEntry entry = get(key);
        return entry == null ? null : entry.asSet();
    }

    public CinderZSet getZSet(ByteString key) {
        ValueEntry entry = get(key);
        return entry == null ? null : entry.asZSet();
    }

    public CinderList getOrCreateList(ByteString key) {
        return getOrCreate(key, DataType.LIST, () -> ValueEntry.list(new CinderList())).asList();
    }

    public CinderHash getOrCreateHash(ByteString key) {
        return getOrCreate(key, DataType.HASH, () -> ValueEntry.hash(new CinderHash())).asHash();
    }

    public CinderSet getOrCreateSet(ByteString key) {
        return getOrCreate(key, DataType.SET, () -> ValueEntry.set(new CinderSet())).asSet();
    }

    public CinderZSet getOrCreateZSet(ByteString key) {
        return getOrCreate(key, DataType.ZSET, () -> ValueEntry.zset(new CinderZSet())).asZSet();
    }

    /**
     * Drops the key if it holds a collection that has become empty.
     */
    public void removeIfEmpty(ByteString key) {
        Shard shard = locked(key);
        ValueEntry entry = shard.entries.get(key);
        if (entry != null && entry.isEmptyCollection()) {
            shard.remove(key);
        }
    }

    private ValueEntry getOrCreate(ByteString key, DataType type, Supplier<ValueEntry> factory) {
        ValueEntry entry = get(key);
        if (entry == null) {
            entry = factory.get();
            locked(key).put(key, entry);
        } else if (entry.getType() != type) {
            throw new WrongTypeException();
        }
        return entry;
    }

    private Shard locked(ByteString key) {
        Shard shard = db.shardFor(key);
        if (!shard.lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("shard " + shard.index + " not locked for key " + key);
        }
        return shard;
    }
}
