package cinder.db;

import cinder.persistence.SnapshotEncoder;
import cinder.persistence.SnapshotException;
import cinder.persistence.SnapshotParser;
import cinder.utils.Time;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * The shared keyspace. Keys are spread over a power-of-two number of shards, each guarded by
 * its own lock. Commands reach entries only through a {@link Keyspace} opened by
 * {@link #withKey} or {@link #withKeys}; multi-shard access always locks in ascending shard order.
 */
public class Database {
    private final Shard[] shards;
    private final int mask;
    private final Time.Clock clock;
    private final AtomicLong expiredKeys = new AtomicLong();
    private final AtomicLong changes = new AtomicLong();

    public Database(int shardCount, Time.Clock clock) {
        if (shardCount <= 0 || Integer.bitCount(shardCount) != 1) {
            throw new IllegalArgumentException("shard count must be a power of two: " + shardCount);
        }
        this.shards = new Shard[shardCount];
        for (int i = 0; i < shardCount; i++) {
            shards[i] = new Shard(i);
        }
        this.mask = shardCount - 1;
        this.clock = clock;
    }

    public Database(int shardCount) {
        this(shardCount, Time.SYSTEM_CLOCK);
    }

    public Time.Clock getClock() {
        return clock;
    }

    public int shardCount() {
        return shards.length;
    }

    Shard shardFor(ByteString key) {
        int h = key.hashCode();
        return shards[(h ^ (h >>> 16)) & mask];
    }

    public <R> R withKey(ByteString key, Function<Keyspace, R> operation) {
        Shard shard = shardFor(key);
        shard.lock.lock();
        try {
            return operation.apply(new Keyspace(this, clock.currentTimeMillis()));
        } finally {
            shard.lock.unlock();
        }
    }

    public <R> R withKeys(Collection<ByteString> keys, Function<Keyspace, R> operation) {
        TreeSet<Integer> indexes = new TreeSet<>();
        for (ByteString key : keys) {
            indexes.add(shardFor(key).index);
        }
        List<Shard> locked = new ArrayList<>(indexes.size());
        try {
            for (int index : indexes) {
                shards[index].lock.lock();
                locked.add(shards[index]);
            }
            return operation.apply(new Keyspace(this, clock.currentTimeMillis()));
        } finally {
            for (int i = locked.size() - 1; i >= 0; i--) {
                locked.get(i).lock.unlock();
            }
        }
    }

    private <R> R withAllShards(Function<Long, R> operation) {
        int locked = 0;
        try {
            for (Shard shard : shards) {
                shard.lock.lock();
                locked++;
            }
            return operation.apply(clock.currentTimeMillis());
        } finally {
            for (int i = locked - 1; i >= 0; i--) {
                shards[i].lock.unlock();
            }
        }
    }

    /**
     * Number of live keys. Entries that have expired but were not swept yet are not counted.
     */
    public int size() {
        int total = 0;
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                long now = clock.currentTimeMillis();
                for (ValueEntry entry : shard.entries.values()) {
                    if (!entry.isExpired(now)) total++;
                }
            } finally {
                shard.lock.unlock();
            }
        }
        return total;
    }

    /**
     * Number of stored entries including expired ones still waiting for removal.
     */
    public int physicalSize() {
        int total = 0;
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                total += shard.entries.size();
            } finally {
                shard.lock.unlock();
            }
        }
        return total;
    }

    public void clear() {
        withAllShards(now -> {
            for (Shard shard : shards) {
                shard.clear();
            }
            markDirty();
            return null;
        });
    }

    /**
     * Samples up to {@code sampleSize} keys with a TTL from one shard and removes the expired ones.
     */
    public ExpireSample sampleExpired(int shardIndex, int sampleSize) {
        Shard shard = shards[shardIndex];
        shard.lock.lock();
        try {
            long now = clock.currentTimeMillis();
            List<ByteString> sample = shard.sampleVolatile(sampleSize);
            int expired = 0;
            for (ByteString key : sample) {
                ValueEntry entry = shard.entries.get(key);
                if (entry != null && entry.isExpired(now)) {
                    shard.remove(key);
                    expired++;
                }
            }
            recordExpired(expired);
            return new ExpireSample(sample.size(), expired);
        } finally {
            shard.lock.unlock();
        }
    }

    void recordExpired(int count) {
        if (count > 0) expiredKeys.addAndGet(count);
    }

    public long getExpiredKeys() {
        return expiredKeys.get();
    }

    /**
     * Bumps the modification counter that decides whether a periodic snapshot is due.
     */
    public void markDirty() {
        changes.incrementAndGet();
    }

    public long getChanges() {
        return changes.get();
    }

    /**
     * Point-in-time image of every live entry, taken with all shards locked.
     */
    public byte[] snapshot() {
        return withAllShards(now -> {
            List<Map.Entry<ByteString, ValueEntry>> live = new ArrayList<>();
            for (Shard shard : shards) {
                for (Map.Entry<ByteString, ValueEntry> e : shard.entries.entrySet()) {
                    if (!e.getValue().isExpired(now)) live.add(e);
                }
            }
            try {
                return new SnapshotEncoder().encode(live);
            } catch (IOException e) {
                throw new SnapshotException("Failed to encode snapshot", e);
            }
        });
    }

    /**
     * Rebuilds a database from {@link #snapshot()} output, dropping entries whose expiry has passed.
     */
    public static Database restore(byte[] snapshot, int shardCount, Time.Clock clock) {
        Database db = new Database(shardCount, clock);
        long now = clock.currentTimeMillis();
        try {
            new SnapshotParser(snapshot).parse((key, entry) -> {
                if (entry.isExpired(now)) return;
                db.shardFor(key).put(key, entry);
            });
        } catch (IOException e) {
            throw new SnapshotException("Failed to parse snapshot", e);
        }
        return db;
    }

    public static final class ExpireSample {
        public final int sampled;
        public final int expired;

        public ExpireSample(int sampled, int expired) {
            this.sampled = sampled;
            this.expired = expired;
        }
    }
}
