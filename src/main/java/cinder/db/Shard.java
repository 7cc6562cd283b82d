package cinder.db;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock-guarded slice of the keyspace. All fields are guarded by {@link #lock}.
 */
final class Shard {
    final int index;
    final ReentrantLock lock = new ReentrantLock();
    final Map<ByteString, ValueEntry> entries = new HashMap<>();

    // keys bearing a TTL, kept in an array for O(1) random sampling
    private final List<ByteString> volatileKeys = new ArrayList<>();
    private final Map<ByteString, Integer> volatilePositions = new HashMap<>();

    Shard(int index) {
        this.index = index;
    }

    ValueEntry put(ByteString key, ValueEntry entry) {
        ValueEntry old = entries.put(key, entry);
        if (entry.hasExpiry()) {
            trackExpiry(key);
        } else if (old != null && old.hasExpiry()) {
            untrackExpiry(key);
        }
        return old;
    }

    ValueEntry remove(ByteString key) {
        ValueEntry old = entries.remove(key);
        if (old != null && old.hasExpiry()) {
            untrackExpiry(key);
        }
        return old;
    }

    void setExpireAt(ByteString key, ValueEntry entry, long expireAt) {
        entry.setExpireAt(expireAt);
        if (expireAt == ValueEntry.NO_EXPIRY) {
            untrackExpiry(key);
        } else {
            trackExpiry(key);
        }
    }

    void clear() {
        entries.clear();
        volatileKeys.clear();
        volatilePositions.clear();
    }

    int volatileCount() {
        return volatileKeys.size();
    }

    /**
     * Picks up to {@code n} distinct keys that carry a TTL.
     */
    List<ByteString> sampleVolatile(int n) {
        int size = volatileKeys.size();
        if (size <= n) return new ArrayList<>(volatileKeys);

        List<ByteString> sample = new ArrayList<>(n);
        ThreadLocalRandom random = ThreadLocalRandom.current();
        int start = random.nextInt(size);
        // contiguous window from a random offset
        for (int i = 0; i < n; i++) {
            sample.add(volatileKeys.get((start + i) % size));
        }
        return sample;
    }

    private void trackExpiry(ByteString key) {
        if (volatilePositions.containsKey(key)) return;
        volatilePositions.put(key, volatileKeys.size());
        volatileKeys.add(key);
    }

    private void untrackExpiry(ByteString key) {
        Integer pos = volatilePositions.remove(key);
        if (pos == null) return;
        int last = volatileKeys.size() - 1;
        ByteString moved = volatileKeys.remove(last);
        if (pos != last) {
            volatileKeys.set(pos, moved);
            volatilePositions.put(moved, pos);
        }
    }
}
