package cinder.db;

import cinder.Config;
import cinder.utils.Log;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Active half of key expiry. The lazy half lives in {@link Keyspace#get}.
 * <p>
 * Each cycle visits every shard, samples keys that carry a TTL and removes the expired ones.
 * While the expired fraction of a sample stays above the threshold the shard is sampled again,
 * up to {@code maxIterations} times, so a burst of simultaneous expiries drains quickly
 * without scanning a whole shard under its lock.
 */
public class ExpirationManager {
    private final Database db;
    private final Config.ActiveExpire settings;
    private ScheduledExecutorService janitor;

    public ExpirationManager(Database db, Config.ActiveExpire settings) {
        this.db = db;
        this.settings = settings;
    }

    /**
     * Runs one sweep over all shards and returns the number of keys removed.
     */
    public int activeExpireCycle() {
        int removed = 0;
        for (int shard = 0; shard < db.shardCount(); shard++) {
            removed += expireShard(shard);
        }
        if (removed > 0 && Log.isDebugEnabled()) {
            Log.debug("[Expire] Removed " + removed + " expired keys");
        }
        return removed;
    }

    int expireShard(int shard) {
        int removed = 0;
        for (int iteration = 0; iteration < settings.getMaxIterations(); iteration++) {
            Database.ExpireSample sample = db.sampleExpired(shard, settings.getSampleSize());
            removed += sample.expired;
            if (sample.sampled == 0) break;
            if ((double) sample.expired / sample.sampled <= settings.getResampleThreshold()) break;
        }
        return removed;
    }

    public synchronized void start() {
        if (janitor != null) return;
        janitor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Janitor");
            t.setDaemon(true);
            return t;
        });
        janitor.scheduleWithFixedDelay(() -> {
            try {
                activeExpireCycle();
            } catch (RuntimeException e) {
                Log.error("[Janitor] Expire cycle failed", e);
            }
        }, settings.getIntervalMillis(), settings.getIntervalMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (janitor == null) return;
        janitor.shutdownNow();
        janitor = null;
    }
}
