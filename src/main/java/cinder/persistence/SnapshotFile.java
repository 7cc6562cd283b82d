package cinder.persistence;

import cinder.db.Database;
import cinder.utils.Log;
import cinder.utils.Time;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The snapshot on disk: loaded once at startup, rewritten atomically on a timer while
 * the database has changed, and once more on shutdown.
 */
public class SnapshotFile {
    private final Path path;
    private final AtomicBoolean saving = new AtomicBoolean(false);
    private volatile long savedChanges;
    private ScheduledExecutorService scheduler;

    public SnapshotFile(Path path) {
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Reads the snapshot into a new database, or returns an empty one when no file exists.
     *
     * @throws SnapshotException when the file exists but is unreadable or corrupt
     */
    public Database load(int shardCount, Time.Clock clock) {
        if (!Files.exists(path)) {
            Log.info("No snapshot at " + path + ", starting empty.");
            return new Database(shardCount, clock);
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new SnapshotException("Failed to read snapshot " + path, e);
        }
        Database db = Database.restore(bytes, shardCount, clock);
        savedChanges = db.getChanges();
        Log.info("Loaded " + db.size() + " keys from " + path);
        return db;
    }

    /**
     * Writes a point-in-time snapshot through a temporary file and an atomic rename.
     */
    public void save(Database db) throws IOException {
        if (!saving.compareAndSet(false, true)) {
            throw new IllegalStateException("Snapshot save already in progress");
        }
        try {
            long changes = db.getChanges();
            byte[] bytes = db.snapshot();
            Path dir = path.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            try {
                Files.write(tmp, bytes);
                try {
                    Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
            savedChanges = changes;
            Log.debug("Snapshot saved to " + path + " (" + bytes.length + " bytes)");
        } finally {
            saving.set(false);
        }
    }

    /**
     * Saves only when something was written since the last save. Returns whether it saved.
     */
    public boolean saveIfDirty(Database db) throws IOException {
        if (db.getChanges() == savedChanges) return false;
        save(db);
        return true;
    }

    public synchronized void startPeriodicSave(Database db, long intervalSeconds) {
        if (scheduler != null || intervalSeconds <= 0) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Snapshot");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                if (saveIfDirty(db)) Log.info("Snapshot saved.");
            } catch (IOException | RuntimeException e) {
                Log.error("Snapshot save failed: " + e.getMessage(), e);
            }
        }, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    /**
     * Stops the timer, letting a save that is already running finish.
     */
    public synchronized void stop() {
        if (scheduler == null) return;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                Log.warn("Snapshot thread did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler = null;
    }
}
