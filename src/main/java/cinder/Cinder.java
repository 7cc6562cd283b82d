package cinder;

import cinder.db.Database;
import cinder.db.ExpirationManager;
import cinder.persistence.SnapshotException;
import cinder.persistence.SnapshotFile;
import cinder.utils.Log;
import cinder.utils.Time;

import java.io.IOException;
import java.nio.file.Paths;

/**
 * Process entry point: {@code java cinder.Cinder [config.yaml]}.
 */
public class Cinder {
    public static final String VERSION = "0.1.0";
    static final String DEFAULT_CONFIG = "cinder.yaml";

    public static void printBanner() {
        Log.info("\n" +
                "  ____ _           _           \n" +
                " / ___(_)_ __   __| | ___ _ __ \n" +
                "| |   | | '_ \\ / _` |/ _ \\ '__|\n" +
                "| |___| | | | | (_| |  __/ |   \n" +
                " \\____|_|_| |_|\\__,_|\\___|_|   \n" +
                "                               \n" +
                " :: Cinder ::       (v" + VERSION + ") \n");
    }

    public static void main(String[] args) throws Exception {
        Config config = Config.load(args.length > 0 ? args[0] : DEFAULT_CONFIG);
        Log.setLevel(config.getLogLevel());
        printBanner();

        SnapshotFile snapshots = hasSnapshotFile(config) ? new SnapshotFile(Paths.get(config.getSnapshotFile())) : null;
        Database db;
        try {
            db = snapshots != null
                    ? snapshots.load(config.getShards(), Time.SYSTEM_CLOCK)
                    : new Database(config.getShards(), Time.SYSTEM_CLOCK);
        } catch (SnapshotException e) {
            Log.error("Cannot load snapshot, refusing to start: " + e.getMessage(), e);
            System.exit(1);
            return;
        }

        ExpirationManager expiration = new ExpirationManager(db, config.getActiveExpire());
        expiration.start();
        if (snapshots != null) snapshots.startPeriodicSave(db, config.getSnapshotIntervalSeconds());

        CinderServer server = new CinderServer(config, db);
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            Log.info("Shutting down...");
            server.stop();
            expiration.stop();
            if (snapshots != null) {
                snapshots.stop();
                try {
                    snapshots.save(db);
                    Log.info("Snapshot saved to " + snapshots.getPath());
                } catch (IOException | RuntimeException e) {
                    Log.error("Final snapshot failed: " + e.getMessage(), e);
                }
            }
        }, "Shutdown"));

        server.awaitClose();
    }

    private static boolean hasSnapshotFile(Config config) {
        return config.getSnapshotFile() != null && !config.getSnapshotFile().trim().isEmpty();
    }
}
