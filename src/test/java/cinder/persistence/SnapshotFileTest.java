package cinder.persistence;

import cinder.commands.CommandDispatcher;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.utils.MockClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class SnapshotFileTest {
    @TempDir
    Path dir;

    private final MockClock clock = new MockClock(1_700_000_000_000L);

    private static Reply run(Database db, String... parts) {
        return CommandDispatcher.execute(db, Command.of(parts));
    }

    @Test
    public void testMissingFileStartsEmpty() {
        SnapshotFile file = new SnapshotFile(dir.resolve("none.snapshot"));
        Database db = file.load(8, clock);
        assertEquals(0, db.size());
        assertEquals(8, db.shardCount());
    }

    @Test
    public void testSaveAndLoad() throws IOException {
        Path path = dir.resolve("nested").resolve("data.snapshot");
        SnapshotFile file = new SnapshotFile(path);
        Database db = new Database(8, clock);
        run(db, "SET", "a", "1");
        run(db, "RPUSH", "l", "x", "y");
        file.save(db);

        assertTrue(Files.exists(path));
        try (Stream<Path> files = Files.list(path.getParent())) {
            assertEquals(1, files.count(), "temporary file left behind");
        }

        Database loaded = new SnapshotFile(path).load(16, clock);
        assertEquals(2, loaded.size());
        assertEquals(Reply.bulk("1"), run(loaded, "GET", "a"));
        assertEquals(Reply.integer(2), run(loaded, "LLEN", "l"));
    }

    @Test
    public void testSaveReplacesPreviousSnapshot() throws IOException {
        Path path = dir.resolve("data.snapshot");
        SnapshotFile file = new SnapshotFile(path);
        Database db = new Database(8, clock);
        run(db, "SET", "a", "1");
        file.save(db);
        run(db, "DEL", "a");
        run(db, "SET", "b", "2");
        file.save(db);

        Database loaded = file.load(8, clock);
        assertEquals(Reply.integer(0), run(loaded, "EXISTS", "a"));
        assertEquals(Reply.bulk("2"), run(loaded, "GET", "b"));
    }

    @Test
    public void testSaveIfDirty() throws IOException {
        SnapshotFile file = new SnapshotFile(dir.resolve("dirty.snapshot"));
        Database db = new Database(8, clock);
        assertFalse(file.saveIfDirty(db));
        assertFalse(Files.exists(file.getPath()));

        run(db, "SET", "a", "1");
        assertTrue(file.saveIfDirty(db));
        assertFalse(file.saveIfDirty(db));

        run(db, "GET", "a");
        assertFalse(file.saveIfDirty(db));

        run(db, "INCR", "a");
        assertTrue(file.saveIfDirty(db));
    }

    @Test
    public void testCorruptFileFailsLoad() throws IOException {
        Path path = dir.resolve("bad.snapshot");
        Files.write(path, new byte[] {'C', 'I', 'N', 'D', 'E', 'R', '0', '0', '0', '1', 0x00, 0x01});
        SnapshotException e = assertThrows(SnapshotException.class, () -> new SnapshotFile(path).load(8, clock));
        assertNotNull(e.getCause());
    }

    @Test
    public void testPeriodicSaveStops() throws Exception {
        SnapshotFile file = new SnapshotFile(dir.resolve("periodic.snapshot"));
        Database db = new Database(8, clock);
        run(db, "SET", "a", "1");
        file.startPeriodicSave(db, 1);
        long deadline = System.currentTimeMillis() + 5000;
        while (!Files.exists(file.getPath()) && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        file.stop();
        assertTrue(Files.exists(file.getPath()));
        assertFalse(file.saveIfDirty(db));
    }
}
