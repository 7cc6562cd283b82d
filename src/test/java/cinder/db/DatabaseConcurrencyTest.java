package cinder.db;

import cinder.commands.CommandDispatcher;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

public class DatabaseConcurrencyTest {

    @Test
    public void testConcurrentIncrementsAreNotLost() throws Exception {
        Database db = new Database(8);
        int threads = 8;
        int perThread = 2_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    CommandDispatcher.execute(db, Command.of("INCR", "counter"));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        pool.shutdown();

        Reply value = CommandDispatcher.execute(db, Command.of("GET", "counter"));
        assertEquals(Reply.bulk(String.valueOf(threads * perThread)), value);
    }

    @Test
    public void testMultiKeyWritesAreSeenAtomically() throws Exception {
        Database db = new Database(16);
        CommandDispatcher.execute(db, Command.of("MSET", "left", "0", "right", "0"));

        AtomicBoolean running = new AtomicBoolean(true);
        AtomicBoolean torn = new AtomicBoolean(false);
        Thread writer = new Thread(() -> {
            for (int i = 1; running.get() && i < 20_000; i++) {
                String v = Integer.toString(i);
                CommandDispatcher.execute(db, Command.of("MSET", "left", v, "right", v));
            }
        });
        Thread reader = new Thread(() -> {
            while (running.get()) {
                Reply.ArrayReply r = (Reply.ArrayReply) CommandDispatcher.execute(db, Command.of("MGET", "left", "right"));
                String l = ((Reply.BulkReply) r.getItems().get(0)).asString();
                String rr = ((Reply.BulkReply) r.getItems().get(1)).asString();
                if (!l.equals(rr)) torn.set(true);
            }
        });
        writer.start();
        reader.start();
        writer.join(30_000);
        running.set(false);
        reader.join(30_000);

        assertFalse(torn.get(), "MGET observed a half-applied MSET");
    }

    @Test
    public void testOpposingMultiKeyOrdersDoNotDeadlock() throws Exception {
        Database db = new Database(16);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        Future<?> a = pool.submit(() -> {
            for (int i = 0; i < 5_000; i++) CommandDispatcher.execute(db, Command.of("DEL", "x", "y", "z"));
        });
        Future<?> b = pool.submit(() -> {
            for (int i = 0; i < 5_000; i++) CommandDispatcher.execute(db, Command.of("MSET", "z", "1", "y", "2", "x", "3"));
        });
        a.get(30, TimeUnit.SECONDS);
        b.get(30, TimeUnit.SECONDS);
        pool.shutdown();
        assertTrue(db.size() == 0 || db.size() == 3);
    }
}
