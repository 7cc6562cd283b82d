package cinder.network;

import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConnectionTest {

    static class ListSink implements ReplySink {
        final List<Reply> replies = new ArrayList<>();
        int capacity = Integer.MAX_VALUE;
        int flushes;
        boolean closeRequested;

        @Override
        public boolean isWritable() {
            return replies.size() < capacity;
        }

        @Override
        public void write(Reply reply) {
            replies.add(reply);
        }

        @Override
        public void flush() {
            flushes++;
        }

        @Override
        public void closeAfterFlush() {
            closeRequested = true;
        }
    }

    private Database db;
    private Connection conn;
    private ListSink sink;

    @BeforeEach
    public void setup() {
        db = new Database(4);
        conn = new Connection(7, db, Long.MAX_VALUE);
        sink = new ListSink();
    }

    @Test
    public void testNothingRunsBeforeActivation() {
        assertEquals(ConnectionState.CONNECTING, conn.getState());
        conn.enqueue(Command.of("PING"));
        assertEquals(0, conn.drain(sink));
        assertTrue(sink.replies.isEmpty());
        assertEquals(1, conn.pendingCount());
    }

    @Test
    public void testRepliesInArrivalOrder() {
        conn.activate();
        conn.enqueue(Command.of("PING"));
        conn.enqueue(Command.of("SET", "k", "v"));
        conn.enqueue(Command.of("GET", "k"));
        conn.enqueue(Command.of("NOSUCH"));

        assertEquals(4, conn.drain(sink));
        assertEquals(Reply.pong(), sink.replies.get(0));
        assertEquals(Reply.ok(), sink.replies.get(1));
        assertEquals(Reply.bulk("v"), sink.replies.get(2));
        assertEquals(Reply.Type.ERROR, sink.replies.get(3).type());
        assertEquals(ConnectionState.READING_COMMAND, conn.getState());
        assertEquals(4, conn.getExecutedCommands());
        assertFalse(conn.hasPending());
    }

    @Test
    public void testTransitionTable() {
        for (ConnectionState s : ConnectionState.values()) {
            boolean closable = s != ConnectionState.CLOSING && s != ConnectionState.CLOSED;
            assertEquals(closable, s.canTransitionTo(ConnectionState.CLOSING), s.name());
        }
        assertTrue(ConnectionState.CONNECTING.canTransitionTo(ConnectionState.READING_COMMAND));
        assertTrue(ConnectionState.READING_COMMAND.canTransitionTo(ConnectionState.EXECUTING));
        assertTrue(ConnectionState.EXECUTING.canTransitionTo(ConnectionState.WRITING_REPLY));
        assertTrue(ConnectionState.WRITING_REPLY.canTransitionTo(ConnectionState.READING_COMMAND));
        assertTrue(ConnectionState.CLOSING.canTransitionTo(ConnectionState.CLOSED));

        assertFalse(ConnectionState.CONNECTING.canTransitionTo(ConnectionState.EXECUTING));
        assertFalse(ConnectionState.READING_COMMAND.canTransitionTo(ConnectionState.WRITING_REPLY));
        assertFalse(ConnectionState.EXECUTING.canTransitionTo(ConnectionState.READING_COMMAND));
        for (ConnectionState s : ConnectionState.values()) {
            assertFalse(ConnectionState.CLOSED.canTransitionTo(s));
        }
    }

    @Test
    public void testIllegalTransitionThrows() {
        assertThrows(IllegalStateException.class, () -> conn.transition(ConnectionState.EXECUTING));
        conn.closed();
        assertEquals(ConnectionState.CLOSED, conn.getState());
        assertThrows(IllegalStateException.class, () -> conn.transition(ConnectionState.READING_COMMAND));
    }

    @Test
    public void testPausesWhileSinkIsFull() {
        conn.activate();
        for (int i = 0; i < 5; i++) {
            conn.enqueue(Command.of("INCR", "n"));
        }
        sink.capacity = 2;
        assertEquals(2, conn.drain(sink));
        assertEquals(1, sink.flushes);
        assertEquals(3, conn.pendingCount());
        assertEquals(ConnectionState.READING_COMMAND, conn.getState());

        sink.capacity = Integer.MAX_VALUE;
        assertEquals(3, conn.drain(sink));
        assertEquals(Reply.integer(5), sink.replies.get(4));
        assertFalse(conn.hasPending());
    }

    @Test
    public void testQuitDropsLaterCommands() {
        conn.activate();
        conn.enqueue(Command.of("PING"));
        conn.enqueue(Command.of("QUIT"));
        conn.enqueue(Command.of("SET", "after", "quit"));

        assertEquals(2, conn.drain(sink));
        assertEquals(List.of(Reply.pong(), Reply.ok()), sink.replies);
        assertTrue(sink.closeRequested);
        assertEquals(ConnectionState.CLOSING, conn.getState());
        assertFalse(conn.hasPending());

        conn.enqueue(Command.of("PING"));
        assertFalse(conn.hasPending());
        assertEquals(0, conn.drain(sink));
        assertEquals(0, db.size());
    }

    @Test
    public void testBeginCloseOnlyOnce() {
        conn.activate();
        conn.enqueue(Command.of("PING"));
        assertTrue(conn.beginClose());
        assertFalse(conn.beginClose());
        assertFalse(conn.hasPending());
        conn.closed();
        conn.closed();
        assertEquals(ConnectionState.CLOSED, conn.getState());
    }

    @Test
    public void testRegistryLimit() {
        ClientRegistry registry = new ClientRegistry(2);
        assertTrue(registry.tryRegister());
        assertTrue(registry.tryRegister());
        assertFalse(registry.tryRegister());
        assertEquals(2, registry.connectedClients());
        registry.unregister();
        assertTrue(registry.tryRegister());
        assertNotEquals(registry.nextId(), registry.nextId());
    }
}
