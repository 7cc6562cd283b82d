package cinder.network;

import cinder.commands.CommandContainer;
import cinder.commands.CommandDispatcher;
import cinder.commands.CommandMetadata;
import cinder.commands.CommandRegistry;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.utils.Log;

import java.util.ArrayDeque;

/**
 * Per-client state: the lifecycle state machine and the queue of decoded commands that have
 * not run yet. Commands run strictly in arrival order; execution pauses while the
 * {@link ReplySink} is not writable. Not thread-safe; owned by one event loop.
 */
public class Connection {
    private final long id;
    private final Database db;
    private final long slowlogThresholdMicros;
    private final ArrayDeque<Command> pending = new ArrayDeque<>();
    private ConnectionState state = ConnectionState.CONNECTING;
    private long executedCommands;

    public Connection(long id, Database db, long slowlogThresholdMicros) {
        this.id = id;
        this.db = db;
        this.slowlogThresholdMicros = slowlogThresholdMicros;
    }

    public long getId() {
        return id;
    }

    public ConnectionState getState() {
        return state;
    }

    public void transition(ConnectionState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("connection " + id + ": illegal transition " + state + " -> " + next);
        }
        state = next;
    }

    public void activate() {
        transition(ConnectionState.READING_COMMAND);
    }

    public boolean isClosing() {
        return state == ConnectionState.CLOSING || state == ConnectionState.CLOSED;
    }

    /**
     * Moves to CLOSING and drops every command that has not started. Returns false when the
     * connection was already closing.
     */
    public boolean beginClose() {
        if (isClosing()) return false;
        transition(ConnectionState.CLOSING);
        pending.clear();
        return true;
    }

    public void closed() {
        beginClose();
        if (state == ConnectionState.CLOSING) transition(ConnectionState.CLOSED);
    }

    /** Queues a decoded command; ignored once the connection is closing. */
    public void enqueue(Command command) {
        if (isClosing()) return;
        pending.add(command);
    }

    public boolean hasPending() {
        return !pending.isEmpty();
    }

    public int pendingCount() {
        return pending.size();
    }

    public long getExecutedCommands() {
        return executedCommands;
    }

    /**
     * Runs queued commands and writes their replies until the queue is empty, the sink stops
     * being writable, or a command asks for the connection to close.
     *
     * @return the number of commands executed
     */
    public int drain(ReplySink sink) {
        int executed = 0;
        while (state == ConnectionState.READING_COMMAND && !pending.isEmpty()) {
            if (!sink.isWritable()) {
                sink.flush();
                break;
            }
            Command command = pending.poll();
            CommandContainer container = CommandRegistry.get(command.getName());

            transition(ConnectionState.EXECUTING);
            long start = System.nanoTime();
            Reply reply = CommandDispatcher.execute(db, command, container);
            long micros = (System.nanoTime() - start) / 1000;
            if (micros > slowlogThresholdMicros) {
                Log.warn("[Slowlog] " + micros + "us conn=" + id + " " + abbreviate(command));
            }
            executed++;
            executedCommands++;

            transition(ConnectionState.WRITING_REPLY);
            sink.write(reply);
            if (container != null && container.getMetadata().hasFlag(CommandMetadata.CLOSE)) {
                beginClose();
                sink.closeAfterFlush();
                break;
            }
            transition(ConnectionState.READING_COMMAND);
        }
        return executed;
    }

    private static String abbreviate(Command command) {
        String s = command.toString();
        return s.length() > 128 ? s.substring(0, 128) + "..." : s;
    }

    @Override
    public String toString() {
        return "Connection{id=" + id + ", state=" + state + ", pending=" + pending.size() + "}";
    }
}
