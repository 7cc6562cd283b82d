package cinder.commands;

import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.utils.MockClock;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Runs commands through the dispatcher against a fresh database with a controllable clock.
 */
public abstract class CommandTestSupport {
    protected static final Reply WRONGTYPE =
            Reply.error("WRONGTYPE", "Operation against a key holding the wrong kind of value");
    protected static final Reply NOT_AN_INTEGER = Reply.error("ERR", FormatException.NOT_AN_INTEGER);
    protected static final Reply SYNTAX = Reply.error("ERR", "syntax error");

    protected MockClock clock;
    protected Database db;

    @BeforeEach
    public void setupDatabase() {
        clock = new MockClock(1_700_000_000_000L);
        db = new Database(16, clock);
    }

    protected Reply run(String... parts) {
        return CommandDispatcher.execute(db, Command.of(parts));
    }

    protected void assertReply(Reply expected, String... parts) {
        assertEquals(expected, run(parts), String.join(" ", parts));
    }

    protected static Reply bulk(String s) {
        return Reply.bulk(s);
    }

    protected static Reply integer(long n) {
        return Reply.integer(n);
    }

    protected static Reply array(String... items) {
        List<Reply> replies = new ArrayList<>();
        for (String item : items) {
            replies.add(item == null ? Reply.nullBulk() : Reply.bulk(item));
        }
        return Reply.array(replies);
    }

    protected static Reply err(String message) {
        return Reply.error("ERR", message);
    }

    /** Array reply of bulk strings as an unordered set. */
    protected static Set<String> members(Reply reply) {
        Set<String> out = new HashSet<>();
        for (Reply item : ((Reply.ArrayReply) reply).getItems()) {
            out.add(((Reply.BulkReply) item).asString());
        }
        return out;
    }

    protected static Set<String> setOf(String... items) {
        return new HashSet<>(List.of(items));
    }
}
