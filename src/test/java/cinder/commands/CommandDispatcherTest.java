package cinder.commands;

import cinder.protocol.Reply;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CommandDispatcherTest extends CommandTestSupport {

    @Test
    public void testUnknownCommandEchoesArguments() {
        assertReply(err("unknown command 'FROB', with args beginning with: 'a' 'b' "), "frob", "a", "b");
        assertReply(err("unknown command 'NOPE', with args beginning with: "), "NOPE");
    }

    @Test
    public void testUnknownCommandTruncatesLongArguments() {
        String longArg = "x".repeat(500);
        Reply.ErrorReply reply = (Reply.ErrorReply) run("FROB", longArg, "tail");
        assertTrue(reply.getMessage().length() < 250, reply.getMessage());
        assertFalse(reply.getMessage().contains("tail"));
    }

    @Test
    public void testVerbIsCaseInsensitive() {
        assertReply(Reply.ok(), "sEt", "k", "v");
        assertReply(bulk("v"), "get", "k");
    }

    @Test
    public void testWrongArity() {
        assertReply(err("wrong number of arguments for 'get' command"), "GET");
        assertReply(err("wrong number of arguments for 'get' command"), "GET", "a", "b");
        assertReply(err("wrong number of arguments for 'set' command"), "SET", "k");
        assertReply(err("wrong number of arguments for 'mset' command"), "MSET", "a", "1", "b");
        assertReply(err("wrong number of arguments for 'hset' command"), "HSET", "h", "f", "v", "g");
        assertEquals(0, db.getChanges());
    }

    @Test
    public void testWrongTypeLeavesValueIntact() {
        run("LPUSH", "l", "x");
        assertReply(WRONGTYPE, "GET", "l");
        assertReply(WRONGTYPE, "SADD", "l", "m");
        assertReply(WRONGTYPE, "HSET", "l", "f", "v");
        assertReply(WRONGTYPE, "ZADD", "l", "1", "m");
        assertReply(WRONGTYPE, "INCR", "l");
        assertReply(array("x"), "LRANGE", "l", "0", "-1");
    }

    @Test
    public void testSetGetDelScenario() {
        assertReply(Reply.ok(), "SET", "foo", "bar");
        assertReply(bulk("bar"), "GET", "foo");
        assertReply(integer(1), "DEL", "foo");
        assertReply(Reply.nullBulk(), "GET", "foo");
        assertReply(integer(0), "DEL", "foo");
    }

    @Test
    public void testSetAddIsIdempotent() {
        assertReply(integer(1), "SADD", "s", "a");
        assertReply(integer(0), "SADD", "s", "a");
        assertReply(integer(1), "SCARD", "s");
    }

    @Test
    public void testWriteCommandsMarkDatabaseDirty() {
        run("GET", "k");
        run("EXISTS", "k");
        assertEquals(0, db.getChanges());
        run("SET", "k", "v");
        long afterSet = db.getChanges();
        assertTrue(afterSet > 0);
        run("GET", "k");
        assertEquals(afterSet, db.getChanges());
    }

    @Test
    public void testEveryRegisteredCommandHasSaneMetadata() {
        for (String name : CommandRegistry.names()) {
            CommandContainer c = CommandRegistry.get(name);
            assertEquals(name, c.getName());
            CommandMetadata meta = c.getMetadata();
            assertTrue(meta.getMinArity() >= 1, name);
            assertTrue(meta.getMaxArity() == CommandMetadata.UNBOUNDED || meta.getMaxArity() >= meta.getMinArity(), name);
            assertFalse(meta.hasFlag(CommandMetadata.WRITE) && meta.hasFlag(CommandMetadata.READONLY), name);
        }
        assertTrue(CommandRegistry.get("QUIT").getMetadata().hasFlag(CommandMetadata.CLOSE));
        assertNull(CommandRegistry.get("get"));
    }

    @Test
    public void testPingAndEcho() {
        assertReply(Reply.pong(), "PING");
        assertReply(bulk("hello"), "PING", "hello");
        assertReply(bulk("hi there"), "ECHO", "hi there");
        assertReply(Reply.ok(), "QUIT");
    }
}
