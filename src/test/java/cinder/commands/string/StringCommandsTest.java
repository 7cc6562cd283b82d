package cinder.commands.string;

import cinder.commands.CommandTestSupport;
import cinder.protocol.Reply;
import org.junit.jupiter.api.Test;

public class StringCommandsTest extends CommandTestSupport {

    @Test
    public void testSetConditions() {
        assertReply(Reply.nullBulk(), "SET", "k", "v", "XX");
        assertReply(Reply.nullBulk(), "GET", "k");
        assertReply(Reply.ok(), "SET", "k", "v", "NX");
        assertReply(Reply.nullBulk(), "SET", "k", "other", "NX");
        assertReply(bulk("v"), "GET", "k");
        assertReply(Reply.ok(), "SET", "k", "w", "XX");
        assertReply(bulk("w"), "GET", "k");
    }

    @Test
    public void testSetGetReturnsPreviousValue() {
        assertReply(Reply.nullBulk(), "SET", "k", "1", "GET");
        assertReply(bulk("1"), "SET", "k", "2", "GET");
        assertReply(bulk("2"), "GET", "k");
        // condition not met: old value still reported, nothing written
        assertReply(bulk("2"), "SET", "k", "3", "NX", "GET");
        assertReply(bulk("2"), "GET", "k");
    }

    @Test
    public void testSetWithExpiry() {
        assertReply(Reply.ok(), "SET", "a", "v", "EX", "10");
        assertReply(integer(10), "TTL", "a");
        assertReply(Reply.ok(), "SET", "b", "v", "PX", "1500");
        assertReply(integer(1500), "PTTL", "b");
        assertReply(Reply.ok(), "SET", "c", "v", "EXAT", "1700000100");
        assertReply(integer(100), "TTL", "c");
        assertReply(Reply.ok(), "SET", "d", "v", "pxat", "1700000000250");
        assertReply(integer(250), "PTTL", "d");

        clock.advance(1501);
        assertReply(Reply.nullBulk(), "GET", "b");
        assertReply(bulk("v"), "GET", "a");
    }

    @Test
    public void testSetKeepTtl() {
        run("SET", "k", "v", "EX", "100");
        assertReply(Reply.ok(), "SET", "k", "v2", "KEEPTTL");
        assertReply(integer(100), "TTL", "k");
        assertReply(Reply.ok(), "SET", "k", "v3");
        assertReply(integer(-1), "TTL", "k");
    }

    @Test
    public void testSetAbsoluteTimeInThePastDeletes() {
        run("SET", "k", "v");
        assertReply(Reply.ok(), "SET", "k", "v2", "PXAT", "1000");
        assertReply(Reply.nullBulk(), "GET", "k");
        assertReply(integer(0), "EXISTS", "k");
    }

    @Test
    public void testSetRejectsBadOptions() {
        assertReply(err("invalid expire time in 'set' command"), "SET", "k", "v", "EX", "0");
        assertReply(err("invalid expire time in 'set' command"), "SET", "k", "v", "PX", "-5");
        assertReply(NOT_AN_INTEGER, "SET", "k", "v", "EX", "ten");
        assertReply(SYNTAX, "SET", "k", "v", "EX", "10", "PX", "10");
        assertReply(SYNTAX, "SET", "k", "v", "NX", "XX");
        assertReply(SYNTAX, "SET", "k", "v", "EX");
        assertReply(SYNTAX, "SET", "k", "v", "KEEPTTL", "EX", "5");
        assertReply(SYNTAX, "SET", "k", "v", "BOGUS");
        assertReply(integer(0), "EXISTS", "k");
    }

    @Test
    public void testSetOverwritesOtherTypes() {
        run("RPUSH", "k", "a");
        assertReply(Reply.ok(), "SET", "k", "v");
        assertReply(Reply.status("string"), "TYPE", "k");
    }

    @Test
    public void testCounters() {
        assertReply(integer(1), "INCR", "n");
        assertReply(integer(11), "INCRBY", "n", "10");
        assertReply(integer(10), "DECR", "n");
        assertReply(integer(-5), "DECRBY", "n", "15");
        assertReply(bulk("-5"), "GET", "n");
        assertReply(integer(-3), "INCRBY", "fresh", "-3");
    }

    @Test
    public void testCounterRejectsNonIntegers() {
        run("SET", "s", "abc");
        assertReply(NOT_AN_INTEGER, "INCR", "s");
        run("SET", "s", " 1");
        assertReply(NOT_AN_INTEGER, "INCR", "s");
        run("SET", "s", "+1");
        assertReply(NOT_AN_INTEGER, "INCR", "s");
        run("SET", "s", "01");
        assertReply(NOT_AN_INTEGER, "INCR", "s");
        run("SET", "s", "1.5");
        assertReply(NOT_AN_INTEGER, "INCR", "s");
        assertReply(NOT_AN_INTEGER, "INCRBY", "n", "x");
        assertReply(bulk("1.5"), "GET", "s");
    }

    @Test
    public void testCounterOverflow() {
        run("SET", "n", Long.toString(Long.MAX_VALUE));
        assertReply(err("increment or decrement would overflow"), "INCR", "n");
        assertReply(bulk(Long.toString(Long.MAX_VALUE)), "GET", "n");

        run("SET", "m", Long.toString(Long.MIN_VALUE));
        assertReply(err("increment or decrement would overflow"), "DECR", "m");
        assertReply(err("decrement would overflow"), "DECRBY", "x", Long.toString(Long.MIN_VALUE));
        assertReply(NOT_AN_INTEGER, "INCRBY", "x", "9223372036854775808");
    }

    @Test
    public void testIncrKeepsTtl() {
        run("SET", "n", "5", "EX", "50");
        run("INCR", "n");
        assertReply(integer(50), "TTL", "n");
    }

    @Test
    public void testAppendAndStrlen() {
        assertReply(integer(0), "STRLEN", "k");
        assertReply(integer(5), "APPEND", "k", "hello");
        assertReply(integer(11), "APPEND", "k", " world");
        assertReply(bulk("hello world"), "GET", "k");
        assertReply(integer(11), "STRLEN", "k");

        run("SET", "t", "x", "EX", "30");
        run("APPEND", "t", "y");
        assertReply(integer(30), "TTL", "t");

        run("SADD", "set", "m");
        assertReply(WRONGTYPE, "APPEND", "set", "z");
        assertReply(WRONGTYPE, "STRLEN", "set");
    }

    @Test
    public void testMultiGetAndSet() {
        assertReply(Reply.ok(), "MSET", "a", "1", "b", "2", "c", "3");
        run("LPUSH", "list", "x");
        assertReply(array("1", null, "3", null), "MGET", "a", "missing", "c", "list");
        assertReply(Reply.ok(), "MSET", "a", "10", "a", "11");
        assertReply(bulk("11"), "GET", "a");
    }
}
