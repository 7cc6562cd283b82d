package cinder.commands.zset;

import cinder.commands.CommandTestSupport;
import cinder.commands.FormatException;
import cinder.protocol.Reply;
import org.junit.jupiter.api.Test;

public class ZSetCommandsTest extends CommandTestSupport {

    @Test
    public void testAddAndRange() {
        assertReply(integer(3), "ZADD", "z", "1", "a", "2", "b", "3", "c");
        assertReply(integer(0), "ZADD", "z", "5", "a");
        assertReply(array("b", "c", "a"), "ZRANGE", "z", "0", "-1");
        assertReply(array("b", "2", "c", "3", "a", "5"), "ZRANGE", "z", "0", "-1", "WITHSCORES");
        assertReply(array("a"), "ZRANGE", "z", "-1", "-1");
        assertReply(Reply.emptyArray(), "ZRANGE", "z", "5", "9");
        assertReply(Reply.emptyArray(), "ZRANGE", "missing", "0", "-1");
        assertReply(SYNTAX, "ZRANGE", "z", "0", "-1", "WITHGARBAGE");
        assertReply(integer(3), "ZCARD", "z");
    }

    @Test
    public void testChangedCount() {
        run("ZADD", "z", "1", "a", "2", "b");
        assertReply(integer(2), "ZADD", "z", "CH", "6", "a", "7", "d", "2", "b");
        assertReply(integer(1), "ZADD", "z", "ch", "7", "d", "8", "e");
    }

    @Test
    public void testConditionalAdd() {
        run("ZADD", "z", "1", "a");
        assertReply(integer(1), "ZADD", "z", "NX", "100", "a", "2", "f");
        assertReply(bulk("1"), "ZSCORE", "z", "a");
        assertReply(integer(0), "ZADD", "z", "XX", "0", "a", "1", "g");
        assertReply(bulk("0"), "ZSCORE", "z", "a");
        assertReply(Reply.nullBulk(), "ZSCORE", "z", "g");

        assertReply(integer(0), "ZADD", "fresh", "XX", "1", "a");
        assertReply(integer(0), "EXISTS", "fresh");
    }

    @Test
    public void testAddRejectsBadInput() {
        assertReply(err("XX and NX options at the same time are not compatible"), "ZADD", "z", "NX", "XX", "1", "a");
        assertReply(SYNTAX, "ZADD", "z", "NX", "1");
        assertReply(SYNTAX, "ZADD", "z", "1", "a", "2");
        assertReply(err(FormatException.NOT_A_FLOAT), "ZADD", "z", "nan", "a");
        assertReply(err(FormatException.NOT_A_FLOAT), "ZADD", "z", "abc", "a");
        assertReply(integer(0), "EXISTS", "z");
    }

    @Test
    public void testScoresAndTies() {
        run("ZADD", "z", "1.5", "half", "inf", "top", "-inf", "bottom", "1.5", "alpha");
        assertReply(bulk("1.5"), "ZSCORE", "z", "half");
        assertReply(bulk("inf"), "ZSCORE", "z", "top");
        assertReply(bulk("-inf"), "ZSCORE", "z", "bottom");
        // equal scores fall back to member order
        assertReply(array("bottom", "alpha", "half", "top"), "ZRANGE", "z", "0", "-1");
    }

    @Test
    public void testRankAndRemove() {
        run("ZADD", "z", "10", "a", "20", "b", "30", "c");
        assertReply(integer(0), "ZRANK", "z", "a");
        assertReply(integer(2), "ZRANK", "z", "c");
        assertReply(Reply.nullBulk(), "ZRANK", "z", "nope");
        assertReply(Reply.nullBulk(), "ZRANK", "missing", "a");

        assertReply(integer(2), "ZREM", "z", "a", "b", "nope");
        assertReply(integer(0), "ZRANK", "z", "c");
        assertReply(integer(1), "ZREM", "z", "c");
        assertReply(integer(0), "EXISTS", "z");
        assertReply(integer(0), "ZCARD", "z");
    }

    @Test
    public void testWrongType() {
        run("SET", "s", "v");
        assertReply(WRONGTYPE, "ZADD", "s", "1", "a");
        assertReply(WRONGTYPE, "ZRANGE", "s", "0", "-1");
        assertReply(WRONGTYPE, "ZSCORE", "s", "a");
        assertReply(WRONGTYPE, "ZRANK", "s", "a");
    }
}
