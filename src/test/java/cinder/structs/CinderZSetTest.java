package cinder.structs;

import cinder.db.ByteString;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CinderZSetTest {

    private static ByteString b(String s) {
        return ByteString.of(s);
    }

    @Test
    public void testScoreUpdateRepositions() {
        CinderZSet zset = new CinderZSet();
        assertEquals(1, zset.add(10.0, b("A")));
        assertEquals(1, zset.add(15.0, b("B")));

        assertEquals(0, zset.add(20.0, b("A")));
        assertEquals(2, zset.size());
        assertEquals(20.0, zset.score(b("A")));

        // no ghost node left at the old score
        assertEquals(2, zset.ordered().size());
        assertEquals(b("B"), zset.ordered().first().member);
        assertEquals(b("A"), zset.ordered().last().member);
    }

    @Test
    public void testTiesOrderedByMember() {
        CinderZSet zset = new CinderZSet();
        zset.add(1.0, b("c"));
        zset.add(1.0, b("a"));
        zset.add(1.0, b("b"));
        List<ZNode> all = zset.rangeByRank(0, -1);
        assertEquals(b("a"), all.get(0).member);
        assertEquals(b("b"), all.get(1).member);
        assertEquals(b("c"), all.get(2).member);
    }

    @Test
    public void testInfinitiesAndNegativeZero() {
        CinderZSet zset = new CinderZSet();
        zset.add(Double.POSITIVE_INFINITY, b("inf"));
        zset.add(Double.NEGATIVE_INFINITY, b("-inf"));
        zset.add(-0.0, b("zero"));

        assertEquals(0, zset.add(0.0, b("zero")));
        assertEquals(0, zset.rank(b("-inf")));
        assertEquals(1, zset.rank(b("zero")));
        assertEquals(2, zset.rank(b("inf")));
    }

    @Test
    public void testNaNRejected() {
        CinderZSet zset = new CinderZSet();
        assertThrows(IllegalArgumentException.class, () -> zset.add(Double.NaN, b("x")));
        assertEquals(0, zset.size());
    }

    @Test
    public void testRangeByRankClamps() {
        CinderZSet zset = new CinderZSet();
        for (int i = 0; i < 5; i++) {
            zset.add(i, b("m" + i));
        }
        assertEquals(5, zset.rangeByRank(-100, 100).size());
        assertEquals(2, zset.rangeByRank(-2, -1).size());
        assertEquals(b("m3"), zset.rangeByRank(-2, -1).get(0).member);
        assertTrue(zset.rangeByRank(3, 1).isEmpty());
        assertTrue(zset.rangeByRank(5, 10).isEmpty());
    }

    @Test
    public void testRemove() {
        CinderZSet zset = new CinderZSet();
        zset.add(1, b("a"));
        assertTrue(zset.remove(b("a")));
        assertFalse(zset.remove(b("a")));
        assertEquals(-1, zset.rank(b("a")));
        assertTrue(zset.ordered().isEmpty());
    }
}
