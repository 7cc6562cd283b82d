package cinder.structs;

import cinder.db.ByteString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Sorted set: a member → score map plus a tree ordered by (score, member).
 * Both structures change together so the ordering never disagrees with the scores.
 */
public class CinderZSet implements Iterable<ZNode> {
    private final Map<ByteString, Double> scores = new HashMap<>();
    private final TreeSet<ZNode> sorted = new TreeSet<>();

    /**
     * Inserts or re-scores a member. Returns 1 when the member is new, 0 otherwise.
     */
    public int add(double score, ByteString member) {
        if (Double.isNaN(score)) throw new IllegalArgumentException("NaN score");
        // -0.0 and 0.0 must land on the same position
        if (score == 0.0) score = 0.0;

        Double oldScore = scores.get(member);
        if (oldScore != null) {
            if (oldScore == score) return 0;
            sorted.remove(new ZNode(oldScore, member));
            scores.put(member, score);
            sorted.add(new ZNode(score, member));
            return 0;
        }
        scores.put(member, score);
        sorted.add(new ZNode(score, member));
        return 1;
    }

    public boolean remove(ByteString member) {
        Double score = scores.remove(member);
        if (score == null) return false;
        sorted.remove(new ZNode(score, member));
        return true;
    }

    public Double score(ByteString member) {
        return scores.get(member);
    }

    public int size() {
        return scores.size();
    }

    /**
     * Zero-based position of the member in ascending order, or -1 when absent.
     */
    public long rank(ByteString member) {
        Double score = scores.get(member);
        if (score == null) return -1;
        return sorted.headSet(new ZNode(score, member), false).size();
    }

    /**
     * Members between two ranks, inclusive, with negative ranks counting from the highest score.
     */
    public List<ZNode> rangeByRank(long start, long stop) {
        int size = sorted.size();
        if (start < 0) start += size;
        if (stop < 0) stop += size;
        if (start < 0) start = 0;
        if (stop >= size) stop = size - 1;
        if (start > stop || start >= size) return Collections.emptyList();

        List<ZNode> result = new ArrayList<>((int) (stop - start + 1));
        Iterator<ZNode> it = sorted.iterator();
        for (int idx = 0; idx <= stop && it.hasNext(); idx++) {
            ZNode node = it.next();
            if (idx >= start) result.add(node);
        }
        return result;
    }

    public NavigableSet<ZNode> ordered() {
        return Collections.unmodifiableNavigableSet(sorted);
    }

    @Override
    public Iterator<ZNode> iterator() {
        return ordered().iterator();
    }
}
