package cinder.structs;

import cinder.db.ByteString;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Set value. Guarded by the shard lock of the owning key.
 */
public class CinderSet {
    private final Set<ByteString> members = new HashSet<>();

    public boolean add(ByteString member) {
        return members.add(member);
    }

    public boolean remove(ByteString member) {
        return members.remove(member);
    }

    public boolean contains(ByteString member) {
        return members.contains(member);
    }

    public int size() {
        return members.size();
    }

    public Set<ByteString> members() {
        return Collections.unmodifiableSet(members);
    }

    /**
     * Intersection of all sets. A null entry stands for an absent key, i.e. the empty set.
     */
    public static Set<ByteString> intersect(List<CinderSet> sets) {
        Set<ByteString> result = new HashSet<>();
        if (sets.isEmpty() || sets.contains(null)) return result;

        CinderSet smallest = sets.get(0);
        for (CinderSet s : sets) {
            if (s.size() < smallest.size()) smallest = s;
        }
        outer:
        for (ByteString member : smallest.members) {
            for (CinderSet s : sets) {
                if (s != smallest && !s.contains(member)) continue outer;
            }
            result.add(member);
        }
        return result;
    }

    public static Set<ByteString> union(List<CinderSet> sets) {
        Set<ByteString> result = new HashSet<>();
        for (CinderSet s : sets) {
            if (s != null) result.addAll(s.members);
        }
        return result;
    }

    /**
     * Members of the first set not present in any of the others.
     */
    public static Set<ByteString> difference(List<CinderSet> sets) {
        Set<ByteString> result = new HashSet<>();
        if (sets.isEmpty() || sets.get(0) == null) return result;
        result.addAll(sets.get(0).members);
        for (int i = 1; i < sets.size() && !result.isEmpty(); i++) {
            CinderSet s = sets.get(i);
            if (s != null) result.removeAll(s.members);
        }
        return result;
    }

    public void addAll(Collection<ByteString> values) {
        members.addAll(values);
    }
}
