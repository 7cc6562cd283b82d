package cinder.structs;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * List value. Not thread-safe; guarded by the shard lock of the owning key.
 */
public class CinderList implements Iterable<byte[]> {
    private final ArrayDeque<byte[]> items = new ArrayDeque<>();

    public int pushLeft(byte[] value) {
        items.addFirst(value);
        return items.size();
    }

    public int pushRight(byte[] value) {
        items.addLast(value);
        return items.size();
    }

    public byte[] popLeft() {
        return items.pollFirst();
    }

    public byte[] popRight() {
        return items.pollLast();
    }

    public int size() {
        return items.size();
    }

    /**
     * Inclusive range; negative indexes count from the tail. Out-of-range bounds are clamped.
     */
    public List<byte[]> range(long start, long stop) {
        int size = items.size();
        if (start < 0) start += size;
        if (stop < 0) stop += size;
        if (start < 0) start = 0;
        if (stop >= size) stop = size - 1;
        if (start > stop || start >= size) return Collections.emptyList();

        List<byte[]> result = new ArrayList<>((int) (stop - start + 1));
        Iterator<byte[]> it = items.iterator();
        for (int idx = 0; idx <= stop && it.hasNext(); idx++) {
            byte[] v = it.next();
            if (idx >= start) result.add(v);
        }
        return result;
    }

    @Override
    public Iterator<byte[]> iterator() {
        return items.iterator();
    }
}
