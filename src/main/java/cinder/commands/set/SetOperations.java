package cinder.commands.set;

import cinder.commands.Args;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.structs.CinderSet;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Helpers for the multi-key set algebra commands.
 */
final class SetOperations {
    private SetOperations() { }

    /**
     * Locks every key, resolves them all (absent keys as null, wrong types fail before any
     * computation) and applies the operation.
     */
    static Reply combine(Database db, Command command, Function<List<CinderSet>, Set<ByteString>> operation) {
        List<ByteString> keys = Args.keys(command, 0, 1);
        return db.withKeys(keys, ks -> {
            List<CinderSet> sets = new ArrayList<>(keys.size());
            for (ByteString key : keys) {
                sets.add(ks.getSet(key));
            }
            return toReply(operation.apply(sets));
        });
    }

    static Reply toReply(Collection<ByteString> members) {
        List<byte[]> out = new ArrayList<>(members.size());
        for (ByteString m : members) {
            out.add(m.toByteArray());
        }
        return Reply.bulkArray(out);
    }
}
