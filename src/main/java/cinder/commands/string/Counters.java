package cinder.commands.string;

import cinder.commands.Args;
import cinder.commands.CommandException;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.db.ValueEntry;
import cinder.protocol.Reply;

/**
 * Shared body of INCR, DECR, INCRBY and DECRBY.
 */
final class Counters {
    private Counters() { }

    static Reply incrBy(Database db, ByteString key, long delta) {
        return db.withKey(key, ks -> {
            ValueEntry entry = ks.get(key);
            long current = entry == null ? 0 : Args.parseLong(entry.asString());
            long next;
            try {
                next = Math.addExact(current, delta);
            } catch (ArithmeticException e) {
                throw new CommandException("increment or decrement would overflow");
            }
            long expireAt = entry == null ? ValueEntry.NO_EXPIRY : entry.getExpireAt();
            ks.put(key, ValueEntry.string(Args.bytes(next), expireAt));
            return Reply.integer(next);
        });
    }

    static long negate(long delta) {
        if (delta == Long.MIN_VALUE) throw new CommandException("decrement would overflow");
        return -delta;
    }
}
