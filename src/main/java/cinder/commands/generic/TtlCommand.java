package cinder.commands.generic;

import cinder.db.ValueEntry;
import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;

/**
 * TTL / PTTL: -2 for a missing key, -1 for a key without expiry, otherwise the time left.
 */
public class TtlCommand implements CommandHandler {
    private final boolean millis;

    public TtlCommand(boolean millis) {
        this.millis = millis;
    }

    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        return db.withKey(key, ks -> {
            ValueEntry entry = ks.get(key);
            if (entry == null) return Reply.integer(-2);
            if (!entry.hasExpiry()) return Reply.integer(-1);
            long remaining = Math.max(0, entry.getExpireAt() - ks.now());
            return Reply.integer(millis ? remaining : (remaining + 500) / 1000);
        });
    }
}
