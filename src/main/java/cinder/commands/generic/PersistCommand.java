package cinder.commands.generic;

import cinder.db.ValueEntry;
import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;

public class PersistCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        return db.withKey(key, ks -> {
            ValueEntry entry = ks.get(key);
            if (entry == null || !entry.hasExpiry()) return Reply.integer(0);
            ks.setExpireAt(key, ValueEntry.NO_EXPIRY);
            return Reply.integer(1);
        });
    }
}
