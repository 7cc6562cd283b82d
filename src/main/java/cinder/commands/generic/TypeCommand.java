package cinder.commands.generic;

import cinder.db.ValueEntry;
import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;

public class TypeCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        return db.withKey(key, ks -> {
            ValueEntry entry = ks.get(key);
            return Reply.status(entry == null ? "none" : entry.getType().typeName());
        });
    }
}
