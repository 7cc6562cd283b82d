package cinder.commands.string;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.db.ValueEntry;
import cinder.protocol.Command;
import cinder.protocol.Reply;

public class AppendCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        byte[] suffix = command.arg(1);
        return db.withKey(key, ks -> {
            ValueEntry entry = ks.get(key);
            if (entry == null) {
                ks.put(key, ValueEntry.string(suffix));
                return Reply.integer(suffix.length);
            }
            byte[] current = entry.asString();
            byte[] joined = new byte[current.length + suffix.length];
            System.arraycopy(current, 0, joined, 0, current.length);
            System.arraycopy(suffix, 0, joined, current.length, suffix.length);
            ks.put(key, ValueEntry.string(joined, entry.getExpireAt()));
            return Reply.integer(joined.length);
        });
    }
}
