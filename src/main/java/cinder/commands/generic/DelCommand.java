package cinder.commands.generic;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;

import java.util.List;

public class DelCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        List<ByteString> keys = Args.keys(command, 0, 1);
        return db.withKeys(keys, ks -> {
            int removed = 0;
            for (ByteString key : keys) {
                if (ks.remove(key)) removed++;
            }
            return Reply.integer(removed);
        });
    }
}
