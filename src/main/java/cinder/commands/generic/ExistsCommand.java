package cinder.commands.generic;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;

import java.util.List;

/**
 * Counts how many of the given keys exist. A key named twice is counted twice.
 */
public class ExistsCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        List<ByteString> keys = Args.keys(command, 0, 1);
        return db.withKeys(keys, ks -> {
            int found = 0;
            for (ByteString key : keys) {
                if (ks.exists(key)) found++;
            }
            return Reply.integer(found);
        });
    }
}
