package cinder.commands.hash;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.structs.CinderHash;

public class HGetCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        ByteString field = Args.key(command, 1);
        return db.withKey(key, ks -> {
            CinderHash hash = ks.getHash(key);
            return Reply.bulk(hash == null ? null : hash.get(field));
        });
    }
}
