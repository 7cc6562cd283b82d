package cinder.commands.hash;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.structs.CinderHash;

public class HLenCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        return db.withKey(key, ks -> {
            CinderHash hash = ks.getHash(key);
            return Reply.integer(hash == null ? 0 : hash.size());
        });
    }
}
