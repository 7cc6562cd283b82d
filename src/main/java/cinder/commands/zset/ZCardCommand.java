package cinder.commands.zset;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.structs.CinderZSet;

public class ZCardCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        return db.withKey(key, ks -> {
            CinderZSet zset = ks.getZSet(key);
            return Reply.integer(zset == null ? 0 : zset.size());
        });
    }
}
