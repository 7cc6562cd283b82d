package cinder.commands.set;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.structs.CinderSet;

public class SIsMemberCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        ByteString member = Args.key(command, 1);
        return db.withKey(key, ks -> {
            CinderSet set = ks.getSet(key);
            return Reply.integer(set != null && set.contains(member) ? 1 : 0);
        });
    }
}
