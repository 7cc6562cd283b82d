package cinder.commands.list;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.structs.CinderList;

public class LRangeCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        long start = Args.parseLong(command.arg(1));
        long stop = Args.parseLong(command.arg(2));
        return db.withKey(key, ks -> {
            CinderList list = ks.getList(key);
            if (list == null) return Reply.emptyArray();
            return Reply.bulkArray(list.range(start, stop));
        });
    }
}
