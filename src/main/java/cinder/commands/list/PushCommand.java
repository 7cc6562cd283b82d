package cinder.commands.list;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.structs.CinderList;

/**
 * Common body of LPUSH and RPUSH: values are pushed one at a time in argument order.
 */
abstract class PushCommand implements CommandHandler {

    abstract int push(CinderList list, byte[] value);

    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        return db.withKey(key, ks -> {
            CinderList list = ks.getOrCreateList(key);
            int size = list.size();
            for (int i = 1; i < command.argCount(); i++) {
                size = push(list, command.arg(i));
            }
            return Reply.integer(size);
        });
    }
}
