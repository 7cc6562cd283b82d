package cinder.commands.set;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.structs.CinderSet;

public class SAddCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        return db.withKey(key, ks -> {
            CinderSet set = ks.getOrCreateSet(key);
            int added = 0;
            for (int i = 1; i < command.argCount(); i++) {
                if (set.add(Args.key(command, i))) added++;
            }
            return Reply.integer(added);
        });
    }
}
