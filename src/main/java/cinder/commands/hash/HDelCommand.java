package cinder.commands.hash;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.structs.CinderHash;

public class HDelCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        return db.withKey(key, ks -> {
            CinderHash hash = ks.getHash(key);
            if (hash == null) return Reply.integer(0);
            int removed = 0;
            for (int i = 1; i < command.argCount(); i++) {
                if (hash.remove(Args.key(command, i))) removed++;
            }
            ks.removeIfEmpty(key);
            return Reply.integer(removed);
        });
    }
}
