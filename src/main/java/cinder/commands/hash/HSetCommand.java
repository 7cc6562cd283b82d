package cinder.commands.hash;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.structs.CinderHash;

/**
 * HSET key field value [field value ...]. Replies with the number of fields that were new.
 */
public class HSetCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        if (command.argCount() % 2 != 1) throw Args.wrongArity(command.getName());
        ByteString key = Args.key(command, 0);
        return db.withKey(key, ks -> {
            CinderHash hash = ks.getOrCreateHash(key);
            int added = 0;
            for (int i = 1; i < command.argCount(); i += 2) {
                if (hash.put(Args.key(command, i), command.arg(i + 1))) added++;
            }
            return Reply.integer(added);
        });
    }
}
