package cinder.commands.string;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;

public class IncrCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        return Counters.incrBy(db, Args.key(command, 0), 1);
    }
}
