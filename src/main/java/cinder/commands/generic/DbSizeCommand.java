package cinder.commands.generic;

import cinder.commands.CommandHandler;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;

public class DbSizeCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        return Reply.integer(db.size());
    }
}
