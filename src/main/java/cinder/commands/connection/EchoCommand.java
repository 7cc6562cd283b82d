package cinder.commands.connection;

import cinder.commands.CommandHandler;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;

public class EchoCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        return Reply.bulk(command.arg(0));
    }
}
