package cinder.commands.connection;

import cinder.commands.CommandHandler;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;

public class PingCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        if (command.argCount() == 0) return Reply.pong();
        return Reply.bulk(command.arg(0));
    }
}
