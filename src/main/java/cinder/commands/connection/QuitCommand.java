package cinder.commands.connection;

import cinder.commands.CommandHandler;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;

/**
 * Replies OK. The connection layer closes the channel once the reply is flushed.
 */
public class QuitCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        return Reply.ok();
    }
}
