package cinder.commands.generic;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.commands.SyntaxException;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;

/**
 * FLUSHDB [ASYNC|SYNC]. Both modes clear synchronously.
 */
public class FlushDbCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        if (command.argCount() == 1) {
            String mode = Args.upper(command.arg(0));
            if (!mode.equals("ASYNC") && !mode.equals("SYNC")) throw new SyntaxException();
        }
        db.clear();
        return Reply.ok();
    }
}
