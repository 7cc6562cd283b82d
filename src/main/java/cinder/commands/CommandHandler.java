package cinder.commands;

import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;

/**
 * Implementation of one verb. Handlers hold no state of their own; everything they read or
 * change lives in the {@link Database}. Argument problems are reported by throwing a
 * {@link CommandException}.
 */
public interface CommandHandler {
    Reply execute(Database db, Command command);
}
