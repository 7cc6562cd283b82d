package cinder.commands.set;

import cinder.commands.CommandHandler;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.structs.CinderSet;

public class SInterCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        return SetOperations.combine(db, command, CinderSet::intersect);
    }
}
