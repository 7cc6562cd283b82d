package cinder.commands.string;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.db.ValueEntry;
import cinder.protocol.Command;
import cinder.protocol.Reply;

import java.util.List;

public class MSetCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        if (command.argCount() % 2 != 0) throw Args.wrongArity(command.getName());
        List<ByteString> keys = Args.keys(command, 0, 2);
        return db.withKeys(keys, ks -> {
            for (int i = 0; i < keys.size(); i++) {
                ks.put(keys.get(i), ValueEntry.string(command.arg(i * 2 + 1)));
            }
            return Reply.ok();
        });
    }
}
