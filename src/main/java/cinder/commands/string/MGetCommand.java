package cinder.commands.string;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.DataType;
import cinder.db.Database;
import cinder.db.ValueEntry;
import cinder.protocol.Command;
import cinder.protocol.Reply;

import java.util.ArrayList;
import java.util.List;

/**
 * MGET key [key ...]. Keys holding other types read as nil.
 */
public class MGetCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        List<ByteString> keys = Args.keys(command, 0, 1);
        return db.withKeys(keys, ks -> {
            List<Reply> values = new ArrayList<>(keys.size());
            for (ByteString key : keys) {
                ValueEntry entry = ks.get(key);
                values.add(entry != null && entry.getType() == DataType.STRING
                        ? Reply.bulk(entry.asString()) : Reply.nullBulk());
            }
            return Reply.array(values);
        });
    }
}
