package cinder.commands.hash;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.structs.CinderHash;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Field/value pairs flattened into one array, in insertion order.
 */
public class HGetAllCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        return db.withKey(key, ks -> {
            CinderHash hash = ks.getHash(key);
            if (hash == null) return Reply.emptyArray();
            List<byte[]> flat = new ArrayList<>(hash.size() * 2);
            for (Map.Entry<ByteString, byte[]> e : hash.entrySet()) {
                flat.add(e.getKey().toByteArray());
                flat.add(e.getValue());
            }
            return Reply.bulkArray(flat);
        });
    }
}
