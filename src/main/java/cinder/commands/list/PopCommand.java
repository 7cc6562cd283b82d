package cinder.commands.list;

import cinder.commands.Args;
import cinder.commands.CommandException;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.structs.CinderList;

import java.util.ArrayList;
import java.util.List;

/**
 * Common body of LPOP and RPOP. Without a count the reply is a single bulk string,
 * with a count it is an array (nil when the key does not exist).
 */
abstract class PopCommand implements CommandHandler {

    abstract byte[] pop(CinderList list);

    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        boolean withCount = command.argCount() > 1;
        long count = 1;
        if (withCount) {
            count = Args.parseLong(command.arg(1));
            if (count < 0) throw new CommandException("value is out of range, must be positive");
        }
        final long n = count;

        return db.withKey(key, ks -> {
            CinderList list = ks.getList(key);
            if (list == null) return withCount ? Reply.nullArray() : Reply.nullBulk();
            if (!withCount) {
                byte[] value = pop(list);
                ks.removeIfEmpty(key);
                return Reply.bulk(value);
            }
            List<byte[]> popped = new ArrayList<>();
            while (popped.size() < n && list.size() > 0) {
                popped.add(pop(list));
            }
            ks.removeIfEmpty(key);
            return Reply.bulkArray(popped);
        });
    }
}
