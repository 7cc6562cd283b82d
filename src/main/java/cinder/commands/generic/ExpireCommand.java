package cinder.commands.generic;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;

import java.util.Locale;

/**
 * EXPIRE key seconds / PEXPIRE key milliseconds. A non-positive timeout deletes the key.
 */
public class ExpireCommand implements CommandHandler {
    private final boolean millis;

    public ExpireCommand(boolean millis) {
        this.millis = millis;
    }

    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        long amount = Args.parseLong(command.arg(1));
        String name = command.getName().toLowerCase(Locale.ROOT);
        return db.withKey(key, ks -> {
            long expireAt = Args.expireAt(ks.now(), amount, millis, false, name);
            if (!ks.exists(key)) return Reply.integer(0);
            if (expireAt <= ks.now()) {
                ks.remove(key);
            } else {
                ks.setExpireAt(key, expireAt);
            }
            return Reply.integer(1);
        });
    }
}
