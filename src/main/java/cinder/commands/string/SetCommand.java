package cinder.commands.string;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.commands.SyntaxException;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.db.ValueEntry;
import cinder.protocol.Command;
import cinder.protocol.Reply;

/**
 * SET key value [NX|XX] [GET] [EX seconds|PX milliseconds|EXAT unix-seconds|PXAT unix-milliseconds|KEEPTTL]
 */
public class SetCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        byte[] value = command.arg(1);

        boolean nx = false;
        boolean xx = false;
        boolean get = false;
        boolean keepTtl = false;
        String expireOption = null;
        long expireAmount = 0;

        for (int i = 2; i < command.argCount(); i++) {
            String opt = Args.upper(command.arg(i));
            switch (opt) {
                case "NX":
                    if (xx) throw new SyntaxException();
                    nx = true;
                    break;
                case "XX":
                    if (nx) throw new SyntaxException();
                    xx = true;
                    break;
                case "GET":
                    get = true;
                    break;
                case "KEEPTTL":
                    if (expireOption != null) throw new SyntaxException();
                    keepTtl = true;
                    break;
                case "EX":
                case "PX":
                case "EXAT":
                case "PXAT":
                    if (expireOption != null || keepTtl || i + 1 >= command.argCount()) throw new SyntaxException();
                    expireOption = opt;
                    expireAmount = Args.parseLong(command.arg(++i));
                    if (expireAmount <= 0) throw Args.invalidExpire("set");
                    break;
                default:
                    throw new SyntaxException();
            }
        }

        final boolean onlyIfAbsent = nx;
        final boolean onlyIfPresent = xx;
        final boolean returnOld = get;
        final boolean keep = keepTtl;
        final String unit = expireOption;
        final long amount = expireAmount;

        return db.withKey(key, ks -> {
            long expireAt = ValueEntry.NO_EXPIRY;
            if (unit != null) {
                boolean millis = unit.startsWith("P");
                boolean absolute = unit.endsWith("AT");
                expireAt = Args.expireAt(ks.now(), amount, millis, absolute, "set");
            }

            ValueEntry existing = ks.get(key);
            byte[] old = returnOld && existing != null ? existing.asString() : null;
            if ((onlyIfAbsent && existing != null) || (onlyIfPresent && existing == null)) {
                return returnOld ? Reply.bulk(old) : Reply.nullBulk();
            }
            if (keep && existing != null) {
                expireAt = existing.getExpireAt();
            }

            if (expireAt != ValueEntry.NO_EXPIRY && expireAt <= ks.now()) {
                ks.remove(key);
            } else {
                ks.put(key, ValueEntry.string(value, expireAt));
            }
            return returnOld ? Reply.bulk(old) : Reply.ok();
        });
    }
}
