package cinder.commands.zset;

import cinder.commands.CommandException;
import cinder.commands.SyntaxException;
import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.structs.CinderZSet;

/**
 * ZADD key [NX|XX] [CH] score member [score member ...]
 */
public class ZAddCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        boolean nx = false;
        boolean xx = false;
        boolean ch = false;

        int i = 1;
        for (; i < command.argCount(); i++) {
            String opt = Args.upper(command.arg(i));
            if (opt.equals("NX")) nx = true;
            else if (opt.equals("XX")) xx = true;
            else if (opt.equals("CH")) ch = true;
            else break;
        }
        if (nx && xx) throw new CommandException("XX and NX options at the same time are not compatible");
        int pairs = command.argCount() - i;
        if (pairs == 0 || pairs % 2 != 0) throw new SyntaxException();

        double[] scores = new double[pairs / 2];
        ByteString[] members = new ByteString[pairs / 2];
        for (int p = 0; p < scores.length; p++) {
            scores[p] = Args.parseDouble(command.arg(i + p * 2));
            members[p] = Args.key(command, i + p * 2 + 1);
        }

        final boolean onlyNew = nx;
        final boolean onlyExisting = xx;
        final boolean countChanged = ch;
        return db.withKey(key, ks -> {
            CinderZSet zset = onlyExisting ? ks.getZSet(key) : ks.getOrCreateZSet(key);
            if (zset == null) return Reply.integer(0);
            int added = 0;
            int changed = 0;
            for (int p = 0; p < scores.length; p++) {
                Double old = zset.score(members[p]);
                if (old == null) {
                    if (onlyExisting) continue;
                    zset.add(scores[p], members[p]);
                    added++;
                } else {
                    if (onlyNew) continue;
                    if (old != scores[p]) {
                        zset.add(scores[p], members[p]);
                        changed++;
                    }
                }
            }
            ks.removeIfEmpty(key);
            return Reply.integer(countChanged ? added + changed : added);
        });
    }
}
