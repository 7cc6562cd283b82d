package cinder.commands.zset;

import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.structs.CinderZSet;

public class ZScoreCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        ByteString member = Args.key(command, 1);
        return db.withKey(key, ks -> {
            CinderZSet zset = ks.getZSet(key);
            Double score = zset == null ? null : zset.score(member);
            return score == null ? Reply.nullBulk() : Reply.bulk(Args.formatDouble(score));
        });
    }
}
