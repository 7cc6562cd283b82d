package cinder.commands.zset;

import cinder.commands.SyntaxException;
import cinder.structs.ZNode;
import cinder.commands.Args;
import cinder.commands.CommandHandler;
import cinder.db.ByteString;
import cinder.db.Database;
import cinder.protocol.Command;
import cinder.protocol.Reply;
import cinder.structs.CinderZSet;

import java.util.ArrayList;
import java.util.List;

/**
 * ZRANGE key start stop [WITHSCORES], by rank in (score, member) order.
 */
public class ZRangeCommand implements CommandHandler {
    @Override
    public Reply execute(Database db, Command command) {
        ByteString key = Args.key(command, 0);
        long start = Args.parseLong(command.arg(1));
        long stop = Args.parseLong(command.arg(2));
        boolean withScores = false;
        if (command.argCount() == 4) {
            if (!Args.upper(command.arg(3)).equals("WITHSCORES")) throw new SyntaxException();
            withScores = true;
        }
        final boolean scores = withScores;

        return db.withKey(key, ks -> {
            CinderZSet zset = ks.getZSet(key);
            if (zset == null) return Reply.emptyArray();
            List<ZNode> nodes = zset.rangeByRank(start, stop);
            List<byte[]> out = new ArrayList<>(scores ? nodes.size() * 2 : nodes.size());
            for (ZNode node : nodes) {
                out.add(node.member.toByteArray());
                if (scores) out.add(Args.bytes(Args.formatDouble(node.score)));
            }
            return Reply.bulkArray(out);
        });
    }
}
