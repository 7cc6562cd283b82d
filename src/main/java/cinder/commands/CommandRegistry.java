package cinder.commands;

import cinder.commands.connection.EchoCommand;
import cinder.commands.connection.PingCommand;
import cinder.commands.connection.QuitCommand;
import cinder.commands.generic.DbSizeCommand;
import cinder.commands.generic.DelCommand;
import cinder.commands.generic.ExistsCommand;
import cinder.commands.generic.ExpireCommand;
import cinder.commands.generic.FlushDbCommand;
import cinder.commands.generic.PersistCommand;
import cinder.commands.generic.TtlCommand;
import cinder.commands.generic.TypeCommand;
import cinder.commands.hash.HDelCommand;
import cinder.commands.hash.HExistsCommand;
import cinder.commands.hash.HGetAllCommand;
import cinder.commands.hash.HGetCommand;
import cinder.commands.hash.HLenCommand;
import cinder.commands.hash.HSetCommand;
import cinder.commands.list.LLenCommand;
import cinder.commands.list.LPopCommand;
import cinder.commands.list.LPushCommand;
import cinder.commands.list.LRangeCommand;
import cinder.commands.list.RPopCommand;
import cinder.commands.list.RPushCommand;
import cinder.commands.set.SAddCommand;
import cinder.commands.set.SCardCommand;
import cinder.commands.set.SDiffCommand;
import cinder.commands.set.SInterCommand;
import cinder.commands.set.SIsMemberCommand;
import cinder.commands.set.SMembersCommand;
import cinder.commands.set.SRemCommand;
import cinder.commands.set.SUnionCommand;
import cinder.commands.string.AppendCommand;
import cinder.commands.string.DecrByCommand;
import cinder.commands.string.DecrCommand;
import cinder.commands.string.GetCommand;
import cinder.commands.string.IncrByCommand;
import cinder.commands.string.IncrCommand;
import cinder.commands.string.MGetCommand;
import cinder.commands.string.MSetCommand;
import cinder.commands.string.SetCommand;
import cinder.commands.string.StrLenCommand;
import cinder.commands.zset.ZAddCommand;
import cinder.commands.zset.ZCardCommand;
import cinder.commands.zset.ZRangeCommand;
import cinder.commands.zset.ZRankCommand;
import cinder.commands.zset.ZRemCommand;
import cinder.commands.zset.ZScoreCommand;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static cinder.commands.CommandMetadata.CLOSE;
import static cinder.commands.CommandMetadata.FAST;
import static cinder.commands.CommandMetadata.READONLY;
import static cinder.commands.CommandMetadata.WRITE;
import static cinder.commands.CommandMetadata.atLeast;
import static cinder.commands.CommandMetadata.between;
import static cinder.commands.CommandMetadata.exactly;

/**
 * The fixed verb table. Built once at class load and never modified.
 */
public final class CommandRegistry {
    private static final Map<String, CommandContainer> COMMANDS;

    static {
        Map<String, CommandContainer> m = new HashMap<>();

        // String
        register(m, "GET", new GetCommand(), exactly(2, READONLY, FAST));
        register(m, "SET", new SetCommand(), atLeast(3, WRITE));
        register(m, "APPEND", new AppendCommand(), exactly(3, WRITE, FAST));
        register(m, "INCR", new IncrCommand(), exactly(2, WRITE, FAST));
        register(m, "DECR", new DecrCommand(), exactly(2, WRITE, FAST));
        register(m, "INCRBY", new IncrByCommand(), exactly(3, WRITE, FAST));
        register(m, "DECRBY", new DecrByCommand(), exactly(3, WRITE, FAST));
        register(m, "STRLEN", new StrLenCommand(), exactly(2, READONLY, FAST));
        register(m, "MGET", new MGetCommand(), atLeast(2, READONLY, FAST));
        register(m, "MSET", new MSetCommand(), atLeast(3, WRITE));

        // List
        register(m, "LPUSH", new LPushCommand(), atLeast(3, WRITE, FAST));
        register(m, "RPUSH", new RPushCommand(), atLeast(3, WRITE, FAST));
        register(m, "LPOP", new LPopCommand(), between(2, 3, WRITE, FAST));
        register(m, "RPOP", new RPopCommand(), between(2, 3, WRITE, FAST));
        register(m, "LRANGE", new LRangeCommand(), exactly(4, READONLY));
        register(m, "LLEN", new LLenCommand(), exactly(2, READONLY, FAST));

        // Hash
        register(m, "HSET", new HSetCommand(), atLeast(4, WRITE, FAST));
        register(m, "HGET", new HGetCommand(), exactly(3, READONLY, FAST));
        register(m, "HDEL", new HDelCommand(), atLeast(3, WRITE, FAST));
        register(m, "HGETALL", new HGetAllCommand(), exactly(2, READONLY));
        register(m, "HLEN", new HLenCommand(), exactly(2, READONLY, FAST));
        register(m, "HEXISTS", new HExistsCommand(), exactly(3, READONLY, FAST));

        // Set
        register(m, "SADD", new SAddCommand(), atLeast(3, WRITE, FAST));
        register(m, "SREM", new SRemCommand(), atLeast(3, WRITE, FAST));
        register(m, "SMEMBERS", new SMembersCommand(), exactly(2, READONLY));
        register(m, "SISMEMBER", new SIsMemberCommand(), exactly(3, READONLY, FAST));
        register(m, "SCARD", new SCardCommand(), exactly(2, READONLY, FAST));
        register(m, "SINTER", new SInterCommand(), atLeast(2, READONLY));
        register(m, "SUNION", new SUnionCommand(), atLeast(2, READONLY));
        register(m, "SDIFF", new SDiffCommand(), atLeast(2, READONLY));

        // ZSet
        register(m, "ZADD", new ZAddCommand(), atLeast(4, WRITE, FAST));
        register(m, "ZRANGE", new ZRangeCommand(), between(4, 5, READONLY));
        register(m, "ZSCORE", new ZScoreCommand(), exactly(3, READONLY, FAST));
        register(m, "ZCARD", new ZCardCommand(), exactly(2, READONLY, FAST));
        register(m, "ZREM", new ZRemCommand(), atLeast(3, WRITE, FAST));
        register(m, "ZRANK", new ZRankCommand(), exactly(3, READONLY, FAST));

        // Keys
        register(m, "DEL", new DelCommand(), atLeast(2, WRITE));
        register(m, "EXISTS", new ExistsCommand(), atLeast(2, READONLY, FAST));
        register(m, "EXPIRE", new ExpireCommand(false), exactly(3, WRITE, FAST));
        register(m, "PEXPIRE", new ExpireCommand(true), exactly(3, WRITE, FAST));
        register(m, "TTL", new TtlCommand(false), exactly(2, READONLY, FAST));
        register(m, "PTTL", new TtlCommand(true), exactly(2, READONLY, FAST));
        register(m, "PERSIST", new PersistCommand(), exactly(2, WRITE, FAST));
        register(m, "TYPE", new TypeCommand(), exactly(2, READONLY, FAST));
        register(m, "DBSIZE", new DbSizeCommand(), exactly(1, READONLY));
        register(m, "FLUSHDB", new FlushDbCommand(), between(1, 2, WRITE));

        // Connection
        register(m, "PING", new PingCommand(), between(1, 2, FAST));
        register(m, "ECHO", new EchoCommand(), exactly(2, FAST));
        register(m, "QUIT", new QuitCommand(), atLeast(1, FAST, CLOSE));

        COMMANDS = Collections.unmodifiableMap(m);
    }

    private CommandRegistry() { }

    private static void register(Map<String, CommandContainer> m, String name, CommandHandler handler, CommandMetadata metadata) {
        m.put(name, new CommandContainer(name, handler, metadata));
    }

    /**
     * Looks up an upper-case verb; null when it is unknown.
     */
    public static CommandContainer get(String name) {
        return COMMANDS.get(name);
    }

    public static Set<String> names() {
        return COMMANDS.keySet();
    }
}
