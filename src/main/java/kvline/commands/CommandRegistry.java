package kvline.commands;

import kvline.commands.connection.*;
import kvline.commands.generic.*;
import kvline.commands.list.*;
import kvline.commands.server.*;
import kvline.commands.set.*;
import kvline.commands.string.*;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Static table from upper-case command name to its handler and metadata.
 * Built once when the class loads and never modified afterwards.
 */
public final class CommandRegistry {
    private static final Map<String, CommandContainer> commands;

    static {
        Map<String, CommandContainer> m = new HashMap<>();

        // String
        register(m, "SET", new SetCommand(), 2, CommandMetadata.FLAG_WRITE);
        register(m, "GET", new GetCommand(), 1, CommandMetadata.FLAG_READONLY);
        register(m, "INCR", new IncrCommand(), 1, CommandMetadata.FLAG_WRITE);
        register(m, "DECR", new DecrCommand(), 1, CommandMetadata.FLAG_WRITE);
        register(m, "INCRBY", new IncrByCommand(), 2, CommandMetadata.FLAG_WRITE);
        register(m, "DECRBY", new DecrByCommand(), 2, CommandMetadata.FLAG_WRITE);

        // List
        register(m, "LPUSH", new LPushCommand(), 1, CommandMetadata.FLAG_WRITE);
        register(m, "RPUSH", new RPushCommand(), 1, CommandMetadata.FLAG_WRITE);
        register(m, "LPOP", new LPopCommand(), 1, CommandMetadata.FLAG_WRITE);
        register(m, "RPOP", new RPopCommand(), 1, CommandMetadata.FLAG_WRITE);
        register(m, "LRANGE", new LRangeCommand(), 3, CommandMetadata.FLAG_READONLY);
        register(m, "LLEN", new LLenCommand(), 1, CommandMetadata.FLAG_READONLY);

        // Set
        register(m, "SADD", new SAddCommand(), 1, CommandMetadata.FLAG_WRITE);
        register(m, "SREM", new SRemCommand(), 1, CommandMetadata.FLAG_WRITE);
        register(m, "SISMEMBER", new SIsMemberCommand(), 2, CommandMetadata.FLAG_READONLY);
        register(m, "SMEMBERS", new SMembersCommand(), 1, CommandMetadata.FLAG_READONLY);
        register(m, "SCARD", new SCardCommand(), 1, CommandMetadata.FLAG_READONLY);

        // Generic
        register(m, "DEL", new DelCommand(), 1, CommandMetadata.FLAG_WRITE);
        register(m, "EXISTS", new ExistsCommand(), 1, CommandMetadata.FLAG_READONLY);
        register(m, "TYPE", new TypeCommand(), 1, CommandMetadata.FLAG_READONLY);

        // Server
        register(m, "DBSIZE", new DbSizeCommand(), 0, CommandMetadata.FLAG_READONLY);
        register(m, "FLUSHALL", new FlushAllCommand(), 0, CommandMetadata.FLAG_WRITE);

        // Connection
        register(m, "PING", new PingCommand(), 0);
        register(m, "ECHO", new EchoCommand(), 1);
        register(m, "QUIT", new QuitCommand(), 0);

        commands = Collections.unmodifiableMap(m);
    }

    private CommandRegistry() {
    }

    private static void register(Map<String, CommandContainer> m, String name, Command command, int arity, String... flags) {
        Set<String> flagSet = new TreeSet<>();
        Collections.addAll(flagSet, flags);
        m.put(name, new CommandContainer(name, command, new CommandMetadata(arity, flagSet)));
    }

    /** Looks up an already upper-cased name. Returns null for unknown commands. */
    public static CommandContainer get(String name) {
        return commands.get(name);
    }

    public static Set<String> names() {
        return new TreeSet<>(commands.keySet());
    }
}
