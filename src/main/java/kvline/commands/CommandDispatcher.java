package kvline.commands;

import kvline.db.KvStore;
import kvline.db.StoreException;
import kvline.protocol.Reply;
import kvline.utils.Log;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Routes a parsed command line to its handler.
 *
 * <p>Order of checks: unknown name, then arity, then execution. Failures never
 * propagate to the caller, they come back as error replies.
 */
public class CommandDispatcher {
    public static final String ERR_UNKNOWN = "unknown command '%s'";
    public static final String ERR_ARITY = "missing arguments for '%s'";
    public static final String ERR_INTERNAL = "internal error";

    private final KvStore store;

    public CommandDispatcher(KvStore store) {
        this.store = store;
    }

    public KvStore getStore() {
        return store;
    }

    public Reply handleCommand(String command, List<String> args) {
        String name = command.toUpperCase(Locale.ROOT);
        CommandContainer container = CommandRegistry.get(name);
        if (container == null) {
            return Reply.error(String.format(ERR_UNKNOWN, name));
        }
        if (args.size() < container.getMetadata().getArity()) {
            return Reply.error(String.format(ERR_ARITY, name));
        }

        try {
            return container.getCommand().execute(store, args);
        } catch (StoreException e) {
            return Reply.error(e.getMessage());
        } catch (RuntimeException e) {
            Log.error("Command " + name + " failed: " + e);
            return Reply.error(ERR_INTERNAL);
        }
    }

    public Reply handleCommand(String command, String... args) {
        return handleCommand(command, Arrays.asList(args));
    }
}
