package kvline.commands;

import kvline.db.KvStore;
import kvline.protocol.Reply;
import java.util.List;

public interface Command {
    // Runs the command against the store and returns its reply.
    // args holds the arguments after the command name; the dispatcher has already checked arity.
    Reply execute(KvStore store, List<String> args);
}
