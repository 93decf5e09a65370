package kvline.commands.connection;

import kvline.commands.Command;
import kvline.db.KvStore;
import kvline.protocol.Reply;
import java.util.List;

// The connection handler closes the channel once this reply is flushed.
public class QuitCommand implements Command {
    @Override
    public Reply execute(KvStore store, List<String> args) {
        return Reply.ok();
    }
}
