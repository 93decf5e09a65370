package kvline.commands.server;

import kvline.commands.Command;
import kvline.db.KvStore;
import kvline.protocol.Reply;
import java.util.List;

public class FlushAllCommand implements Command {
    @Override
    public Reply execute(KvStore store, List<String> args) {
        store.flushAll();
        return Reply.ok();
    }
}
