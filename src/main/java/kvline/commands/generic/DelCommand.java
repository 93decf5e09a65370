package kvline.commands.generic;

import kvline.commands.Command;
import kvline.db.KvStore;
import kvline.protocol.Reply;
import java.util.List;

public class DelCommand implements Command {
    @Override
    public Reply execute(KvStore store, List<String> args) {
        return Reply.integer(store.delete(args.toArray(new String[0])));
    }
}
