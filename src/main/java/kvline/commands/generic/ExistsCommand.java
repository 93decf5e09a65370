package kvline.commands.generic;

import kvline.commands.Command;
import kvline.db.KvStore;
import kvline.protocol.Reply;
import java.util.List;

public class ExistsCommand implements Command {
    @Override
    public Reply execute(KvStore store, List<String> args) {
        return Reply.integer(store.exists(args.toArray(new String[0])));
    }
}
