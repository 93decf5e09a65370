package kvline.commands.list;

import kvline.commands.Command;
import kvline.db.KvStore;
import kvline.protocol.Reply;
import java.util.List;

public class LPopCommand implements Command {
    @Override
    public Reply execute(KvStore store, List<String> args) {
        return Reply.bulkString(store.lpop(args.get(0)));
    }
}
