package kvline.commands.list;

import kvline.commands.Args;
import kvline.commands.Command;
import kvline.db.KvStore;
import kvline.protocol.Reply;
import java.util.List;

public class RPushCommand implements Command {
    @Override
    public Reply execute(KvStore store, List<String> args) {
        return Reply.integer(store.rpush(args.get(0), Args.tail(args, 1)));
    }
}
