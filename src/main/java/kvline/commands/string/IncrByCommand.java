package kvline.commands.string;

import kvline.commands.Args;
import kvline.commands.Command;
import kvline.db.KvStore;
import kvline.protocol.Reply;
import java.util.List;

public class IncrByCommand implements Command {
    @Override
    public Reply execute(KvStore store, List<String> args) {
        long incr = Args.parseLong(args.get(1));
        return Reply.integer(store.incrBy(args.get(0), incr));
    }
}
