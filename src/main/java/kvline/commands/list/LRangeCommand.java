package kvline.commands.list;

import kvline.commands.Args;
import kvline.commands.Command;
import kvline.db.KvStore;
import kvline.protocol.Reply;
import java.util.List;

public class LRangeCommand implements Command {
    @Override
    public Reply execute(KvStore store, List<String> args) {
        long start = Args.parseLong(args.get(1));
        long end = Args.parseLong(args.get(2));
        // null (missing key) renders as (nil), an empty range as (empty list or set)
        return Reply.array(store.lrange(args.get(0), start, end));
    }
}
