package kvline.commands.string;

import kvline.commands.Args;
import kvline.commands.Command;
import kvline.db.KvStore;
import kvline.protocol.Reply;
import java.util.List;

public class DecrByCommand implements Command {
    @Override
    public Reply execute(KvStore store, List<String> args) {
        long decr = Args.parseLong(args.get(1));
        return Reply.integer(store.decrBy(args.get(0), decr));
    }
}
